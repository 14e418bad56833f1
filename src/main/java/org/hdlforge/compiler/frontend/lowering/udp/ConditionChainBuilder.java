package org.hdlforge.compiler.frontend.lowering.udp;

import org.hdlforge.compiler.frontend.ast.AstNode;
import org.hdlforge.compiler.frontend.ast.IfNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Threads line conditionals into an if / else-if chain in the order they are appended.
 * The first appended conditional is tested first; the chain ends without a final else,
 * so nothing is assigned when no line matches.
 */
public class ConditionChainBuilder {

    private final List<IfNode> links = new ArrayList<>();

    /**
     * Adds a conditional as the else branch of the current tail.
     * @param link A conditional without else branch.
     */
    public void append(IfNode link) {
        if (!link.elseStatements().isEmpty()) {
            throw new IllegalArgumentException("Chain links must not have an else branch");
        }
        links.add(link);
    }

    public int size() {
        return links.size();
    }

    /**
     * Builds the process body.
     * @return A single nested conditional, or an empty list when nothing was appended.
     */
    public List<AstNode> build() {
        IfNode chain = null;
        for (int i = links.size() - 1; i >= 0; i--) {
            IfNode link = links.get(i);
            chain = chain == null ? link : link.withElse(List.of(chain));
        }
        return chain == null ? List.of() : List.of(chain);
    }
}
