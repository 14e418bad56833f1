package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A procedural {@code if} with optional {@code else} branch.
 *
 * @param condition The tested expression.
 * @param thenStatements Statements executed when the condition is 1.
 * @param elseStatements Statements executed otherwise; empty when there is no else branch.
 * @param source The position of the statement.
 */
public record IfNode(
        AstNode condition,
        List<AstNode> thenStatements,
        List<AstNode> elseStatements,
        SourceInfo source
) implements AstNode, SourceLocatable {

    public IfNode {
        thenStatements = List.copyOf(thenStatements);
        elseStatements = List.copyOf(elseStatements);
    }

    /**
     * Returns a copy with the given else branch.
     * @param elseStatements The new else branch.
     * @return The new node.
     */
    public IfNode withElse(List<AstNode> elseStatements) {
        return new IfNode(condition, thenStatements, elseStatements, source);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.addAll(thenStatements);
        children.addAll(elseStatements);
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        int thenEnd = 1 + thenStatements.size();
        return new IfNode(
                newChildren.get(0),
                newChildren.subList(1, thenEnd),
                newChildren.subList(thenEnd, newChildren.size()),
                source);
    }
}
