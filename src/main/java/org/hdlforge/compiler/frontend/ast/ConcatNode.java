package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

import java.util.List;

/**
 * Concatenation {@code {high, low}}; {@code low} occupies the least significant bits.
 *
 * @param high The most significant operand.
 * @param low The least significant operand.
 * @param source The position of the expression.
 */
public record ConcatNode(AstNode high, AstNode low, SourceInfo source) implements AstNode, SourceLocatable {

    @Override
    public List<AstNode> getChildren() {
        return List.of(high, low);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new ConcatNode(newChildren.get(0), newChildren.get(1), source);
    }
}
