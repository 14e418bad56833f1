package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

import java.util.List;

/**
 * Logical equality {@code lhs == rhs}, one bit wide.
 *
 * @param lhs The left operand.
 * @param rhs The right operand.
 * @param source The position of the expression.
 */
public record EqNode(AstNode lhs, AstNode rhs, SourceInfo source) implements AstNode, SourceLocatable {

    @Override
    public List<AstNode> getChildren() {
        return List.of(lhs, rhs);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new EqNode(newChildren.get(0), newChildren.get(1), source);
    }
}
