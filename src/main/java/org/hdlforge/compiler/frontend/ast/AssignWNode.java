package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

import java.util.List;

/**
 * A continuous assignment ({@code assign lhs = rhs;}), always active.
 *
 * @param lhs The driven variable, a write reference.
 * @param rhs The driving expression.
 * @param source The position of the assignment.
 */
public record AssignWNode(VarRefNode lhs, AstNode rhs, SourceInfo source) implements AstNode, SourceLocatable {

    @Override
    public List<AstNode> getChildren() {
        return List.of(lhs, rhs);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new AssignWNode((VarRefNode) newChildren.get(0), newChildren.get(1), source);
    }
}
