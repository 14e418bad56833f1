package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

import java.util.List;

/**
 * A blocking procedural assignment inside a process.
 *
 * @param lhs The assigned variable, a write reference.
 * @param rhs The assigned expression.
 * @param source The position of the assignment.
 */
public record AssignNode(VarRefNode lhs, AstNode rhs, SourceInfo source) implements AstNode, SourceLocatable {

    @Override
    public List<AstNode> getChildren() {
        return List.of(lhs, rhs);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new AssignNode((VarRefNode) newChildren.get(0), newChildren.get(1), source);
    }
}
