package org.hdlforge.compiler.frontend.ast;

import java.util.List;

/**
 * Root of a compilation unit: all modules and primitives of the design.
 *
 * @param units The top-level modules and primitives in source order.
 */
public record NetlistNode(List<AstNode> units) implements AstNode {

    public NetlistNode {
        units = List.copyOf(units);
    }

    @Override
    public List<AstNode> getChildren() {
        return units;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new NetlistNode(newChildren);
    }
}
