package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

import java.util.List;

/**
 * A user-defined primitive ({@code primitive ... endprimitive}).
 * Before lowering its items are the port declarations, optional locals and a
 * {@link UdpTableNode}; afterwards the table is replaced by procedural logic.
 *
 * @param name The primitive name.
 * @param items The declarations and statements in source order.
 * @param source The position of the primitive header.
 */
public record PrimitiveNode(String name, List<AstNode> items, SourceInfo source) implements AstNode, SourceLocatable {

    public PrimitiveNode {
        items = List.copyOf(items);
    }

    @Override
    public List<AstNode> getChildren() {
        return items;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new PrimitiveNode(name, newChildren, source);
    }
}
