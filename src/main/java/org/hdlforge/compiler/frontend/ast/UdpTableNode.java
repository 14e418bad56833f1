package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

import java.util.List;

/**
 * The {@code table ... endtable} block of a primitive.
 *
 * @param lines The table lines in declaration order. Order is match priority.
 * @param source The position of the {@code table} keyword.
 */
public record UdpTableNode(List<UdpTableLineNode> lines, SourceInfo source) implements AstNode, SourceLocatable {

    public UdpTableNode {
        lines = List.copyOf(lines);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(lines);
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new UdpTableNode(newChildren.stream().map(UdpTableLineNode.class::cast).toList(), source);
    }
}
