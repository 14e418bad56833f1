package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

import java.util.List;

/**
 * A regular module. Its items are variables and statements.
 *
 * @param name The module name.
 * @param items The declarations and statements in source order.
 * @param source The position of the module header.
 */
public record ModuleNode(String name, List<AstNode> items, SourceInfo source) implements AstNode, SourceLocatable {

    public ModuleNode {
        items = List.copyOf(items);
    }

    @Override
    public List<AstNode> getChildren() {
        return items;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new ModuleNode(name, newChildren, source);
    }
}
