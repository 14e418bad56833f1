package org.hdlforge.compiler.frontend.ast;

import java.util.List;

/**
 * Base interface of all nodes in the design tree.
 * <p>
 * Nodes are immutable. Passes rewrite the tree by building replacement nodes through
 * {@link #reconstructWithChildren(List)} rather than relinking existing ones.
 */
public interface AstNode {

    /**
     * Returns the direct children of this node in source order.
     * @return The children, empty for leaf nodes.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }

    /**
     * Creates a copy of this node with the given children.
     * The list must have the same shape as {@link #getChildren()} returned.
     * @param newChildren The replacement children.
     * @return The new node, or this node for leaves.
     */
    default AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return this;
    }
}
