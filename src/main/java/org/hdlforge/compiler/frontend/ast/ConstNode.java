package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;
import org.hdlforge.compiler.model.BitVector;

/**
 * A sized constant.
 *
 * @param value The value. The node keeps its own copy and hands out copies.
 * @param source The position the constant was derived from.
 */
public record ConstNode(BitVector value, SourceInfo source) implements AstNode, SourceLocatable {

    public ConstNode {
        value = value.copy();
    }

    @Override
    public BitVector value() {
        return value.copy();
    }
}
