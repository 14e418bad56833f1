package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

/**
 * A variable declaration, either a port or a local.
 *
 * @param name The variable name.
 * @param direction The port direction, {@link VarDirection#NONE} for locals.
 * @param varType The storage class.
 * @param dataType The declared type.
 * @param source The declaration position.
 */
public record VarNode(
        String name,
        VarDirection direction,
        VarType varType,
        BasicDataType dataType,
        SourceInfo source
) implements AstNode, SourceLocatable {

    public boolean isIO() {
        return direction != VarDirection.NONE;
    }

    public boolean isInput() {
        return direction == VarDirection.INPUT;
    }

    public int width() {
        return dataType.width();
    }
}
