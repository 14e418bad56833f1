package org.hdlforge.compiler.frontend.ast;

/**
 * Packed data type of a variable.
 *
 * @param kind The underlying kind.
 * @param width Number of bits, at least 1.
 * @param signed Whether arithmetic treats the value as signed.
 */
public record BasicDataType(BasicKind kind, int width, boolean signed) {

    public BasicDataType {
        if (width <= 0) {
            throw new IllegalArgumentException("Data type width must be positive, got: " + width);
        }
    }

    /**
     * An unsigned bit vector type, as produced for compiler temporaries.
     * @param width The width.
     * @return The type.
     */
    public static BasicDataType bits(int width) {
        return new BasicDataType(BasicKind.BIT, width, false);
    }

    public boolean isLogic() {
        return kind == BasicKind.LOGIC;
    }
}
