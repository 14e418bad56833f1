package org.hdlforge.compiler.model;

/**
 * A single four-state logic value. High impedance is folded into {@link #X}
 * since nothing in the lowered logic drives or resolves tri-state nets.
 */
public enum Bit {
    ZERO('0'),
    ONE('1'),
    X('x');

    private final char symbol;

    Bit(char symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The character used in Verilog literals.
     */
    public char symbol() {
        return symbol;
    }

    public boolean isKnown() {
        return this != X;
    }

    /**
     * @param value 0 or 1.
     * @return The matching known bit.
     */
    public static Bit of(boolean value) {
        return value ? ONE : ZERO;
    }
}
