package org.hdlforge.compiler.model;

/**
 * The value of one entry in a UDP table line. Every symbol other than
 * {@code 0} and {@code 1} (e.g. {@code ?}, {@code x}, {@code b}) matches any input.
 */
public enum UdpSymbol {
    ZERO,
    ONE,
    DONT_CARE;

    /**
     * Classifies a table entry by its first character.
     * @param text The entry as written in the table, may be empty.
     * @return The symbol.
     */
    public static UdpSymbol fromText(String text) {
        if (text == null || text.isEmpty()) {
            return DONT_CARE;
        }
        return switch (text.charAt(0)) {
            case '0' -> ZERO;
            case '1' -> ONE;
            default -> DONT_CARE;
        };
    }

    /**
     * @return The value this symbol drives when it appears as a table output.
     */
    public Bit toOutputBit() {
        return switch (this) {
            case ZERO -> Bit.ZERO;
            case ONE -> Bit.ONE;
            case DONT_CARE -> Bit.X;
        };
    }
}
