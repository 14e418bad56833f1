package org.hdlforge.compiler.frontend.ast;

/**
 * Flavor of a process block.
 */
public enum AlwaysKeyword {
    ALWAYS("always"),
    ALWAYS_COMB("always_comb"),
    ALWAYS_LATCH("always_latch");

    private final String keyword;

    AlwaysKeyword(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The Verilog keyword.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * True for processes whose assigned variables keep their value when a
     * run does not assign them.
     * @return whether values are held between evaluations.
     */
    public boolean holdsOutputs() {
        return this != ALWAYS_COMB;
    }
}
