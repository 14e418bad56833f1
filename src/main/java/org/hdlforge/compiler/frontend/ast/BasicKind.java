package org.hdlforge.compiler.frontend.ast;

/**
 * Underlying data type of a variable.
 */
public enum BasicKind {
    /** Plain two-valued bits, as used for wires and compiler temporaries. */
    BIT,
    /** Four-state, state-holding storage ({@code reg} / {@code logic}). */
    LOGIC
}
