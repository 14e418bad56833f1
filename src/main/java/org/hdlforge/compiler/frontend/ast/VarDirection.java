package org.hdlforge.compiler.frontend.ast;

/**
 * Port direction of a variable. {@link #NONE} marks variables that are not ports.
 */
public enum VarDirection {
    INPUT,
    OUTPUT,
    INOUT,
    NONE
}
