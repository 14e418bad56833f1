package org.hdlforge.compiler.frontend.ast;

/**
 * Whether a variable reference reads or writes the variable.
 */
public enum Access {
    READ,
    WRITE
}
