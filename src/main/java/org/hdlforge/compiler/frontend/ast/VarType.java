package org.hdlforge.compiler.frontend.ast;

/**
 * Storage class of a variable.
 */
public enum VarType {
    /** A declared port. */
    PORT,
    /** A declared net or variable local to the module. */
    VAR,
    /** A temporary introduced by a compiler pass. */
    MODULETEMP
}
