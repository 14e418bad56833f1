package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;

/**
 * A reference to a variable of the enclosing module or primitive, by name.
 *
 * @param name The referenced variable.
 * @param access Read or write access.
 * @param source The position of the reference.
 */
public record VarRefNode(String name, Access access, SourceInfo source) implements AstNode, SourceLocatable {
}
