package org.hdlforge.compiler.frontend.ast;

import org.hdlforge.compiler.api.SourceInfo;
import org.hdlforge.compiler.model.UdpSymbol;

/**
 * A single entry of a table line as written in the source, e.g. {@code "0"} or {@code "?"}.
 *
 * @param text The entry text.
 * @param source The position of the entry.
 */
public record UdpTableLineValNode(String text, SourceInfo source) implements AstNode, SourceLocatable {

    /**
     * @return The entry classified by its first character.
     */
    public UdpSymbol symbol() {
        return UdpSymbol.fromText(text);
    }
}
