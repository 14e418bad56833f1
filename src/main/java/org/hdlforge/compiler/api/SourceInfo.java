package org.hdlforge.compiler.api;

/**
 * Source position of a node in the design files.
 *
 * @param fileName     The file the construct was read from.
 * @param lineNumber   The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /** Position used for nodes that do not originate from a source file. */
    public static final SourceInfo UNKNOWN = new SourceInfo(null, 0, 0);

    @Override
    public String toString() {
        return (fileName != null ? fileName : "<unknown>") + ":" + lineNumber + ":" + columnNumber;
    }
}
