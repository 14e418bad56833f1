package org.hdlforge.compiler.diagnostics;

/**
 * A single message produced during compilation.
 *
 * @param type       The severity of the message.
 * @param message    The human-readable text.
 * @param fileName   The source file the message refers to, may be {@code null} for synthetic nodes.
 * @param lineNumber The 1-based line number, or 0 when unknown.
 */
public record Diagnostic(Type type, String message, String fileName, int lineNumber) {

    /**
     * Severity of a diagnostic.
     */
    public enum Type {
        ERROR,
        WARNING
    }

    @Override
    public String toString() {
        String location = fileName != null ? fileName + ":" + lineNumber : "<unknown>";
        return String.format("[%s] %s: %s", type, location, message);
    }
}
