package org.hdlforge.compiler.api;

import org.hdlforge.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when compilation cannot continue because errors were reported.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * @param message The summary message.
     * @param diagnostics The diagnostics that caused the failure.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics recorded up to the failure.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
