package org.hdlforge.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects errors and warnings reported by the compiler phases.
 * <p>
 * Reporting never throws. Phases keep going after an error so that a single run
 * surfaces as many problems as possible; callers decide via {@link #hasErrors()}
 * whether later stages may run.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     * @param message The error message.
     * @param fileName The source file, may be null.
     * @param lineNumber The line number, 0 when unknown.
     */
    public void reportError(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber));
    }

    /**
     * Reports a warning.
     * @param message The warning message.
     * @param fileName The source file, may be null.
     * @param lineNumber The line number, 0 when unknown.
     */
    public void reportWarning(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, lineNumber));
    }

    /**
     * @return true if at least one error has been reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return An unmodifiable view of all reported diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return The number of errors reported so far.
     */
    public int errorCount() {
        return (int) diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Formats all diagnostics, one per line.
     * @return The summary text, empty if nothing was reported.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining(System.lineSeparator()));
    }
}
