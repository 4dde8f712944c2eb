package org.pdemeta.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics produced by the lexer and parser.
 * <p>
 * Reading keeps going after an error so that one pass reports every problem in a
 * definition; the caller checks {@link #hasErrors()} afterwards and aborts.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param source  The logical source name.
     * @param column  The column of the error.
     */
    public void reportError(String message, String source, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, source, column));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param source  The logical source name.
     * @param column  The column of the warning.
     */
    public void reportWarning(String message, String source, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, source, column));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return An unmodifiable view of all diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All diagnostics, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
