package org.pdemeta.diagnostics;

/**
 * A single message reported while reading a problem definition.
 *
 * @param type The severity.
 * @param message The message text.
 * @param source A logical name for the text being read, e.g. {@code "boundary-conditions[2]"}.
 * @param column The 1-based column within the source, 0 if unknown.
 */
public record Diagnostic(
        Type type,
        String message,
        String source,
        int column
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Type {
        /** Prevents the problem from being analyzed. */
        ERROR,
        /** Reported but not fatal. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, source, column, message);
    }
}
