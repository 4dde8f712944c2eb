package org.pdemeta.expr.lexer;

/**
 * A single token extracted from equation text by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token.
 * @param value The processed value (the {@link Double} of a number), or {@code null}.
 * @param column The 1-based column where the token begins.
 * @param source The logical name of the text the token came from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int column,
        String source
) {
}
