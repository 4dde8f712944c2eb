package org.pdemeta.expr.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    /** The '~' separating the two sides of an equation. */
    TILDE,

    // Literals.
    /** A name: coordinate, parameter, function or derivative operator. */
    IDENTIFIER,
    /** A numeric literal, value is a {@link Double}. */
    NUMBER,

    /** Represents the end of the input. */
    END_OF_INPUT
}
