package org.pdemeta.expr.lexer;

import org.pdemeta.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts one line of equation text into a sequence of tokens.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalName;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The equation text.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical name for error reporting.
     * @param source The equation text.
     * @param diagnostics The engine for reporting errors.
     * @param logicalName The name of the text, e.g. the configuration path it was read from.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalName = logicalName;
    }

    /**
     * Tokenizes the whole input.
     * @return The recognized tokens, always terminated by {@link TokenType#END_OF_INPUT}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_INPUT, "", null, current + 1, logicalName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case ',' -> addToken(TokenType.COMMA);
            case '+' -> addToken(TokenType.PLUS);
            case '-' -> addToken(TokenType.MINUS);
            case '*' -> addToken(TokenType.STAR);
            case '/' -> addToken(TokenType.SLASH);
            case '^' -> addToken(TokenType.CARET);
            case '~' -> addToken(TokenType.TILDE);
            case '#' -> {
                // A comment runs to the end of the input.
                while (!isAtEnd()) advance();
            }
            case ' ', '\r', '\t', '\n' -> { }
            default -> {
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError("Unexpected character: " + c, logicalName, start + 1);
                }
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '-' || peekNext() == '+') && isDigit(peekAt(2))))) {
            advance();
            if (peek() == '-' || peek() == '+') advance();
            while (isDigit(peek())) advance();
        }

        String text = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            diagnostics.reportError("Invalid number format: " + text, logicalName, start + 1);
        }
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        tokens.add(new Token(type, source.substring(start, current), literal, start + 1, logicalName));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
