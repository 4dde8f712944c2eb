package org.pdemeta.expr.lexer;

import org.pdemeta.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 */
public class LexerTest {

    @Test
    @Tag("unit")
    void testLexerTokenization() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("Dx(u(t, 1.5)) ~ -2e-3 * a", diagnostics);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.LEFT_PAREN,
                TokenType.IDENTIFIER, TokenType.COMMA, TokenType.NUMBER, TokenType.RIGHT_PAREN, TokenType.RIGHT_PAREN,
                TokenType.TILDE, TokenType.MINUS, TokenType.NUMBER, TokenType.STAR, TokenType.IDENTIFIER,
                TokenType.END_OF_INPUT);
        assertThat(tokens.get(6)).extracting(Token::text, Token::value).containsExactly("1.5", 1.5);
        assertThat(tokens.get(11)).extracting(Token::text, Token::value).containsExactly("2e-3", 2e-3);
    }

    @Test
    @Tag("unit")
    void testCommentRunsToEndOfInput() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("u(t, 0) ~ 0 # left wall", diagnostics).scanTokens();

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(tokens.size() - 2)).extracting(Token::type, Token::text).containsExactly(TokenType.NUMBER, "0");
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.END_OF_INPUT);
    }

    @Test
    @Tag("unit")
    void testUnexpectedCharacterIsReportedWithColumn() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        new Lexer("u(x) $ 1", diagnostics, "equations[0]").scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics().get(0).source()).isEqualTo("equations[0]");
        assertThat(diagnostics.getDiagnostics().get(0).column()).isEqualTo(6);
        assertThat(diagnostics.summary()).contains("Unexpected character: $");
    }
}
