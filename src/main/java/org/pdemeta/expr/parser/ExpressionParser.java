package org.pdemeta.expr.parser;

import org.pdemeta.diagnostics.DiagnosticsEngine;
import org.pdemeta.expr.Apply;
import org.pdemeta.expr.Constant;
import org.pdemeta.expr.Differential;
import org.pdemeta.expr.Equation;
import org.pdemeta.expr.Expr;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Operation;
import org.pdemeta.expr.Symbol;
import org.pdemeta.expr.lexer.Lexer;
import org.pdemeta.expr.lexer.Token;
import org.pdemeta.expr.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for equation text such as {@code Dt(u(t, x)) ~ a * Dxx(u(t, x))}.
 * <p>
 * Precedence, lowest first: {@code ~}, {@code + -}, {@code * /}, unary {@code -}, {@code ^}
 * (right-associative). Identifiers are resolved against the problem's {@link Declarations}:
 * <ul>
 *     <li>a declared function applied to arguments is an {@link Apply};</li>
 *     <li>{@code Dx(e)}, {@code Dxx(e)} and {@code D(e, x, n)} are nested {@link Differential}s;</li>
 *     <li>any other call is a named {@link Operation}, e.g. {@code sin(x)}.</li>
 * </ul>
 * Errors are reported to the {@link DiagnosticsEngine}; the parse methods then return {@code null}.
 */
public class ExpressionParser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final Declarations declarations;
    private int current = 0;

    /**
     * Constructs a parser over already scanned tokens.
     * @param tokens The tokens, terminated by {@link TokenType#END_OF_INPUT}.
     * @param declarations The declared names.
     * @param diagnostics The engine for reporting errors.
     */
    public ExpressionParser(List<Token> tokens, Declarations declarations, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.declarations = declarations;
        this.diagnostics = diagnostics;
    }

    /**
     * Scans and parses one equation.
     * @param text The equation text.
     * @param source The logical name of the text for diagnostics.
     * @param declarations The declared names.
     * @param diagnostics The engine for reporting errors.
     * @return The equation, or {@code null} if errors were reported.
     */
    public static Equation parseEquation(String text, String source, Declarations declarations, DiagnosticsEngine diagnostics) {
        int reportedBefore = diagnostics.getDiagnostics().size();
        List<Token> tokens = new Lexer(text, diagnostics, source).scanTokens();
        if (diagnostics.getDiagnostics().size() > reportedBefore) {
            return null;
        }
        return new ExpressionParser(tokens, declarations, diagnostics).equation();
    }

    /**
     * Parses the whole token stream as one equation {@code lhs ~ rhs}.
     * @return The equation, or {@code null} if an error was reported.
     */
    public Equation equation() {
        try {
            Expr lhs = sum();
            consume(TokenType.TILDE, "Expected '~' between the two sides of the equation.");
            Expr rhs = sum();
            expectEnd();
            return new Equation(lhs, rhs);
        } catch (ParseError e) {
            return null;
        }
    }

    /**
     * Parses the whole token stream as a single expression.
     * @return The expression, or {@code null} if an error was reported.
     */
    public Expr expression() {
        try {
            Expr expr = sum();
            expectEnd();
            return expr;
        } catch (ParseError e) {
            return null;
        }
    }

    private Expr sum() {
        Expr expr = product();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            String op = advance().type() == TokenType.PLUS ? Operation.ADD : Operation.SUB;
            expr = Operation.of(op, expr, product());
        }
        return expr;
    }

    private Expr product() {
        Expr expr = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            String op = advance().type() == TokenType.STAR ? Operation.MUL : Operation.DIV;
            expr = Operation.of(op, expr, unary());
        }
        return expr;
    }

    private Expr unary() {
        if (match(TokenType.MINUS)) {
            Expr operand = unary();
            if (operand instanceof Constant c) {
                return Constant.of(-c.value());
            }
            return Operation.of(Operation.NEG, operand);
        }
        return power();
    }

    private Expr power() {
        Expr base = primary();
        if (match(TokenType.CARET)) {
            return Operation.of(Operation.POW, base, unary());
        }
        return base;
    }

    private Expr primary() {
        if (match(TokenType.NUMBER)) {
            return Constant.of((Double) previous().value());
        }
        if (match(TokenType.LEFT_PAREN)) {
            Expr inner = sum();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
            return inner;
        }
        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (match(TokenType.LEFT_PAREN)) {
                return call(name, arguments());
            }
            return identifier(name);
        }
        throw error(peek(), "Unexpected token while parsing expression: '" + peek().text() + "'.");
    }

    private List<Expr> arguments() {
        List<Expr> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(sum());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments.");
        return args;
    }

    private Expr call(Token name, List<Expr> args) {
        String text = name.text();

        Optional<FunctionTag> function = declarations.function(text);
        if (function.isPresent()) {
            return new Apply(function.get(), args);
        }

        if ("D".equals(text)) {
            return generalDerivative(name, args);
        }
        if (text.startsWith("D")) {
            Optional<Declarations.DerivativeShorthand> shorthand = declarations.derivativeShorthand(text.substring(1));
            if (shorthand.isPresent()) {
                if (args.size() != 1) {
                    throw error(name, "Derivative operator '" + text + "' takes exactly one argument, got " + args.size() + ".");
                }
                return Differential.of(shorthand.get().coordinate(), args.get(0), shorthand.get().order());
            }
        }
        return new Operation(text, args);
    }

    private Expr generalDerivative(Token name, List<Expr> args) {
        if (args.size() < 2 || args.size() > 3) {
            throw error(name, "D(expr, coordinate[, order]) expects 2 or 3 arguments, got " + args.size() + ".");
        }
        if (!(args.get(1) instanceof Symbol x) || !x.isCoordinate()) {
            throw error(name, "Second argument of D(...) must be a declared coordinate, got '" + args.get(1).render() + "'.");
        }
        int order = 1;
        if (args.size() == 3) {
            if (!(args.get(2) instanceof Constant c) || c.value() < 1 || c.value() != Math.rint(c.value())) {
                throw error(name, "Derivative order must be a positive integer, got '" + args.get(2).render() + "'.");
            }
            order = (int) c.value();
        }
        return Differential.of(x, args.get(0), order);
    }

    private Expr identifier(Token name) {
        String text = name.text();
        Optional<Symbol> coordinate = declarations.coordinate(text);
        if (coordinate.isPresent()) {
            return coordinate.get();
        }
        Optional<Symbol> parameter = declarations.parameter(text);
        if (parameter.isPresent()) {
            return parameter.get();
        }
        if ("pi".equals(text)) {
            return Constant.of(Math.PI);
        }
        if (declarations.function(text).isPresent()) {
            throw error(name, "Function '" + text + "' must be applied to arguments.");
        }
        throw error(name, "Unknown identifier '" + text + "'.");
    }

    private void expectEnd() {
        if (!isAtEnd()) {
            throw error(peek(), "Unexpected trailing input: '" + peek().text() + "'.");
        }
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(message, token.source(), token.column());
        return new ParseError(message);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_INPUT;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    /** Unwinds the descent after an error has been reported. */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }
}
