package org.pdemeta.expr;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An arithmetic operator or a named elementary function applied to arguments.
 * Binary operators are {@code + - * / ^}, unary negation is {@code neg}; anything else is
 * treated as a named function such as {@code sin} or {@code exp}.
 *
 * @param operator The operator symbol or function name.
 * @param arguments The operands.
 */
public record Operation(String operator, List<Expr> arguments) implements Expr {

    public static final String ADD = "+";
    public static final String SUB = "-";
    public static final String MUL = "*";
    public static final String DIV = "/";
    public static final String POW = "^";
    public static final String NEG = "neg";

    private static final Set<String> INFIX = Set.of(ADD, SUB, MUL, DIV, POW);

    public Operation {
        arguments = List.copyOf(arguments);
    }

    public static Operation of(String operator, Expr... arguments) {
        return new Operation(operator, List.of(arguments));
    }

    public boolean isInfix() {
        return INFIX.contains(operator) && arguments.size() == 2;
    }

    @Override
    public boolean isCompound() {
        return true;
    }

    @Override
    public Object head() {
        return operator;
    }

    @Override
    public Expr reconstructWithArguments(List<Expr> newArguments) {
        return new Operation(operator, newArguments);
    }

    @Override
    public String render() {
        if (isInfix()) {
            return "(" + arguments.get(0).render() + " " + operator + " " + arguments.get(1).render() + ")";
        }
        if (NEG.equals(operator) && arguments.size() == 1) {
            return "-" + arguments.get(0).render();
        }
        return operator + arguments.stream().map(Expr::render).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return render();
    }
}
