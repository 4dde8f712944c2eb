package org.pdemeta.inspect;

import org.pdemeta.expr.Apply;
import org.pdemeta.expr.Equation;
import org.pdemeta.expr.Expr;
import org.pdemeta.expr.ExpressionWalker;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Operation;
import org.pdemeta.expr.Symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural queries over expression trees.
 * <p>
 * Every query is pure and linear in the size of the tree. Repeated substructure is visited
 * as often as it occurs; nothing is evaluated or simplified.
 */
public final class ExpressionInspector {

    private ExpressionInspector() {}

    /**
     * Sums the order of every derivative operator with respect to {@code coordinate} anywhere
     * inside {@code expr}, {@code expr} itself included.
     *
     * @param expr The expression to inspect.
     * @param coordinate The coordinate to count derivatives for.
     * @return The total count, 0 if there is none.
     */
    public static int countDerivativeOrder(Expr expr, Symbol coordinate) {
        if (!expr.isCompound()) {
            return 0;
        }
        int count = expr.derivativeOrder(coordinate);
        for (Expr arg : expr.arguments()) {
            count += countDerivativeOrder(arg, coordinate);
        }
        return count;
    }

    /**
     * Collects the orders, with respect to {@code coordinate}, of every outermost derivative
     * chain on either side of the equation. Zero is never part of the result.
     *
     * @param equation The equation to inspect.
     * @param coordinate The coordinate.
     * @return The distinct non-zero orders.
     */
    public static Set<Integer> allDerivativeOrders(Equation equation, Symbol coordinate) {
        Set<Integer> orders = new TreeSet<>();
        collectOrders(equation.lhs(), coordinate, orders);
        collectOrders(equation.rhs(), coordinate, orders);
        orders.remove(0);
        return orders;
    }

    private static void collectOrders(Expr expr, Symbol coordinate, Set<Integer> orders) {
        if (!expr.isCompound()) {
            return;
        }
        if (expr.isDerivative()) {
            orders.add(countDerivativeOrder(expr, coordinate));
            return;
        }
        for (Expr arg : expr.arguments()) {
            collectOrders(arg, coordinate, orders);
        }
    }

    /**
     * The distinct non-zero derivative orders with respect to {@code coordinate} over a set
     * of equations, highest first.
     *
     * @param equations The equations.
     * @param coordinate The coordinate.
     * @return The orders in descending order.
     */
    public static List<Integer> derivativeOrders(Collection<Equation> equations, Symbol coordinate) {
        Set<Integer> union = new TreeSet<>(Comparator.reverseOrder());
        for (Equation eq : equations) {
            union.addAll(allDerivativeOrders(eq, coordinate));
        }
        return List.copyOf(union);
    }

    /**
     * @param expr The expression to inspect.
     * @return {@code true} as soon as one derivative operator is found.
     */
    public static boolean containsDerivative(Expr expr) {
        if (expr.isDerivative()) {
            return true;
        }
        for (Expr arg : expr.arguments()) {
            if (containsDerivative(arg)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param equation The equation to inspect.
     * @return {@code true} if either side contains a derivative.
     */
    public static boolean containsDerivative(Equation equation) {
        return containsDerivative(equation.lhs()) || containsDerivative(equation.rhs());
    }

    /**
     * Finds the first node, in pre-order, that is either a derivative operator or an
     * application of {@code function}.
     *
     * @param expr The expression to search.
     * @param function The function tag to look for.
     * @return The node found, or empty.
     */
    public static Optional<Expr> locateDerivativeOrFunction(Expr expr, FunctionTag function) {
        if (!expr.isCompound()) {
            return Optional.empty();
        }
        if (expr.isDerivative() || (expr instanceof Apply app && app.function().equals(function))) {
            return Optional.of(expr);
        }
        for (Expr arg : expr.arguments()) {
            Optional<Expr> found = locateDerivativeOrFunction(arg, function);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Collects every application whose tag is one of {@code functions}, matched by tag and not
     * by argument values. The search continues into the arguments of a matched application, so
     * {@code u(v(t), x)} yields both {@code u(...)} and {@code v(t)}.
     *
     * @param expr The expression to search.
     * @param functions The tags to match.
     * @return The distinct applications in discovery order.
     */
    public static Set<Apply> collectMatchingFunctionApplications(Expr expr, Collection<FunctionTag> functions) {
        Set<Apply> found = new LinkedHashSet<>();
        applicationCollector(functions, found).walk(expr);
        return found;
    }

    /**
     * Same as {@link #collectMatchingFunctionApplications(Expr, Collection)} over both sides
     * of an equation, left first.
     *
     * @param equation The equation to search.
     * @param functions The tags to match.
     * @return The distinct applications in discovery order.
     */
    public static Set<Apply> collectMatchingFunctionApplications(Equation equation, Collection<FunctionTag> functions) {
        Set<Apply> found = new LinkedHashSet<>();
        applicationCollector(functions, found).walk(equation);
        return found;
    }

    private static ExpressionWalker applicationCollector(Collection<FunctionTag> functions, Set<Apply> sink) {
        Set<FunctionTag> tags = Set.copyOf(functions);
        return new ExpressionWalker(Map.of(Apply.class, node -> {
            Apply app = (Apply) node;
            if (tags.contains(app.function())) {
                sink.add(app);
            }
        }));
    }

    /**
     * Splits both sides into their top-level additive terms.
     *
     * @param equation The equation.
     * @return The lhs terms followed by the rhs terms.
     */
    public static List<Expr> splitAdditiveTerms(Equation equation) {
        List<Expr> terms = new ArrayList<>();
        addTerms(equation.lhs(), terms);
        addTerms(equation.rhs(), terms);
        return terms;
    }

    private static void addTerms(Expr expr, List<Expr> terms) {
        if (expr instanceof Operation op && Operation.ADD.equals(op.operator())) {
            op.arguments().forEach(a -> addTerms(a, terms));
        } else {
            terms.add(expr);
        }
    }

    /**
     * @param equation The equation to search.
     * @param target The subexpression to find, by structural equality.
     * @return {@code true} if either side contains {@code target}.
     */
    public static boolean containsSubexpression(Equation equation, Expr target) {
        return containsSubexpression(equation.lhs(), target) || containsSubexpression(equation.rhs(), target);
    }

    /**
     * @param expr The expression to search.
     * @param target The subexpression to find, by structural equality.
     * @return {@code true} if {@code expr} is or contains {@code target}.
     */
    public static boolean containsSubexpression(Expr expr, Expr target) {
        if (expr.equals(target)) {
            return true;
        }
        for (Expr arg : expr.arguments()) {
            if (containsSubexpression(arg, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces subexpressions of both sides according to {@code rules}.
     *
     * @param equation The equation.
     * @param rules Map from subexpressions to their replacements.
     * @return The rewritten equation.
     */
    public static Equation substitute(Equation equation, Map<? extends Expr, ? extends Expr> rules) {
        return new ExpressionWalker().transform(equation, rules);
    }
}
