package org.pdemeta.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic traversal over expression trees.
 * Instead of the Visitor pattern, this walker uses a handler-based system so that
 * analyses can pick the node types they care about without coupling to the whole tree.
 */
public class ExpressionWalker {

    private final Map<Class<? extends Expr>, Consumer<Expr>> handlers;

    /**
     * Constructs a walker without handlers, useful for {@link #transform(Expr, Map)} only.
     */
    public ExpressionWalker() {
        this(Collections.emptyMap());
    }

    /**
     * Constructs a new walker.
     * @param handlers A map from node classes to their handlers.
     */
    public ExpressionWalker(Map<Class<? extends Expr>, Consumer<Expr>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks both sides of an equation, left first.
     * @param equation The equation to walk.
     */
    public void walk(Equation equation) {
        walk(equation.lhs());
        walk(equation.rhs());
    }

    /**
     * Walks a node and all its arguments in pre-order.
     * @param node The node to walk.
     */
    public void walk(Expr node) {
        if (node == null) {
            return;
        }
        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);
        for (Expr child : node.arguments()) {
            walk(child);
        }
    }

    /**
     * Replaces every subexpression found in {@code replacements} (outermost match wins) and
     * rebuilds only the nodes on the path to a replacement.
     *
     * @param node The root node.
     * @param replacements Map from nodes to their replacements, matched by structural equality.
     * @return The transformed tree, or {@code node} itself if nothing matched.
     */
    public Expr transform(Expr node, Map<? extends Expr, ? extends Expr> replacements) {
        if (node == null) {
            return null;
        }
        Expr replacement = replacements.get(node);
        if (replacement != null) {
            return replacement;
        }

        List<Expr> children = node.arguments();
        List<Expr> transformed = new ArrayList<>(children.size());
        boolean changed = false;
        for (Expr child : children) {
            Expr t = transform(child, replacements);
            if (t != child) {
                changed = true;
            }
            transformed.add(t);
        }
        return changed ? node.reconstructWithArguments(transformed) : node;
    }

    /**
     * Applies {@link #transform(Expr, Map)} to both sides of an equation.
     * @param equation The equation.
     * @param replacements The replacement map.
     * @return The transformed equation.
     */
    public Equation transform(Equation equation, Map<? extends Expr, ? extends Expr> replacements) {
        return new Equation(transform(equation.lhs(), replacements), transform(equation.rhs(), replacements));
    }
}
