package org.pdemeta.expr;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of a symbolic expression tree.
 * <p>
 * Implementations are immutable records, so structural equality and hashing come for free.
 * Generic traversals (see {@link ExpressionWalker}) only rely on {@link #arguments()} and
 * {@link #reconstructWithArguments(List)} and never need to know the concrete node type.
 */
public interface Expr {

    /**
     * Returns the ordered argument list of this node.
     *
     * @return The arguments, or an empty list for atomic nodes.
     */
    default List<Expr> arguments() {
        return Collections.emptyList();
    }

    /**
     * @return {@code true} if this node is an operation applied to arguments, {@code false} for atoms.
     */
    default boolean isCompound() {
        return false;
    }

    /**
     * Returns the operation of a compound node: the function tag of an {@link Apply}, the
     * coordinate of a {@link Differential}, the operator name of an {@link Operation}.
     *
     * @return The head, or {@code null} for atoms.
     */
    default Object head() {
        return null;
    }

    /**
     * @return {@code true} if this node is itself a derivative operator.
     */
    default boolean isDerivative() {
        return false;
    }

    /**
     * Derivative-operator recognizer: the order this node's own operator contributes with
     * respect to {@code coordinate}. Nested derivatives are not included.
     *
     * @param coordinate The coordinate to test against.
     * @return The order of this operator for the coordinate, 0 if it is no derivative in it.
     */
    default int derivativeOrder(Symbol coordinate) {
        return 0;
    }

    /**
     * Creates a node of the same kind with the given arguments.
     *
     * @param newArguments The replacement arguments, same arity as {@link #arguments()}.
     * @return A new node, or this node if it has no arguments.
     */
    default Expr reconstructWithArguments(List<Expr> newArguments) {
        return this;
    }

    /**
     * @return A textual rendering used in logs and error messages.
     */
    String render();
}
