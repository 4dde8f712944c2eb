package org.pdemeta.expr;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class ExpressionWalkerTest {

    private static final Symbol T = Symbol.coordinate("t");
    private static final Symbol X = Symbol.coordinate("x");
    private static final FunctionTag U = FunctionTag.of("u");

    @Test
    void testWalkVisitsNodesInPreOrder() {
        // Arrange
        Expr expr = Operation.of(Operation.ADD, new Differential(X, Apply.of(U, T, X)), Constant.of(1));
        List<String> visited = new ArrayList<>();
        ExpressionWalker walker = new ExpressionWalker(Map.of(
                Symbol.class, n -> visited.add("sym:" + n.render()),
                Apply.class, n -> visited.add("app:" + ((Apply) n).function()),
                Constant.class, n -> visited.add("const:" + n.render())));

        // Act
        walker.walk(expr);

        // Assert
        assertThat(visited).containsExactly("app:u", "sym:t", "sym:x", "const:1");
    }

    @Test
    void testTransformRebuildsOnlyChangedPaths() {
        // Arrange
        Apply boundary = Apply.of(U, T, Constant.of(0));
        Expr untouched = Operation.of(Operation.MUL, Constant.of(2), T);
        Expr expr = Operation.of(Operation.ADD, new Differential(X, boundary), untouched);

        // Act
        Expr result = new ExpressionWalker().transform(expr, Map.of(boundary, Apply.of(U, T, X)));

        // Assert
        assertThat(result.render()).isEqualTo("(Dx(u(t, x)) + (2 * t))");
        assertThat(result.arguments().get(1)).isSameAs(untouched);
    }

    @Test
    void testTransformWithoutMatchReturnsSameTree() {
        Expr expr = new Differential(X, Apply.of(U, T, X));

        assertThat(new ExpressionWalker().transform(expr, Map.of(Constant.of(5), Constant.of(6)))).isSameAs(expr);
    }

    @Test
    void testConditionGroupsFlattenDepthFirstInOrder() {
        Equation a = Equation.of(Apply.of(U, T, Constant.of(0)), Constant.ZERO);
        Equation b = Equation.of(Apply.of(U, T, Constant.of(1)), Constant.ZERO);
        Equation c = Equation.of(Apply.of(U, Constant.ZERO, X), Constant.ZERO);

        List<Equation> flat = ConditionGroup.flatten(List.of(c, ConditionGroup.of(a, ConditionGroup.of(b))));

        assertThat(flat).containsExactly(c, a, b);
    }
}
