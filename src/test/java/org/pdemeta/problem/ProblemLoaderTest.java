package org.pdemeta.problem;

import org.pdemeta.ProblemFixtures;
import org.pdemeta.api.AnalysisErrorCode;
import org.pdemeta.api.ProblemDefinitionException;
import org.pdemeta.expr.ConditionGroup;
import org.pdemeta.expr.Equation;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for reading problem files with the {@link ProblemLoader}.
 */
@Tag("unit")
public class ProblemLoaderTest {

    @Test
    void testLoadHeatProblemFromFile() throws Exception {
        // Act
        PdeProblem problem = ProblemLoader.load(Path.of("src/test/resources/problems/heat.conf"));

        // Assert
        assertThat(problem.name()).isEqualTo("heat");
        assertThat(problem.coordinates()).containsExactly(Symbol.coordinate("t"), Symbol.coordinate("x"));
        assertThat(problem.timeCoordinate()).contains(Symbol.coordinate("t"));
        assertThat(problem.functions()).containsExactly(FunctionTag.of("u"));
        assertThat(problem.parameters()).containsExactly(Symbol.parameter("alpha"));
        assertThat(problem.domains()).containsEntry(Symbol.coordinate("x"), Interval.of(0, 1));
        assertThat(problem.flatEquations()).hasSize(1);
    }

    @Test
    void testNestedBoundaryGroupsKeepTheirOrder() throws Exception {
        PdeProblem problem = ProblemLoader.load(Path.of("src/test/resources/problems/heat.conf"));

        assertThat(problem.boundaryConditions()).hasSize(2);
        assertThat(problem.boundaryConditions().get(1)).isInstanceOf(ConditionGroup.class);
        assertThat(problem.flatBoundaryConditions()).extracting(Equation::render).containsExactly(
                "u(0, x) ~ sin((3.141592653589793 * x))",
                "u(t, 0) ~ 0",
                "Dx(u(t, 1)) ~ 0");
    }

    @Test
    void testInfiniteDomainStringsAreLoaded() {
        PdeProblem problem = ProblemFixtures.parse("""
                problem {
                  coordinates = [x]
                  functions = [u]
                  domains { x = [0, "Infinity"] }
                  equations = ["Dxx(u(x)) ~ 0"]
                }
                """);

        assertThat(problem.name()).isEqualTo("problem");
        assertThat(problem.domains().get(Symbol.coordinate("x")).upper()).isInfinite();
        assertThat(problem.domains().get(Symbol.coordinate("x")).isWellFormed()).isFalse();
    }

    @Test
    void testAllEquationErrorsAreCollected() {
        assertThatThrownBy(() -> ProblemLoader.load(Path.of("src/test/resources/problems/broken.conf")))
                .isInstanceOf(ProblemDefinitionException.class)
                .hasMessageContaining("Unknown identifier 'q'")
                .satisfies(e -> assertThat(((ProblemDefinitionException) e).getCode()).isEqualTo(AnalysisErrorCode.PROBLEM_DEFINITION));
    }

    @Test
    void testMissingFileIsReported() {
        assertThatThrownBy(() -> ProblemLoader.load(Path.of("src/test/resources/problems/does-not-exist.conf")))
                .isInstanceOf(ProblemDefinitionException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void testUndeclaredTimeCoordinateIsRejected() {
        assertThatThrownBy(() -> ProblemLoader.parseString("""
                problem {
                  coordinates = [x]
                  time = t
                  functions = [u]
                  equations = ["Dxx(u(x)) ~ 0"]
                }
                """))
                .isInstanceOf(ProblemDefinitionException.class)
                .hasMessageContaining("Time coordinate 't'");
    }

    @Test
    void testMissingRequiredKeyIsWrapped() {
        assertThatThrownBy(() -> ProblemLoader.parseString("problem { coordinates = [x] }"))
                .isInstanceOf(ProblemDefinitionException.class)
                .hasMessageContaining("functions");
    }

    @Test
    void testBuilderMatchesLoadedProblem() throws Exception {
        PdeProblem loaded = ProblemFixtures.laplace("u(0, y) ~ 0");
        Symbol x = Symbol.coordinate("x");
        Symbol y = Symbol.coordinate("y");

        PdeProblem built = PdeProblem.builder("laplace")
                .coordinate(x, 0, 1)
                .coordinate(y, 0, 1)
                .function(FunctionTag.of("u"))
                .equation(loaded.flatEquations().get(0))
                .boundaryCondition(loaded.flatBoundaryConditions().get(0))
                .build();

        assertThat(built).isEqualTo(loaded);
        assertThat(built.withEquations(List.of(), List.of(), List.of()).flatEquations()).isEmpty();
    }
}
