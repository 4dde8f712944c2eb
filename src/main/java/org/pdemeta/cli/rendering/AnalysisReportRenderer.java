package org.pdemeta.cli.rendering;

import org.pdemeta.api.AnalysisResult;
import org.pdemeta.boundary.Boundary;
import org.pdemeta.boundary.EdgeBoundary;
import org.pdemeta.boundary.HigherOrderInterfaceBoundary;
import org.pdemeta.boundary.InterfaceBoundary;
import org.pdemeta.expr.Apply;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;
import org.pdemeta.varmap.VariableMap;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain-text report of an analysis result for the command line.
 */
public final class AnalysisReportRenderer {

    private AnalysisReportRenderer() {}

    public static String render(AnalysisResult result) {
        VariableMap vm = result.variableMap();
        StringBuilder sb = new StringBuilder();
        sb.append("Problem: ").append(result.problem().name()).append('\n');

        sb.append("\nVariable map\n");
        sb.append("  unknowns: ").append(vm.unknowns().stream().map(Apply::render).collect(Collectors.joining(", "))).append('\n');
        for (Symbol x : vm.spatialCoordinates()) {
            sb.append(String.format("  [%d] %s in %s%n", vm.indexOf(x), x, vm.interval(x)));
        }
        result.time().ifPresent(span -> sb.append("  time ").append(vm.time().get()).append(" in ").append(span).append('\n'));
        if (!vm.parameters().isEmpty()) {
            sb.append("  parameters: ").append(vm.parameters()).append('\n');
        }

        sb.append("\nBoundary map\n");
        for (FunctionTag u : result.boundaryMap().functions()) {
            for (Symbol x : vm.allCoordinates()) {
                List<Boundary> boundaries = result.boundaryMap().get(u, x);
                if (boundaries.isEmpty()) {
                    continue;
                }
                sb.append("  ").append(u).append(" / ").append(x).append('\n');
                for (Boundary b : boundaries) {
                    sb.append("    ").append(describe(b)).append(": ").append(b.equation().render()).append('\n');
                }
            }
        }

        sb.append("\nPeriodic map (any periodic: ").append(result.periodicMap().hasPeriodic()).append(")\n");
        result.periodicMap().asMap().forEach((u, flags) -> flags.forEach((x, periodic) -> {
            if (periodic) {
                sb.append("  ").append(u).append(" periodic in ").append(x).append('\n');
            }
        }));
        return sb.toString();
    }

    private static String describe(Boundary boundary) {
        if (boundary instanceof EdgeBoundary edge) {
            String kind = edge.isInitialCondition() ? "initial" : (edge.upper() ? "upper edge" : "lower edge");
            return kind + ", order " + edge.order();
        }
        if (boundary instanceof InterfaceBoundary ib) {
            return "interface " + ib.first() + " <-> " + ib.second();
        }
        if (boundary instanceof HigherOrderInterfaceBoundary hb) {
            return "interface " + hb.first() + " <-> " + hb.second() + ", order " + hb.order();
        }
        throw new IllegalStateException("Unknown boundary kind: " + boundary.getClass().getName());
    }
}
