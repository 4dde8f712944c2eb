package org.pdemeta.varmap;

import org.pdemeta.expr.Apply;
import org.pdemeta.expr.Expr;
import org.pdemeta.expr.FunctionTag;
import org.pdemeta.expr.Symbol;
import org.pdemeta.problem.Interval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical metadata about the unknowns and coordinates of one discretization run.
 * <p>
 * Instances are immutable. {@link #registerUnknown(Apply)} is the only way to add an
 * unknown and it returns an extended copy; existing entries are never removed or
 * renumbered. Callers must not interleave it with reads on another thread.
 */
public final class VariableMap {

    private final List<Apply> unknowns;
    private final List<FunctionTag> declaredFunctions;
    private final List<Symbol> spatialCoordinates;
    private final Symbol time;
    private final List<Symbol> parameters;
    private final Map<Symbol, Interval> intervals;
    private final Map<FunctionTag, List<Symbol>> signatures;
    private final Map<Symbol, Integer> coordinateToIndex;
    private final Map<Integer, Symbol> indexToCoordinate;

    VariableMap(List<Apply> unknowns,
                List<FunctionTag> declaredFunctions,
                List<Symbol> spatialCoordinates,
                Symbol time,
                List<Symbol> parameters,
                Map<Symbol, Interval> intervals,
                Map<FunctionTag, List<Symbol>> signatures) {
        this.unknowns = List.copyOf(unknowns);
        this.declaredFunctions = List.copyOf(declaredFunctions);
        this.spatialCoordinates = List.copyOf(spatialCoordinates);
        this.time = time;
        this.parameters = List.copyOf(parameters);
        this.intervals = Collections.unmodifiableMap(new LinkedHashMap<>(intervals));
        Map<FunctionTag, List<Symbol>> sigs = new LinkedHashMap<>();
        signatures.forEach((tag, args) -> sigs.put(tag, List.copyOf(args)));
        this.signatures = Collections.unmodifiableMap(sigs);

        Map<Symbol, Integer> x2i = new LinkedHashMap<>();
        Map<Integer, Symbol> i2x = new LinkedHashMap<>();
        for (int i = 0; i < this.spatialCoordinates.size(); i++) {
            x2i.put(this.spatialCoordinates.get(i), i + 1);
            i2x.put(i + 1, this.spatialCoordinates.get(i));
        }
        this.coordinateToIndex = Collections.unmodifiableMap(x2i);
        this.indexToCoordinate = Collections.unmodifiableMap(i2x);
    }

    /**
     * @return The unknowns in their genuine form, e.g. {@code u(t, x)}, in discovery order.
     */
    public List<Apply> unknowns() {
        return unknowns;
    }

    /**
     * @return The tags of all unknowns, in discovery order.
     */
    public List<FunctionTag> functionTags() {
        return List.copyOf(signatures.keySet());
    }

    /**
     * @return Every declared function tag, whether or not it became an unknown.
     */
    public List<FunctionTag> declaredFunctions() {
        return declaredFunctions;
    }

    /**
     * @return The spatial coordinates in canonical dimension order.
     */
    public List<Symbol> spatialCoordinates() {
        return spatialCoordinates;
    }

    /**
     * @return The spatial coordinates followed by the time coordinate, if any.
     */
    public List<Symbol> allCoordinates() {
        if (time == null) {
            return spatialCoordinates;
        }
        List<Symbol> all = new ArrayList<>(spatialCoordinates);
        all.add(time);
        return Collections.unmodifiableList(all);
    }

    public Optional<Symbol> time() {
        return Optional.ofNullable(time);
    }

    public boolean isTime(Symbol coordinate) {
        return time != null && time.equals(coordinate);
    }

    public List<Symbol> parameters() {
        return parameters;
    }

    /**
     * @return The domain table of every coordinate in use.
     */
    public Map<Symbol, Interval> intervals() {
        return intervals;
    }

    /**
     * @param coordinate A coordinate in use.
     * @return Its domain.
     * @throws IllegalArgumentException if the coordinate is not in use.
     */
    public Interval interval(Symbol coordinate) {
        Interval interval = intervals.get(coordinate);
        if (interval == null) {
            throw new IllegalArgumentException("Coordinate '" + coordinate + "' is not in use.");
        }
        return interval;
    }

    public boolean isUnknown(FunctionTag function) {
        return signatures.containsKey(function);
    }

    /**
     * @param function An unknown's tag.
     * @return Its full coordinate signature, time included.
     * @throws IllegalArgumentException if the tag is not an unknown.
     */
    public List<Symbol> signature(FunctionTag function) {
        List<Symbol> signature = signatures.get(function);
        if (signature == null) {
            throw new IllegalArgumentException("'" + function + "' is not an unknown of this problem.");
        }
        return signature;
    }

    /**
     * @param function An unknown's tag.
     * @return Its signature without the time coordinate.
     */
    public List<Symbol> spatialSignature(FunctionTag function) {
        return signature(function).stream().filter(x -> !isTime(x)).toList();
    }

    /**
     * @param function An unknown's tag.
     * @return The number of spatial dimensions it lives in.
     */
    public int ndims(FunctionTag function) {
        return spatialSignature(function).size();
    }

    /**
     * @param function An unknown's tag.
     * @return The genuine application, e.g. {@code u(t, x)}.
     */
    public Apply genuineForm(FunctionTag function) {
        return new Apply(function, List.<Expr>copyOf(signature(function)));
    }

    /**
     * @param coordinate A spatial coordinate.
     * @return Its 1-based dimension index.
     * @throws IllegalArgumentException if the coordinate is not spatial.
     */
    public int indexOf(Symbol coordinate) {
        Integer index = coordinateToIndex.get(coordinate);
        if (index == null) {
            throw new IllegalArgumentException("'" + coordinate + "' is not a spatial coordinate.");
        }
        return index;
    }

    /**
     * @param index A 1-based dimension index.
     * @return The spatial coordinate at that index.
     * @throws IllegalArgumentException if the index is out of range.
     */
    public Symbol coordinateAt(int index) {
        Symbol coordinate = indexToCoordinate.get(index);
        if (coordinate == null) {
            throw new IllegalArgumentException("No spatial coordinate with index " + index + ".");
        }
        return coordinate;
    }

    public Map<Symbol, Integer> coordinateIndices() {
        return coordinateToIndex;
    }

    /**
     * Position of {@code coordinate} within the spatial signature of {@code function}.
     *
     * @param function An unknown's tag.
     * @param coordinate The coordinate.
     * @return The 1-based position, or empty if the function does not depend on it.
     */
    public Optional<Integer> positionInSignature(FunctionTag function, Symbol coordinate) {
        int i = spatialSignature(function).indexOf(coordinate);
        return i < 0 ? Optional.empty() : Optional.of(i + 1);
    }

    /**
     * Registers an auxiliary unknown introduced by a later pipeline stage.
     * <p>
     * The receiver is left untouched; the returned map appends the unknown and its signature.
     * Every argument must be a coordinate already in use, so no index is renumbered.
     *
     * @param unknown The genuine application of the new unknown.
     * @return The extended map.
     * @throws IllegalArgumentException if the application is not genuine, its tag is already
     *                                  registered or it uses a coordinate not in use.
     */
    public VariableMap registerUnknown(Apply unknown) {
        Objects.requireNonNull(unknown, "unknown");
        if (!unknown.isGenuine()) {
            throw new IllegalArgumentException("Only genuine applications can be registered as unknowns, got " + unknown.render());
        }
        if (signatures.containsKey(unknown.function())) {
            throw new IllegalArgumentException("'" + unknown.function() + "' is already registered.");
        }
        List<Symbol> args = new ArrayList<>();
        for (Expr arg : unknown.arguments()) {
            Symbol x = (Symbol) arg;
            if (!intervals.containsKey(x)) {
                throw new IllegalArgumentException("Coordinate '" + x + "' of " + unknown.render() + " is not in use.");
            }
            args.add(x);
        }

        List<Apply> newUnknowns = new ArrayList<>(unknowns);
        newUnknowns.add(unknown);
        Map<FunctionTag, List<Symbol>> newSignatures = new LinkedHashMap<>(signatures);
        newSignatures.put(unknown.function(), args);
        List<FunctionTag> newDeclared = new ArrayList<>(declaredFunctions);
        if (!newDeclared.contains(unknown.function())) {
            newDeclared.add(unknown.function());
        }
        return new VariableMap(newUnknowns, newDeclared, spatialCoordinates, time, parameters, intervals, newSignatures);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableMap that)) return false;
        return unknowns.equals(that.unknowns)
                && declaredFunctions.equals(that.declaredFunctions)
                && spatialCoordinates.equals(that.spatialCoordinates)
                && Objects.equals(time, that.time)
                && parameters.equals(that.parameters)
                && intervals.equals(that.intervals)
                && signatures.equals(that.signatures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unknowns, declaredFunctions, spatialCoordinates, time, parameters, intervals, signatures);
    }

    @Override
    public String toString() {
        return "VariableMap{unknowns=" + unknowns + ", spatial=" + spatialCoordinates + ", time=" + time
                + ", intervals=" + intervals + "}";
    }
}
