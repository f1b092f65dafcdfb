package org.matroid.engine.core;

import org.matroid.core.SearchBudget;
import org.matroid.core.id.GroundSet;
import org.matroid.core.set.SetFamily;
import org.matroid.engine.oracle.RankFunctionOracle;
import org.matroid.engine.oracle.RankOracle;
import org.matroid.engine.validation.CircuitAxioms;
import org.matroid.engine.validation.ValidationResult;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToIntFunction;

/**
 * Reference matroid answering rank queries from a caller-supplied rank function.
 *
 * <p>Circuits are enumerated from the rank function on first use and cached; they act as
 * the defining family for validation, export and isomorphism. The rank function must be
 * pure.</p>
 */
public final class RankFunctionMatroid<E extends Comparable<? super E>> implements Matroid<E> {
    private final GroundSet<E> groundSet;
    private final RankFunctionOracle oracle;
    private final String name;
    private final AtomicReference<SetFamily> circuitCache = new AtomicReference<>();

    private RankFunctionMatroid(GroundSet<E> groundSet, RankFunctionOracle oracle, String name) {
        this.groundSet = groundSet;
        this.oracle = oracle;
        this.name = name;
    }

    /**
     * @param groundset ground-set labels.
     * @param rankFunction rank of a labeled subset of the ground set.
     */
    public static <E extends Comparable<? super E>> RankFunctionMatroid<E> of(
            Collection<? extends E> groundset,
            ToIntFunction<? super SortedSet<E>> rankFunction
    ) {
        Objects.requireNonNull(rankFunction, "rankFunction");
        GroundSet<E> groundSet = Labels.groundSet(groundset);
        RankFunctionOracle oracle = new RankFunctionOracle(
                groundSet.size(),
                subset -> rankFunction.applyAsInt(groundSet.decode(subset))
        );
        return new RankFunctionMatroid<>(groundSet, oracle, null);
    }

    @Override
    public GroundSet<E> groundSet() {
        return groundSet;
    }

    @Override
    public RankOracle oracle() {
        return oracle;
    }

    @Override
    public Encoding encoding() {
        return Encoding.CIRCUITS;
    }

    @Override
    public SetFamily definingFamily() {
        return circuitFamily();
    }

    @Override
    public SetFamily circuitFamily() {
        SetFamily cached = circuitCache.get();
        if (cached != null) {
            return cached;
        }
        circuitCache.compareAndSet(null, MatroidEnumeration.circuits(oracle, SearchBudget.defaults()));
        return circuitCache.get();
    }

    /**
     * Checks the circuit axioms on the enumerated circuits.
     */
    @Override
    public ValidationResult validate(SearchBudget budget) {
        return CircuitAxioms.validate(MatroidEnumeration.circuits(oracle, budget), budget);
    }

    /**
     * Relabels the enumerated circuits; the result is a {@link CircuitsMatroid}.
     */
    @Override
    public CircuitsMatroid<E> relabel(Map<E, E> mapping) {
        return CircuitsMatroid.of(this).relabel(mapping);
    }

    @Override
    public RankFunctionMatroid<E> withName(String name) {
        return new RankFunctionMatroid<>(groundSet, oracle, name);
    }

    @Override
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    /**
     * Exports the enumerated circuits; rebuilding yields a {@link CircuitsMatroid}.
     */
    @Override
    public MatroidState<E> exportState() {
        return CircuitsMatroid.of(this).exportState();
    }

    @Override
    public String toString() {
        String description = "Matroid of rank " + rank() + " on " + groundSet.size() + " elements given by a rank function";
        return name == null ? description : name + ": " + description;
    }
}
