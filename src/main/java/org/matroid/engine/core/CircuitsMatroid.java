package org.matroid.engine.core;

import org.matroid.core.SearchBudget;
import org.matroid.core.id.GroundSet;
import org.matroid.core.set.SetFamily;
import org.matroid.engine.oracle.CircuitsOracle;
import org.matroid.engine.oracle.RankOracle;
import org.matroid.engine.validation.CircuitAxioms;
import org.matroid.engine.validation.ValidationResult;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Matroid stored as its circuits, partitioned by circuit size.
 *
 * <p>Construction normalizes duplicates and computes the rank but does not check the
 * circuit axioms; call {@link #isValid()} for that. Immutable.</p>
 */
public final class CircuitsMatroid<E extends Comparable<? super E>> implements Matroid<E> {
    private final GroundSet<E> groundSet;
    private final SetFamily circuits;
    private final CircuitsOracle oracle;
    private final int rank;
    private final String name;

    private CircuitsMatroid(GroundSet<E> groundSet, SetFamily circuits, String name) {
        this.groundSet = groundSet;
        this.circuits = circuits;
        this.oracle = new CircuitsOracle(circuits);
        this.rank = oracle.fullRank();
        this.name = name;
    }

    /**
     * Copies the ground set and circuits of another matroid.
     */
    public static <E extends Comparable<? super E>> CircuitsMatroid<E> of(Matroid<E> matroid) {
        Objects.requireNonNull(matroid, "matroid");
        if (matroid instanceof CircuitsMatroid<E> circuitsMatroid) {
            return circuitsMatroid;
        }
        GroundSet<E> groundSet = matroid.groundSet();
        return new CircuitsMatroid<>(
                groundSet,
                SetFamily.bySize(groundSet.size(), matroid.circuitFamily().toList()),
                matroid.name().orElse(null)
        );
    }

    /**
     * Builds a matroid from explicit circuits.
     *
     * @param groundset ground-set labels.
     * @param circuits circuits as label collections; duplicates are merged.
     */
    public static <E extends Comparable<? super E>> CircuitsMatroid<E> of(
            Collection<? extends E> groundset,
            Collection<? extends Collection<? extends E>> circuits
    ) {
        GroundSet<E> groundSet = Labels.groundSet(groundset);
        return new CircuitsMatroid<>(groundSet, SetFamily.bySize(groundSet.size(), Labels.encodeAll(groundSet, circuits)), null);
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
        return circuits;
    }

    @Override
    public SetFamily circuitFamily() {
        return circuits;
    }

    @Override
    public int rank() {
        return rank;
    }

    @Override
    public ValidationResult validate(SearchBudget budget) {
        return CircuitAxioms.validate(circuits, budget);
    }

    @Override
    public CircuitsMatroid<E> relabel(Map<E, E> mapping) {
        GroundSet<E> relabeled = Labels.relabel(groundSet, mapping);
        return new CircuitsMatroid<>(
                relabeled,
                SetFamily.bySize(relabeled.size(), Labels.relabelAll(circuits, groundSet, relabeled, mapping)),
                name
        );
    }

    @Override
    public CircuitsMatroid<E> withName(String name) {
        return new CircuitsMatroid<>(groundSet, circuits, name);
    }

    @Override
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    @Override
    public MatroidState<E> exportState() {
        return MatroidState.<E>builder()
                .encoding(Encoding.CIRCUITS)
                .groundset(groundset())
                .definingSets(Labels.export(circuits, groundSet))
                .customName(name)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CircuitsMatroid<?> other)) {
            return false;
        }
        return rank == other.rank && groundSet.equals(other.groundSet) && circuits.equals(other.circuits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groundSet, circuits, rank);
    }

    @Override
    public String toString() {
        String description = "Matroid of rank " + rank + " on " + groundSet.size() + " elements with "
                + circuits.size() + " circuits";
        return name == null ? description : name + ": " + description;
    }
}
