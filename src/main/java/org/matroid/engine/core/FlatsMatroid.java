package org.matroid.engine.core;

import org.matroid.core.SearchBudget;
import org.matroid.core.id.GroundSet;
import org.matroid.core.set.SetFamily;
import org.matroid.engine.oracle.FlatsOracle;
import org.matroid.engine.oracle.RankOracle;
import org.matroid.engine.validation.FlatAxioms;
import org.matroid.engine.validation.ValidationResult;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Matroid stored as its flats, partitioned by rank.
 *
 * <p>Rank is the highest supplied rank key. Closure is answered by the lowest-rank flat
 * containing the query. The flats are not checked on construction; see {@link #isValid()}.</p>
 */
public final class FlatsMatroid<E extends Comparable<? super E>> implements Matroid<E> {
    private final GroundSet<E> groundSet;
    private final SetFamily flats;
    private final FlatsOracle oracle;
    private final String name;

    private FlatsMatroid(GroundSet<E> groundSet, SetFamily flats, String name) {
        this.groundSet = groundSet;
        this.flats = flats;
        this.oracle = new FlatsOracle(flats);
        this.name = name;
    }

    /**
     * Copies the ground set and the flats of every rank of another matroid.
     */
    public static <E extends Comparable<? super E>> FlatsMatroid<E> of(Matroid<E> matroid) {
        Objects.requireNonNull(matroid, "matroid");
        if (matroid instanceof FlatsMatroid<E> flatsMatroid) {
            return flatsMatroid;
        }
        return new FlatsMatroid<>(matroid.groundSet(), matroid.flatFamily(), matroid.name().orElse(null));
    }

    /**
     * Builds a matroid from rank-indexed flats.
     *
     * @param groundset ground-set labels.
     * @param flats flats grouped by rank; a flat listed under several ranks keeps the lowest.
     */
    public static <E extends Comparable<? super E>> FlatsMatroid<E> of(
            Collection<? extends E> groundset,
            Map<Integer, ? extends Collection<? extends Collection<? extends E>>> flats
    ) {
        GroundSet<E> groundSet = Labels.groundSet(groundset);
        return new FlatsMatroid<>(groundSet, Labels.encodeKeyed(groundSet, flats), null);
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
        return Encoding.FLATS;
    }

    @Override
    public SetFamily definingFamily() {
        return flats;
    }

    @Override
    public SetFamily flatFamily() {
        return flats;
    }

    @Override
    public ValidationResult validate(SearchBudget budget) {
        return FlatAxioms.validate(flats, budget);
    }

    @Override
    public FlatsMatroid<E> relabel(Map<E, E> mapping) {
        GroundSet<E> relabeled = Labels.relabel(groundSet, mapping);
        return new FlatsMatroid<>(relabeled, Labels.relabelKeyed(flats, groundSet, relabeled, mapping), name);
    }

    @Override
    public FlatsMatroid<E> withName(String name) {
        return new FlatsMatroid<>(groundSet, flats, name);
    }

    @Override
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    @Override
    public MatroidState<E> exportState() {
        return MatroidState.<E>builder()
                .encoding(Encoding.FLATS)
                .groundset(groundset())
                .definingSets(Labels.export(flats, groundSet))
                .customName(name)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FlatsMatroid<?> other)) {
            return false;
        }
        return groundSet.equals(other.groundSet) && flats.equals(other.flats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groundSet, flats);
    }

    @Override
    public String toString() {
        String description = "Matroid of rank " + rank() + " on " + groundSet.size() + " elements with "
                + flats.size() + " flats";
        return name == null ? description : name + ": " + description;
    }
}
