package org.matroid.engine.core;

import org.matroid.core.SearchBudget;
import org.matroid.core.id.GroundSet;
import org.matroid.core.set.SetFamily;
import org.matroid.engine.lattice.InclusionPoset;
import org.matroid.engine.oracle.FlatsOracle;
import org.matroid.engine.oracle.RankOracle;
import org.matroid.engine.validation.LatticeAxioms;
import org.matroid.engine.validation.ValidationResult;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Matroid stored as the lattice of its flats under inclusion.
 *
 * <p>Each flat's rank is its rank in the poset, and queries go through the same
 * lowest-superset lookup as {@link FlatsMatroid}. Validation checks that the poset is a
 * geometric lattice topped by the ground set.</p>
 */
public final class LatticeOfFlatsMatroid<E extends Comparable<? super E>> implements Matroid<E> {
    private final GroundSet<E> groundSet;
    private final InclusionPoset lattice;
    private final SetFamily flats;
    private final FlatsOracle oracle;
    private final String name;

    private LatticeOfFlatsMatroid(GroundSet<E> groundSet, InclusionPoset lattice, String name) {
        this.groundSet = groundSet;
        this.lattice = lattice;
        this.flats = SetFamily.byKey(groundSet.size(), lattice.elements(), set -> lattice.rank(lattice.indexOf(set)));
        this.oracle = new FlatsOracle(flats);
        this.name = name;
    }

    /**
     * Copies the ground set and lattice of flats of another matroid.
     */
    public static <E extends Comparable<? super E>> LatticeOfFlatsMatroid<E> of(Matroid<E> matroid) {
        Objects.requireNonNull(matroid, "matroid");
        if (matroid instanceof LatticeOfFlatsMatroid<E> latticeMatroid) {
            return latticeMatroid;
        }
        return new LatticeOfFlatsMatroid<>(matroid.groundSet(), matroid.latticeOfFlats(), matroid.name().orElse(null));
    }

    /**
     * Builds a matroid from the inclusion order of the given sets.
     *
     * @param groundset ground-set labels.
     * @param flats the flats; duplicates are merged.
     */
    public static <E extends Comparable<? super E>> LatticeOfFlatsMatroid<E> of(
            Collection<? extends E> groundset,
            Collection<? extends Collection<? extends E>> flats
    ) {
        GroundSet<E> groundSet = Labels.groundSet(groundset);
        return new LatticeOfFlatsMatroid<>(groundSet, InclusionPoset.of(Labels.encodeAll(groundSet, flats)), null);
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
        return Encoding.LATTICE_OF_FLATS;
    }

    /**
     * Returns the lattice elements keyed by their poset rank.
     */
    @Override
    public SetFamily definingFamily() {
        return flats;
    }

    @Override
    public SetFamily flatFamily() {
        return flats;
    }

    @Override
    public InclusionPoset latticeOfFlats() {
        return lattice;
    }

    @Override
    public int rank() {
        return lattice.rank();
    }

    @Override
    public int[] whitneyNumbers() {
        return MatroidEnumeration.whitneyNumbers(lattice);
    }

    @Override
    public ValidationResult validate(SearchBudget budget) {
        return LatticeAxioms.validate(lattice, groundSet.size());
    }

    @Override
    public LatticeOfFlatsMatroid<E> relabel(Map<E, E> mapping) {
        GroundSet<E> relabeled = Labels.relabel(groundSet, mapping);
        return new LatticeOfFlatsMatroid<>(
                relabeled,
                InclusionPoset.of(Labels.relabelAll(lattice.elements(), groundSet, relabeled, mapping)),
                name
        );
    }

    @Override
    public LatticeOfFlatsMatroid<E> withName(String name) {
        return new LatticeOfFlatsMatroid<>(groundSet, lattice, name);
    }

    @Override
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    @Override
    public MatroidState<E> exportState() {
        return MatroidState.<E>builder()
                .encoding(Encoding.LATTICE_OF_FLATS)
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
        if (!(o instanceof LatticeOfFlatsMatroid<?> other)) {
            return false;
        }
        return groundSet.equals(other.groundSet) && lattice.equals(other.lattice);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groundSet, lattice);
    }

    @Override
    public String toString() {
        String description = "Matroid of rank " + rank() + " on " + groundSet.size() + " elements with "
                + lattice.size() + " flats";
        return name == null ? description : name + ": " + description;
    }
}
