package org.matroid.engine.core;

import org.matroid.core.MatroidException;
import org.matroid.core.SearchBudget;
import org.matroid.core.id.GroundSet;
import org.matroid.core.set.ElementSet;
import org.matroid.core.set.SetFamily;
import org.matroid.engine.iso.IsomorphismEngine;
import org.matroid.engine.lattice.InclusionPoset;
import org.matroid.engine.oracle.RankOracle;
import org.matroid.engine.validation.ValidationResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedSet;

/**
 * Finite matroid over comparable element labels.
 *
 * <p>Implementations supply a ground set, a rank oracle and their defining family; every
 * other query has a default derived from those. Derived enumerations are exponential in
 * the ground-set size and run under {@link SearchBudget#defaults()}.</p>
 *
 * <p>Subsets passed in must lie inside the ground set; an unknown label raises
 * {@link MatroidException} with {@link MatroidException#INVALID_INPUT}.</p>
 *
 * @param <E> element label type.
 */
public interface Matroid<E extends Comparable<? super E>> {

    /**
     * Returns the label index of the ground set.
     */
    GroundSet<E> groundSet();

    /**
     * Returns the rank oracle answering index-level queries.
     */
    RankOracle oracle();

    /**
     * Returns the encoding whose family {@link #definingFamily()} holds.
     */
    Encoding encoding();

    /**
     * Returns the stored defining family in index space.
     */
    SetFamily definingFamily();

    /**
     * Checks the axioms of this encoding's defining data.
     *
     * @param budget search budget.
     * @return valid, or the first violation found.
     */
    ValidationResult validate(SearchBudget budget);

    /**
     * Returns a copy over relabeled elements; labels missing from {@code mapping} are kept.
     *
     * <p>Rank is preserved only for injective mappings.</p>
     */
    Matroid<E> relabel(Map<E, E> mapping);

    /**
     * Returns a copy carrying a display name.
     */
    Matroid<E> withName(String name);

    /**
     * Returns the display name, if any.
     */
    Optional<String> name();

    /**
     * Exports construction data for {@link Matroids#fromState(MatroidState)}.
     */
    MatroidState<E> exportState();

    default SortedSet<E> groundset() {
        return groundSet().decode(groundSet().all());
    }

    default int size() {
        return groundSet().size();
    }

    /**
     * Returns the rank of the matroid.
     */
    default int rank() {
        return oracle().fullRank();
    }

    default int rank(Collection<? extends E> subset) {
        return oracle().rank(encode(subset));
    }

    default boolean isIndependent(Collection<? extends E> subset) {
        return oracle().isIndependent(encode(subset));
    }

    default boolean isDependent(Collection<? extends E> subset) {
        return !isIndependent(subset);
    }

    default boolean isBasis(Collection<? extends E> subset) {
        ElementSet x = encode(subset);
        return x.cardinality() == rank() && oracle().isIndependent(x);
    }

    default SortedSet<E> maxIndependent(Collection<? extends E> subset) {
        return groundSet().decode(oracle().maxIndependent(encode(subset)));
    }

    /**
     * Returns a circuit inside {@code subset}.
     *
     * @throws MatroidException with {@link MatroidException#NO_CIRCUIT_FOUND} when {@code subset} is independent.
     */
    default SortedSet<E> circuit(Collection<? extends E> subset) {
        return groundSet().decode(oracle().circuit(encode(subset)));
    }

    default SortedSet<E> closure(Collection<? extends E> subset) {
        return groundSet().decode(oracle().closure(encode(subset)));
    }

    default boolean isClosed(Collection<? extends E> subset) {
        return oracle().isClosed(encode(subset));
    }

    /**
     * Returns all circuits keyed by size, in index space.
     */
    default SetFamily circuitFamily() {
        return MatroidEnumeration.circuits(oracle(), SearchBudget.defaults());
    }

    /**
     * Returns all flats keyed by rank, in index space.
     */
    default SetFamily flatFamily() {
        return MatroidEnumeration.flats(oracle(), SearchBudget.defaults());
    }

    default List<SortedSet<E>> circuits() {
        return decodeAll(circuitFamily());
    }

    default List<SortedSet<E>> circuits(int size) {
        return decodeAll(circuitFamily().partition(size));
    }

    /**
     * Returns circuits of size at most the rank.
     */
    default List<SortedSet<E>> nonspanningCircuits() {
        SetFamily circuits = circuitFamily();
        List<ElementSet> out = new ArrayList<>();
        for (int size : circuits.keys().headSet(rank() + 1)) {
            out.addAll(circuits.partition(size));
        }
        return decodeAll(out);
    }

    /**
     * Returns the size of a smallest circuit, or empty when every subset is independent.
     */
    default OptionalInt girth() {
        SetFamily circuits = circuitFamily();
        return circuits.isEmpty() ? OptionalInt.empty() : OptionalInt.of(circuits.minKey());
    }

    default List<SortedSet<E>> bases() {
        return decodeAll(MatroidEnumeration.bases(oracle(), SearchBudget.defaults()));
    }

    default List<SortedSet<E>> flats(int rank) {
        return decodeAll(flatFamily().partition(rank));
    }

    /**
     * Returns the flats of rank {@code rank() - 1}.
     */
    default List<SortedSet<E>> hyperplanes() {
        return flats(rank() - 1);
    }

    /**
     * Returns the flats as an inclusion poset in index space.
     */
    default InclusionPoset latticeOfFlats() {
        return InclusionPoset.of(flatFamily().toList());
    }

    /**
     * Returns the number of flats at each rank.
     */
    default int[] whitneyNumbers2() {
        return MatroidEnumeration.whitneyNumbers2(flatFamily());
    }

    /**
     * Returns the absolute Möbius sums {@code |Σ μ(0, x)|} per rank of the lattice of flats.
     */
    default int[] whitneyNumbers() {
        return MatroidEnumeration.whitneyNumbers(latticeOfFlats());
    }

    /**
     * Returns every circuit minus its smallest element under {@code ordering}.
     *
     * @param ordering permutation of the ground set.
     */
    default List<SortedSet<E>> brokenCircuits(List<E> ordering) {
        return decodeAll(BrokenCircuits.brokenCircuits(circuitFamily(), BrokenCircuits.positions(groundSet(), ordering)));
    }

    /**
     * Returns the subsets containing no broken circuit under {@code ordering}.
     *
     * @param ordering permutation of the ground set.
     */
    default List<SortedSet<E>> noBrokenCircuitsSets(List<E> ordering) {
        int[] positions = BrokenCircuits.positions(groundSet(), ordering);
        return decodeAll(BrokenCircuits.nbcSets(circuitFamily(), positions, SearchBudget.defaults()));
    }

    default List<SortedSet<E>> noBrokenCircuitsSets() {
        return noBrokenCircuitsSets(groundSet().elements());
    }

    default boolean isValid() {
        return validate().valid();
    }

    default ValidationResult validate() {
        return validate(SearchBudget.defaults());
    }

    default boolean isIsomorphic(Matroid<E> other) {
        return isomorphism(other).isPresent();
    }

    /**
     * Returns a ground-set bijection carrying this matroid onto {@code other}, if one exists.
     */
    default Optional<Map<E, E>> isomorphism(Matroid<E> other) {
        return IsomorphismEngine.isomorphism(this, other, SearchBudget.defaults());
    }

    /**
     * Encodes labels, reporting unknown ones as {@link MatroidException#INVALID_INPUT}.
     */
    default ElementSet encode(Collection<? extends E> subset) {
        return Labels.encode(groundSet(), subset);
    }

    private List<SortedSet<E>> decodeAll(Iterable<ElementSet> sets) {
        List<SortedSet<E>> out = new ArrayList<>();
        for (ElementSet set : sets) {
            out.add(groundSet().decode(set));
        }
        return out;
    }
}
