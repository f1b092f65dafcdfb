package org.matroid.engine.oracle;

import org.matroid.core.MatroidException;
import org.matroid.core.set.ElementSet;

/**
 * Rank and independence queries over element-index subsets.
 *
 * <p>Only {@link #rank(ElementSet)} is mandatory; the remaining queries derive from it
 * and are overridden by encodings that can answer them directly.</p>
 */
public interface RankOracle {

    /**
     * Returns the number of ground-set elements the oracle answers for.
     */
    int groundSetSize();

    /**
     * Returns the rank of a subset.
     *
     * @param x subset of the ground set.
     * @return size of a largest independent subset of {@code x}.
     */
    int rank(ElementSet x);

    /**
     * Returns the rank of the whole ground set.
     */
    default int fullRank() {
        return rank(ElementSet.range(groundSetSize()));
    }

    /**
     * Returns true when {@code x} has no dependent subset.
     */
    default boolean isIndependent(ElementSet x) {
        return rank(x) == x.cardinality();
    }

    /**
     * Returns a maximal independent subset of {@code x}.
     *
     * <p>Greedy scan in ascending index order.</p>
     */
    default ElementSet maxIndependent(ElementSet x) {
        ElementSet independent = ElementSet.empty();
        for (int e = x.first(); e >= 0; e = x.nextElement(e + 1)) {
            ElementSet extended = independent.with(e);
            if (rank(extended) == extended.cardinality()) {
                independent = extended;
            }
        }
        return independent;
    }

    /**
     * Returns a circuit contained in {@code x}.
     *
     * @throws MatroidException with {@link MatroidException#NO_CIRCUIT_FOUND} when {@code x} is independent.
     */
    default ElementSet circuit(ElementSet x) {
        if (isIndependent(x)) {
            throw new MatroidException(MatroidException.NO_CIRCUIT_FOUND, "subset " + x + " is independent");
        }
        ElementSet dependent = x;
        for (int e = x.first(); e >= 0; e = x.nextElement(e + 1)) {
            ElementSet smaller = dependent.without(e);
            if (!isIndependent(smaller)) {
                dependent = smaller;
            }
        }
        return dependent;
    }

    /**
     * Returns the smallest closed set containing {@code x}.
     */
    default ElementSet closure(ElementSet x) {
        int r = rank(x);
        ElementSet closed = x;
        for (int e = 0; e < groundSetSize(); e++) {
            if (!x.contains(e) && rank(x.with(e)) == r) {
                closed = closed.with(e);
            }
        }
        return closed;
    }

    /**
     * Returns true when {@code x} equals its closure.
     */
    default boolean isClosed(ElementSet x) {
        return closure(x).equals(x);
    }
}
