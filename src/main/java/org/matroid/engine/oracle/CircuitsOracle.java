package org.matroid.engine.oracle;

import org.matroid.core.MatroidException;
import org.matroid.core.set.ElementSet;
import org.matroid.core.set.SetFamily;

import java.util.Objects;

/**
 * Rank oracle answering from a circuit family partitioned by circuit size.
 *
 * <p>Immutable; safe for concurrent readers.</p>
 */
public final class CircuitsOracle implements RankOracle {
    private final SetFamily circuits;

    /**
     * @param circuits circuits keyed by cardinality.
     */
    public CircuitsOracle(SetFamily circuits) {
        this.circuits = Objects.requireNonNull(circuits, "circuits");
    }

    @Override
    public int groundSetSize() {
        return circuits.groundSetSize();
    }

    /**
     * True iff no circuit of size at most {@code |x|} lies inside {@code x}.
     */
    @Override
    public boolean isIndependent(ElementSet x) {
        return circuits.firstSubsetOf(x, x.cardinality()).isEmpty();
    }

    /**
     * Drops one element (the smallest) of every circuit found inside the working set,
     * scanning circuits by increasing size. Removing an element of a contained circuit
     * never changes the span, so the remainder is a basis of {@code x}.
     */
    @Override
    public ElementSet maxIndependent(ElementSet x) {
        ElementSet working = x;
        for (int size : circuits.keys()) {
            if (size > working.cardinality()) {
                break;
            }
            for (ElementSet circuit : circuits.partition(size)) {
                if (circuit.isSubsetOf(working)) {
                    working = working.without(circuit.first());
                }
            }
        }
        return working;
    }

    @Override
    public int rank(ElementSet x) {
        return maxIndependent(x).cardinality();
    }

    /**
     * Returns the first contained circuit in family order.
     */
    @Override
    public ElementSet circuit(ElementSet x) {
        return circuits.firstSubsetOf(x, x.cardinality())
                .orElseThrow(() -> new MatroidException(
                        MatroidException.NO_CIRCUIT_FOUND,
                        "subset " + x + " is independent"
                ));
    }

    /**
     * Adds every element {@code e} that completes a circuit {@code C} with {@code C - e} inside {@code x}.
     */
    @Override
    public ElementSet closure(ElementSet x) {
        ElementSet closed = x;
        for (ElementSet circuit : circuits) {
            ElementSet outside = circuit.minus(x);
            if (outside.cardinality() == 1) {
                closed = closed.union(outside);
            }
        }
        return closed;
    }

    public SetFamily circuits() {
        return circuits;
    }
}
