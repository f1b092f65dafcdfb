package org.matroid.core.set;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Immutable subset of a ground set, expressed as element indices.
 *
 * <p>The backing {@link BitSet} is copied on the way in and never exposed, so instances
 * can be shared freely and used as hash keys.</p>
 */
public final class ElementSet implements Comparable<ElementSet> {
    private static final ElementSet EMPTY = new ElementSet(new BitSet(0));

    private final BitSet bits;
    private final int cardinality;
    private final int hash;

    private ElementSet(BitSet bits) {
        this.bits = bits;
        this.cardinality = bits.cardinality();
        this.hash = bits.hashCode();
    }

    /**
     * Returns the empty set.
     */
    public static ElementSet empty() {
        return EMPTY;
    }

    /**
     * Creates a set from element indices.
     *
     * @param indices non-negative element indices; duplicates are ignored.
     * @return immutable set.
     */
    public static ElementSet of(int... indices) {
        BitSet bits = new BitSet();
        for (int index : indices) {
            if (index < 0) {
                throw new IllegalArgumentException("element index must be >= 0: " + index);
            }
            bits.set(index);
        }
        return new ElementSet(bits);
    }

    /**
     * Creates a set from a bit set copy.
     *
     * @param bits source bits.
     * @return immutable set.
     */
    public static ElementSet of(BitSet bits) {
        return new ElementSet((BitSet) bits.clone());
    }

    /**
     * Returns {@code {0, ..., size - 1}}.
     */
    public static ElementSet range(int size) {
        BitSet bits = new BitSet(size);
        bits.set(0, size);
        return new ElementSet(bits);
    }

    public int cardinality() {
        return cardinality;
    }

    public boolean isEmpty() {
        return cardinality == 0;
    }

    public boolean contains(int index) {
        return index >= 0 && bits.get(index);
    }

    /**
     * Returns the largest index plus one, or 0 for the empty set.
     */
    public int length() {
        return bits.length();
    }

    /**
     * Returns the smallest index, or -1 when empty.
     */
    public int first() {
        return bits.nextSetBit(0);
    }

    /**
     * Returns the next index at or after {@code from}, or -1.
     */
    public int nextElement(int from) {
        return bits.nextSetBit(from);
    }

    public boolean isSubsetOf(ElementSet other) {
        if (cardinality > other.cardinality) {
            return false;
        }
        BitSet rest = (BitSet) bits.clone();
        rest.andNot(other.bits);
        return rest.isEmpty();
    }

    public boolean isProperSubsetOf(ElementSet other) {
        return cardinality < other.cardinality && isSubsetOf(other);
    }

    public boolean intersects(ElementSet other) {
        return bits.intersects(other.bits);
    }

    public ElementSet union(ElementSet other) {
        BitSet result = (BitSet) bits.clone();
        result.or(other.bits);
        return new ElementSet(result);
    }

    public ElementSet intersection(ElementSet other) {
        BitSet result = (BitSet) bits.clone();
        result.and(other.bits);
        return new ElementSet(result);
    }

    public ElementSet minus(ElementSet other) {
        BitSet result = (BitSet) bits.clone();
        result.andNot(other.bits);
        return new ElementSet(result);
    }

    public ElementSet with(int index) {
        if (contains(index)) {
            return this;
        }
        BitSet result = (BitSet) bits.clone();
        result.set(index);
        return new ElementSet(result);
    }

    public ElementSet without(int index) {
        if (!contains(index)) {
            return this;
        }
        BitSet result = (BitSet) bits.clone();
        result.clear(index);
        return new ElementSet(result);
    }

    /**
     * Returns a copy of the backing bits.
     */
    public BitSet toBitSet() {
        return (BitSet) bits.clone();
    }

    /**
     * Returns the indices in ascending order.
     */
    public int[] toArray() {
        return bits.stream().toArray();
    }

    /**
     * Orders by cardinality first, then lexicographically by ascending indices.
     */
    @Override
    public int compareTo(ElementSet other) {
        if (cardinality != other.cardinality) {
            return Integer.compare(cardinality, other.cardinality);
        }
        int i = bits.nextSetBit(0);
        int j = other.bits.nextSetBit(0);
        while (i >= 0 && j >= 0) {
            if (i != j) {
                return Integer.compare(i, j);
            }
            i = bits.nextSetBit(i + 1);
            j = other.bits.nextSetBit(j + 1);
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ElementSet other)) {
            return false;
        }
        return hash == other.hash && cardinality == other.cardinality && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray()).replace('[', '{').replace(']', '}');
    }
}
