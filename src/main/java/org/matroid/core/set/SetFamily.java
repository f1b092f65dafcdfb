package org.matroid.core.set;

import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectSet;
import it.unimi.dsi.fastutil.objects.ObjectSets;
import org.matroid.core.MatroidException;
import org.matroid.core.SearchBudget;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Immutable collection of distinct subsets of a fixed ground set, partitioned by an integer key.
 *
 * <p>Contract summary:</p>
 * <ul>
 * <li>Partitions are iterated in increasing key order; within a partition, in insertion order.</li>
 * <li>A subset is stored once; later duplicates (under any key) are dropped.</li>
 * <li>Every element index must be below the ground-set size.</li>
 * </ul>
 */
public final class SetFamily implements Iterable<ElementSet> {

    private final int groundSetSize;
    private final Int2ObjectSortedMap<ObjectLinkedOpenHashSet<ElementSet>> partitions;
    private final ObjectOpenHashSet<ElementSet> members;
    private final int hash;

    private SetFamily(int groundSetSize, Int2ObjectSortedMap<ObjectLinkedOpenHashSet<ElementSet>> partitions) {
        this.groundSetSize = groundSetSize;
        this.partitions = partitions;
        this.members = new ObjectOpenHashSet<>();
        int h = 0;
        for (Int2ObjectMap.Entry<ObjectLinkedOpenHashSet<ElementSet>> entry : partitions.int2ObjectEntrySet()) {
            members.addAll(entry.getValue());
            for (ElementSet set : entry.getValue()) {
                h += 31 * entry.getIntKey() + set.hashCode();
            }
        }
        this.members.trim();
        this.hash = 31 * groundSetSize + h;
    }

    /**
     * Builds a family partitioned by subset size.
     *
     * @param groundSetSize number of ground-set elements.
     * @param sets subsets; duplicates are merged.
     */
    public static SetFamily bySize(int groundSetSize, Collection<ElementSet> sets) {
        return byKey(groundSetSize, sets, ElementSet::cardinality);
    }

    /**
     * Builds a family whose partition key is computed per subset.
     *
     * @param groundSetSize number of ground-set elements.
     * @param sets subsets; duplicates are merged.
     * @param key partition key function.
     */
    public static SetFamily byKey(int groundSetSize, Collection<ElementSet> sets, ToIntFunction<ElementSet> key) {
        Objects.requireNonNull(sets, "sets");
        Objects.requireNonNull(key, "key");
        Builder builder = new Builder(groundSetSize);
        for (ElementSet set : sets) {
            builder.add(key.applyAsInt(Objects.requireNonNull(set, "set")), set);
        }
        return builder.build();
    }

    /**
     * Builds a family from explicit key partitions.
     *
     * @param groundSetSize number of ground-set elements.
     * @param keyed partitions by key; a subset repeated under a second key keeps its lowest key.
     */
    public static SetFamily byKey(int groundSetSize, Map<Integer, ? extends Collection<ElementSet>> keyed) {
        Objects.requireNonNull(keyed, "keyed");
        List<Integer> keys = new ArrayList<>(keyed.keySet());
        for (Integer key : keys) {
            Objects.requireNonNull(key, "key");
        }
        keys.sort(null);
        Builder builder = new Builder(groundSetSize);
        for (Integer key : keys) {
            for (ElementSet set : keyed.get(key)) {
                builder.add(key, Objects.requireNonNull(set, "set"));
            }
        }
        return builder.build();
    }

    public int groundSetSize() {
        return groundSetSize;
    }

    /**
     * Returns total number of distinct subsets.
     */
    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public boolean contains(ElementSet set) {
        return set != null && members.contains(set);
    }

    /**
     * Returns the keys of non-empty partitions in ascending order.
     */
    public IntSortedSet keys() {
        return IntSortedSets.unmodifiable(partitions.keySet());
    }

    /**
     * Returns the subsets stored under one key, or an empty set.
     */
    public ObjectSet<ElementSet> partition(int key) {
        ObjectLinkedOpenHashSet<ElementSet> sets = partitions.get(key);
        return sets == null ? ObjectSets.emptySet() : ObjectSets.unmodifiable(sets);
    }

    /**
     * Returns the key under which a subset is stored, or -1 when absent.
     */
    public int keyOf(ElementSet set) {
        if (!contains(set)) {
            return -1;
        }
        for (Int2ObjectMap.Entry<ObjectLinkedOpenHashSet<ElementSet>> entry : partitions.int2ObjectEntrySet()) {
            if (entry.getValue().contains(set)) {
                return entry.getIntKey();
            }
        }
        return -1;
    }

    /**
     * Returns the largest key, or -1 for an empty family.
     */
    public int maxKey() {
        return partitions.isEmpty() ? -1 : partitions.lastIntKey();
    }

    /**
     * Returns the smallest key, or -1 for an empty family.
     */
    public int minKey() {
        return partitions.isEmpty() ? -1 : partitions.firstIntKey();
    }

    /**
     * Returns the first member (in iteration order) that is a subset of {@code x},
     * scanning only partitions with key at most {@code maxKey}.
     */
    public Optional<ElementSet> firstSubsetOf(ElementSet x, int maxKey) {
        for (Int2ObjectMap.Entry<ObjectLinkedOpenHashSet<ElementSet>> entry : partitions.int2ObjectEntrySet()) {
            if (entry.getIntKey() > maxKey) {
                break;
            }
            for (ElementSet set : entry.getValue()) {
                if (set.isSubsetOf(x)) {
                    return Optional.of(set);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the key of the first partition holding a superset of {@code x}, or -1.
     */
    public int firstSupersetKey(ElementSet x) {
        for (Int2ObjectMap.Entry<ObjectLinkedOpenHashSet<ElementSet>> entry : partitions.int2ObjectEntrySet()) {
            for (ElementSet set : entry.getValue()) {
                if (x.isSubsetOf(set)) {
                    return entry.getIntKey();
                }
            }
        }
        return -1;
    }

    /**
     * Returns the first superset of {@code x} in increasing key order.
     */
    public Optional<ElementSet> firstSuperset(ElementSet x) {
        for (ObjectLinkedOpenHashSet<ElementSet> sets : partitions.values()) {
            for (ElementSet set : sets) {
                if (x.isSubsetOf(set)) {
                    return Optional.of(set);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns all members in iteration order.
     */
    public List<ElementSet> toList() {
        List<ElementSet> out = new ArrayList<>(members.size());
        forEach(out::add);
        return out;
    }

    /**
     * Looks for a ground-set permutation mapping this family onto {@code other}.
     *
     * @param other target family.
     * @param budget search budget.
     * @return {@code f} with {@code f[i]} the image of element {@code i}, or empty.
     */
    public Optional<int[]> isomorphismTo(SetFamily other, SearchBudget budget) {
        return SetSystemIsomorphism.find(this, other, budget);
    }

    /**
     * Unbounded variant of {@link #isomorphismTo(SetFamily, SearchBudget)}.
     */
    public Optional<int[]> isomorphismTo(SetFamily other) {
        return isomorphismTo(other, SearchBudget.unlimited());
    }

    @Override
    public Iterator<ElementSet> iterator() {
        Iterator<ObjectLinkedOpenHashSet<ElementSet>> outer = partitions.values().iterator();
        return new Iterator<>() {
            private Iterator<ElementSet> inner = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!inner.hasNext() && outer.hasNext()) {
                    inner = outer.next().iterator();
                }
                return inner.hasNext();
            }

            @Override
            public ElementSet next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return inner.next();
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SetFamily other)) {
            return false;
        }
        if (groundSetSize != other.groundSetSize || hash != other.hash || size() != other.size()) {
            return false;
        }
        if (!partitions.keySet().equals(other.partitions.keySet())) {
            return false;
        }
        for (Int2ObjectMap.Entry<ObjectLinkedOpenHashSet<ElementSet>> entry : partitions.int2ObjectEntrySet()) {
            if (!entry.getValue().equals(other.partitions.get(entry.getIntKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean firstKey = true;
        for (Int2ObjectMap.Entry<ObjectLinkedOpenHashSet<ElementSet>> entry : partitions.int2ObjectEntrySet()) {
            if (!firstKey) {
                sb.append(", ");
            }
            firstKey = false;
            sb.append(entry.getIntKey()).append(": ").append(entry.getValue());
        }
        return sb.append('}').toString();
    }

    /**
     * Incremental builder; validates indices and drops duplicates.
     */
    public static final class Builder {
        private final int groundSetSize;
        private final Int2ObjectAVLTreeMap<ObjectLinkedOpenHashSet<ElementSet>> partitions = new Int2ObjectAVLTreeMap<>();
        private final ObjectOpenHashSet<ElementSet> seen = new ObjectOpenHashSet<>();

        public Builder(int groundSetSize) {
            if (groundSetSize < 0) {
                throw new IllegalArgumentException("groundSetSize must be >= 0");
            }
            this.groundSetSize = groundSetSize;
        }

        /**
         * Adds a subset under a key.
         *
         * @return false when the subset was already present.
         * @throws MatroidException with {@link MatroidException#INVALID_INPUT} for out-of-range indices.
         */
        public boolean add(int key, ElementSet set) {
            Objects.requireNonNull(set, "set");
            if (set.length() > groundSetSize) {
                throw new MatroidException(
                        MatroidException.INVALID_INPUT,
                        "subset " + set + " is not contained in a ground set of size " + groundSetSize
                );
            }
            if (!seen.add(set)) {
                return false;
            }
            ObjectLinkedOpenHashSet<ElementSet> partition = partitions.get(key);
            if (partition == null) {
                partition = new ObjectLinkedOpenHashSet<>();
                partitions.put(key, partition);
            }
            partition.add(set);
            return true;
        }

        public SetFamily build() {
            Int2ObjectAVLTreeMap<ObjectLinkedOpenHashSet<ElementSet>> copy = new Int2ObjectAVLTreeMap<>();
            for (Int2ObjectMap.Entry<ObjectLinkedOpenHashSet<ElementSet>> entry : partitions.int2ObjectEntrySet()) {
                copy.put(entry.getIntKey(), new ObjectLinkedOpenHashSet<>(entry.getValue()));
            }
            return new SetFamily(groundSetSize, copy);
        }
    }
}
