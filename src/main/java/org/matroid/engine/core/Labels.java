package org.matroid.engine.core;

import lombok.experimental.UtilityClass;
import org.matroid.core.MatroidException;
import org.matroid.core.id.GroundSet;
import org.matroid.core.set.ElementSet;
import org.matroid.core.set.SetFamily;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Translation between labeled subsets and index-space families, shared by the encodings.
 */
@UtilityClass
class Labels {

    static <E extends Comparable<? super E>> GroundSet<E> groundSet(Collection<? extends E> elements) {
        try {
            return GroundSet.of(Objects.requireNonNull(elements, "groundset"));
        } catch (IllegalArgumentException ex) {
            throw new MatroidException(MatroidException.INVALID_INPUT, ex.getMessage(), ex);
        }
    }

    static <E extends Comparable<? super E>> ElementSet encode(GroundSet<E> groundSet, Collection<? extends E> subset) {
        try {
            return groundSet.encode(Objects.requireNonNull(subset, "subset"));
        } catch (GroundSet.UnknownElementException | IllegalArgumentException ex) {
            throw new MatroidException(
                    MatroidException.INVALID_INPUT,
                    "subset " + subset + " is not contained in ground set " + groundSet,
                    ex
            );
        }
    }

    static <E extends Comparable<? super E>> List<ElementSet> encodeAll(
            GroundSet<E> groundSet,
            Collection<? extends Collection<? extends E>> subsets
    ) {
        Objects.requireNonNull(subsets, "subsets");
        List<ElementSet> out = new ArrayList<>(subsets.size());
        for (Collection<? extends E> subset : subsets) {
            out.add(encode(groundSet, subset));
        }
        return out;
    }

    static <E extends Comparable<? super E>> SetFamily encodeKeyed(
            GroundSet<E> groundSet,
            Map<Integer, ? extends Collection<? extends Collection<? extends E>>> keyed
    ) {
        Objects.requireNonNull(keyed, "keyed");
        TreeMap<Integer, List<ElementSet>> encoded = new TreeMap<>();
        for (Map.Entry<Integer, ? extends Collection<? extends Collection<? extends E>>> entry : keyed.entrySet()) {
            Integer key = entry.getKey();
            if (key == null || key < 0) {
                throw new MatroidException(MatroidException.INVALID_INPUT, "partition key must be a non-negative integer: " + key);
            }
            encoded.put(key, encodeAll(groundSet, entry.getValue()));
        }
        return SetFamily.byKey(groundSet.size(), encoded);
    }

    /**
     * Applies {@code mapping} to every label; labels without an entry are kept.
     */
    static <E extends Comparable<? super E>> GroundSet<E> relabel(GroundSet<E> groundSet, Map<E, E> mapping) {
        Objects.requireNonNull(mapping, "mapping");
        List<E> labels = new ArrayList<>(groundSet.size());
        for (E element : groundSet.elements()) {
            labels.add(image(element, mapping));
        }
        return GroundSet.of(labels);
    }

    static <E extends Comparable<? super E>> ElementSet relabel(
            ElementSet set,
            GroundSet<E> from,
            GroundSet<E> to,
            Map<E, E> mapping
    ) {
        BitSet bits = new BitSet(to.size());
        for (int index : set.toArray()) {
            bits.set(to.indexOf(image(from.elementAt(index), mapping)));
        }
        return ElementSet.of(bits);
    }

    static <E extends Comparable<? super E>> List<ElementSet> relabelAll(
            Iterable<ElementSet> sets,
            GroundSet<E> from,
            GroundSet<E> to,
            Map<E, E> mapping
    ) {
        List<ElementSet> out = new ArrayList<>();
        for (ElementSet set : sets) {
            out.add(relabel(set, from, to, mapping));
        }
        return out;
    }

    /**
     * Relabels a family keeping each subset's key.
     */
    static <E extends Comparable<? super E>> SetFamily relabelKeyed(
            SetFamily family,
            GroundSet<E> from,
            GroundSet<E> to,
            Map<E, E> mapping
    ) {
        SetFamily.Builder builder = new SetFamily.Builder(to.size());
        for (int key : family.keys()) {
            for (ElementSet set : family.partition(key)) {
                builder.add(key, relabel(set, from, to, mapping));
            }
        }
        return builder.build();
    }

    static <E extends Comparable<? super E>> SortedMap<Integer, List<SortedSet<E>>> export(
            SetFamily family,
            GroundSet<E> groundSet
    ) {
        SortedMap<Integer, List<SortedSet<E>>> out = new TreeMap<>();
        for (int key : family.keys()) {
            List<SortedSet<E>> sets = new ArrayList<>();
            for (ElementSet set : family.partition(key)) {
                sets.add(groundSet.decode(set));
            }
            out.put(key, sets);
        }
        return out;
    }

    private static <E> E image(E element, Map<E, E> mapping) {
        E mapped = mapping.get(element);
        return mapped == null ? element : mapped;
    }
}
