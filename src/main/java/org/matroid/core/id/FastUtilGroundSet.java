package org.matroid.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.matroid.core.set.ElementSet;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable {@link GroundSet} backed by a fastutil label-to-index map and a reverse array.
 *
 * <p>Safe for concurrent reads.</p>
 */
public final class FastUtilGroundSet<E extends Comparable<? super E>> implements GroundSet<E> {

    // label -> index (forward lookup)
    private final Object2IntOpenHashMap<E> forward;
    // index -> label (reverse lookup)
    private final List<E> reverse;
    private final ElementSet all;

    /**
     * Builds the index from the given labels sorted by natural order.
     *
     * @param elements ground-set labels; duplicates are merged.
     */
    public FastUtilGroundSet(Collection<? extends E> elements) {
        if (elements == null) {
            throw new IllegalArgumentException("Ground set cannot be null");
        }
        TreeSet<E> sorted = new TreeSet<>();
        for (E element : elements) {
            if (element == null) {
                throw new IllegalArgumentException("Ground set cannot contain null elements");
            }
            sorted.add(element);
        }

        this.forward = new Object2IntOpenHashMap<>(sorted.size());
        this.forward.defaultReturnValue(-1); // Sentinel value
        List<E> ordered = new ArrayList<>(sorted.size());
        for (E element : sorted) {
            forward.put(element, ordered.size());
            ordered.add(element);
        }
        this.forward.trim();
        this.reverse = Collections.unmodifiableList(ordered);

        BitSet bits = new BitSet(ordered.size());
        bits.set(0, ordered.size());
        this.all = ElementSet.of(bits);
    }

    @Override
    public int indexOf(E element) throws UnknownElementException {
        if (element == null) {
            throw new IllegalArgumentException("Element cannot be null");
        }
        int index = forward.getInt(element);
        if (index == -1) {
            throw new UnknownElementException("Element not in ground set: " + element);
        }
        return index;
    }

    @Override
    public E elementAt(int index) {
        if (index < 0 || index >= reverse.size()) {
            throw new IndexOutOfBoundsException("Element index out of bounds: " + index);
        }
        return reverse.get(index);
    }

    @Override
    public boolean contains(E element) {
        return element != null && forward.containsKey(element);
    }

    @Override
    public int size() {
        return reverse.size();
    }

    @Override
    public List<E> elements() {
        return reverse;
    }

    @Override
    public ElementSet encode(Collection<? extends E> subset) throws UnknownElementException {
        if (subset == null) {
            throw new IllegalArgumentException("Subset cannot be null");
        }
        BitSet bits = new BitSet(reverse.size());
        for (E element : subset) {
            bits.set(indexOf(element));
        }
        return ElementSet.of(bits);
    }

    @Override
    public SortedSet<E> decode(ElementSet subset) {
        TreeSet<E> labels = new TreeSet<>();
        for (int index : subset.toArray()) {
            labels.add(elementAt(index));
        }
        return Collections.unmodifiableSortedSet(labels);
    }

    @Override
    public ElementSet all() {
        return all;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FastUtilGroundSet<?> other)) {
            return false;
        }
        return reverse.equals(other.reverse);
    }

    @Override
    public int hashCode() {
        return reverse.hashCode();
    }

    @Override
    public String toString() {
        return reverse.toString();
    }
}
