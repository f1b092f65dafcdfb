package org.matroid.core.id;

import lombok.experimental.StandardException;
import org.matroid.core.set.ElementSet;

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;

/**
 * Bidirectional mapping between ground-set labels and dense element indices.
 *
 * <p>Indices follow the natural order of the labels, so two ground sets holding the
 * same labels always assign the same index to each label.</p>
 *
 * @param <E> element label type.
 */
public interface GroundSet<E extends Comparable<? super E>> {

    /**
     * Converts a label to its dense index.
     *
     * @param element ground-set label.
     * @return index in {@code [0, size())}.
     * @throws UnknownElementException if the label is not part of the ground set.
     */
    int indexOf(E element) throws UnknownElementException;

    /**
     * Converts a dense index back to its label.
     *
     * @param index element index.
     * @return ground-set label.
     * @throws IndexOutOfBoundsException if the index is invalid.
     */
    E elementAt(int index);

    /**
     * Checks whether a label belongs to the ground set.
     *
     * @param element label to test.
     * @return true when present.
     */
    boolean contains(E element);

    /**
     * Returns number of ground-set elements.
     */
    int size();

    /**
     * Returns the labels in index order.
     */
    List<E> elements();

    /**
     * Encodes a collection of labels as an index set.
     *
     * @param subset labels, all of which must belong to the ground set.
     * @return encoded subset.
     * @throws UnknownElementException if any label is outside the ground set.
     */
    ElementSet encode(Collection<? extends E> subset) throws UnknownElementException;

    /**
     * Decodes an index set into an immutable sorted set of labels.
     *
     * @param subset encoded subset.
     * @return labels in natural order.
     */
    SortedSet<E> decode(ElementSet subset);

    /**
     * Returns the full ground set as an index set.
     */
    ElementSet all();

    /**
     * Exception thrown when a label is not part of the ground set.
     */
    @StandardException
    class UnknownElementException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation.
     *
     * @param elements ground-set labels; duplicates are merged.
     * @return immutable ground set.
     */
    static <E extends Comparable<? super E>> GroundSet<E> of(Collection<? extends E> elements) {
        return new FastUtilGroundSet<>(elements);
    }
}
