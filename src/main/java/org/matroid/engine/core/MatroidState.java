package org.matroid.engine.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Construction data sufficient to rebuild an equal matroid through {@link Matroids#fromState(MatroidState)}.
 *
 * <p>This is the only persistence boundary; file and wire formats are left to callers.</p>
 */
@Value
@Builder
public class MatroidState<E extends Comparable<? super E>> {
    /** Encoding to rebuild. */
    @NonNull
    Encoding encoding;
    /** Ground-set labels. */
    @NonNull
    SortedSet<E> groundset;
    /**
     * Defining sets by partition key: circuit size, flat rank, or poset rank.
     */
    @NonNull
    SortedMap<Integer, List<SortedSet<E>>> definingSets;
    /** Optional display name; {@code null} when unnamed. */
    String customName;
}
