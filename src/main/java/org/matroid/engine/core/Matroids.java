package org.matroid.engine.core;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Construction entry point for exported matroid state.
 */
@UtilityClass
public class Matroids {

    /**
     * Rebuilds a matroid equal to the one that produced {@code state}.
     *
     * @param state exported construction data.
     * @return façade of the exported encoding, named when the state carries a name.
     */
    public static <E extends Comparable<? super E>> Matroid<E> fromState(MatroidState<E> state) {
        Objects.requireNonNull(state, "state");
        Matroid<E> matroid = switch (state.getEncoding()) {
            case CIRCUITS -> CircuitsMatroid.of(state.getGroundset(), flatten(state));
            case FLATS -> FlatsMatroid.of(state.getGroundset(), state.getDefiningSets());
            case LATTICE_OF_FLATS -> LatticeOfFlatsMatroid.of(state.getGroundset(), flatten(state));
        };
        return state.getCustomName() == null ? matroid : matroid.withName(state.getCustomName());
    }

    private static <E extends Comparable<? super E>> List<SortedSet<E>> flatten(MatroidState<E> state) {
        List<SortedSet<E>> out = new ArrayList<>();
        for (Map.Entry<Integer, List<SortedSet<E>>> entry : state.getDefiningSets().entrySet()) {
            out.addAll(entry.getValue());
        }
        return out;
    }
}
