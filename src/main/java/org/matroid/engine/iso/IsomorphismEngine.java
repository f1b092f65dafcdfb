package org.matroid.engine.iso;

import lombok.experimental.UtilityClass;
import org.jboss.logging.Logger;
import org.matroid.core.SearchBudget;
import org.matroid.core.id.GroundSet;
import org.matroid.core.set.SetFamily;
import org.matroid.engine.core.Matroid;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Matroid isomorphism through the defining-set collections.
 *
 * <p>A matroid is determined up to relabeling by its full circuit collection, and equally
 * by its full flat collection, so a ground-set bijection carries one matroid onto the other
 * exactly when it carries one collection onto the other. Two flat-based matroids compare
 * flats keyed by rank; any other pair compares circuits keyed by size.</p>
 */
@UtilityClass
public class IsomorphismEngine {

    private static final Logger LOG = Logger.getLogger(IsomorphismEngine.class);

    /**
     * Searches for a bijection {@code f} of ground sets with {@code a.relabel(f)} equal to {@code b}.
     *
     * @param a source matroid.
     * @param b target matroid.
     * @param budget search budget shared by enumeration and search.
     * @return the bijection keyed by elements of {@code a}, or empty when the matroids are not isomorphic.
     */
    public static <E extends Comparable<? super E>> Optional<Map<E, E>> isomorphism(
            Matroid<E> a,
            Matroid<E> b,
            SearchBudget budget
    ) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        Objects.requireNonNull(budget, "budget");
        if (a.size() != b.size() || a.rank() != b.rank()) {
            LOG.debugf("isomorphism rejected: size %d/%d, rank %d/%d", a.size(), b.size(), a.rank(), b.rank());
            return Optional.empty();
        }

        boolean flatBased = a.encoding().isFlatBased() && b.encoding().isFlatBased();
        SetFamily source = flatBased ? a.flatFamily() : a.circuitFamily();
        SetFamily target = flatBased ? b.flatFamily() : b.circuitFamily();
        if (source.size() != target.size()) {
            LOG.debugf("isomorphism rejected: %d vs %d %s", source.size(), target.size(), flatBased ? "flats" : "circuits");
            return Optional.empty();
        }

        Optional<int[]> images = source.isomorphismTo(target, budget);
        if (images.isEmpty()) {
            return Optional.empty();
        }
        GroundSet<E> from = a.groundSet();
        GroundSet<E> to = b.groundSet();
        int[] image = images.get();
        Map<E, E> mapping = new LinkedHashMap<>(image.length * 2);
        for (int i = 0; i < image.length; i++) {
            mapping.put(from.elementAt(i), to.elementAt(image[i]));
        }
        return Optional.of(mapping);
    }

    public static <E extends Comparable<? super E>> boolean isIsomorphic(Matroid<E> a, Matroid<E> b, SearchBudget budget) {
        return isomorphism(a, b, budget).isPresent();
    }
}
