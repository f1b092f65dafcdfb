package org.matroid.engine.core;

import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import lombok.experimental.UtilityClass;
import org.matroid.core.MatroidException;
import org.matroid.core.SearchBudget;
import org.matroid.core.id.GroundSet;
import org.matroid.core.set.ElementSet;
import org.matroid.core.set.SetFamily;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Broken circuits and no-broken-circuit (NBC) sets under a ground-set ordering.
 *
 * <p>A set containing no broken circuit contains no circuit either, so NBC sets are
 * independent and form a simplicial complex; they are grown one element at a time in
 * increasing order position.</p>
 */
@UtilityClass
class BrokenCircuits {

    /**
     * Maps each element index to its position in {@code ordering}.
     *
     * @throws MatroidException with {@link MatroidException#INVALID_INPUT} unless the ordering
     *         is a permutation of the ground set.
     */
    static <E extends Comparable<? super E>> int[] positions(GroundSet<E> groundSet, List<E> ordering) {
        Objects.requireNonNull(ordering, "ordering");
        if (ordering.size() != groundSet.size()) {
            throw new MatroidException(
                    MatroidException.INVALID_INPUT,
                    "ordering has " + ordering.size() + " elements, ground set has " + groundSet.size()
            );
        }
        int[] positions = new int[groundSet.size()];
        Arrays.fill(positions, -1);
        for (int p = 0; p < ordering.size(); p++) {
            E element = ordering.get(p);
            if (!groundSet.contains(element)) {
                throw new MatroidException(MatroidException.INVALID_INPUT, "ordering element not in ground set: " + element);
            }
            int index = groundSet.indexOf(element);
            if (positions[index] >= 0) {
                throw new MatroidException(MatroidException.INVALID_INPUT, "ordering repeats element: " + element);
            }
            positions[index] = p;
        }
        return positions;
    }

    static List<ElementSet> brokenCircuits(SetFamily circuits, int[] positions) {
        ObjectLinkedOpenHashSet<ElementSet> broken = new ObjectLinkedOpenHashSet<>();
        for (ElementSet circuit : circuits) {
            if (circuit.isEmpty()) {
                continue;
            }
            broken.add(circuit.without(smallest(circuit, positions)));
        }
        return new ArrayList<>(broken);
    }

    static List<ElementSet> nbcSets(SetFamily circuits, int[] positions, SearchBudget budget) {
        SearchBudget.Tracker tracker = budget.start("NBC enumeration");
        List<ElementSet> broken = brokenCircuits(circuits, positions);
        if (broken.contains(ElementSet.empty())) {
            // a loop breaks to the empty set, which every set contains
            return List.of();
        }
        int n = positions.length;
        int[] byPosition = new int[n];
        for (int index = 0; index < n; index++) {
            byPosition[positions[index]] = index;
        }

        List<ElementSet> out = new ArrayList<>();
        List<ElementSet> level = List.of(ElementSet.empty());
        while (!level.isEmpty()) {
            out.addAll(level);
            List<ElementSet> next = new ArrayList<>();
            for (ElementSet set : level) {
                int from = set.isEmpty() ? 0 : positions[largest(set, positions)] + 1;
                for (int p = from; p < n; p++) {
                    tracker.step();
                    ElementSet extended = set.with(byPosition[p]);
                    if (!containsAny(extended, broken)) {
                        next.add(extended);
                    }
                }
            }
            level = next;
        }
        return out;
    }

    private static boolean containsAny(ElementSet set, List<ElementSet> candidates) {
        for (ElementSet candidate : candidates) {
            if (candidate.isSubsetOf(set)) {
                return true;
            }
        }
        return false;
    }

    private static int smallest(ElementSet set, int[] positions) {
        int best = -1;
        for (int e = set.first(); e >= 0; e = set.nextElement(e + 1)) {
            if (best < 0 || positions[e] < positions[best]) {
                best = e;
            }
        }
        return best;
    }

    private static int largest(ElementSet set, int[] positions) {
        int best = -1;
        for (int e = set.first(); e >= 0; e = set.nextElement(e + 1)) {
            if (best < 0 || positions[e] > positions[best]) {
                best = e;
            }
        }
        return best;
    }
}
