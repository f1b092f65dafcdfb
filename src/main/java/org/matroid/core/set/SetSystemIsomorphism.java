package org.matroid.core.set;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import lombok.experimental.UtilityClass;
import org.jboss.logging.Logger;
import org.matroid.core.SearchBudget;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Backtracking search for a ground-set bijection between two set families.
 *
 * <p>Each element carries a signature: the sorted multiset of {@code (key, size)} pairs of
 * the subsets containing it. Candidates must share the source element's signature.
 * Elements are assigned from the rarest signature class outward, preferring elements
 * that share subsets with those already assigned. A subset is checked as soon as its
 * last element is assigned.</p>
 *
 * <p>The search keeps an explicit cursor stack instead of recursing.</p>
 */
@UtilityClass
public class SetSystemIsomorphism {

    private static final Logger LOG = Logger.getLogger(SetSystemIsomorphism.class);

    /**
     * Finds a bijection {@code f} with {@code {f(s) : s in source} == target}.
     *
     * @param source family to map.
     * @param target family to map onto.
     * @param budget search budget.
     * @return images by source element index, or empty when no bijection exists.
     */
    public static Optional<int[]> find(SetFamily source, SetFamily target, SearchBudget budget) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(budget, "budget");

        int n = source.groundSetSize();
        if (n != target.groundSetSize() || source.size() != target.size()) {
            return Optional.empty();
        }
        if (!shapeHistogram(source).equals(shapeHistogram(target))) {
            return Optional.empty();
        }

        LongArrayList[] sourceSignatures = signatures(source);
        LongArrayList[] targetSignatures = signatures(target);
        Object2ObjectOpenHashMap<LongArrayList, IntArrayList> sourceClasses = classes(sourceSignatures);
        Object2ObjectOpenHashMap<LongArrayList, IntArrayList> targetClasses = classes(targetSignatures);
        if (sourceClasses.size() != targetClasses.size()) {
            return Optional.empty();
        }
        for (Object2ObjectMap.Entry<LongArrayList, IntArrayList> entry : sourceClasses.object2ObjectEntrySet()) {
            IntArrayList matching = targetClasses.get(entry.getKey());
            if (matching == null || matching.size() != entry.getValue().size()) {
                return Optional.empty();
            }
        }

        List<KeyedSet> sourceSets = new ArrayList<>(source.size());
        for (int key : source.keys()) {
            for (ElementSet set : source.partition(key)) {
                sourceSets.add(new KeyedSet(key, set.toArray()));
            }
        }
        int[] order = assignmentOrder(n, sourceSets, sourceSignatures, sourceClasses);
        List<List<KeyedSet>> completedAt = completionSchedule(n, order, sourceSets);

        IntArrayList[] candidates = new IntArrayList[n];
        for (int depth = 0; depth < n; depth++) {
            candidates[depth] = targetClasses.get(sourceSignatures[order[depth]]);
        }

        SearchBudget.Tracker tracker = budget.start("set-system isomorphism");
        int[] image = new int[n];
        Arrays.fill(image, -1);
        boolean[] used = new boolean[n];
        int[] cursor = new int[n + 1];
        int depth = 0;
        while (depth >= 0) {
            if (depth == n) {
                LOG.debugf("isomorphism found on %d elements after %d steps", n, tracker.steps());
                return Optional.of(image.clone());
            }
            int element = order[depth];
            if (image[element] >= 0) {
                used[image[element]] = false;
                image[element] = -1;
            }
            IntArrayList options = candidates[depth];
            boolean placed = false;
            while (cursor[depth] < options.size()) {
                int candidate = options.getInt(cursor[depth]++);
                if (used[candidate]) {
                    continue;
                }
                tracker.step();
                image[element] = candidate;
                used[candidate] = true;
                if (imagesPresent(completedAt.get(depth), image, target)) {
                    placed = true;
                    break;
                }
                used[candidate] = false;
                image[element] = -1;
            }
            if (placed) {
                depth++;
                cursor[depth] = 0;
            } else {
                cursor[depth] = 0;
                depth--;
            }
        }
        LOG.debugf("no isomorphism on %d elements after %d steps", n, tracker.steps());
        return Optional.empty();
    }

    private static boolean imagesPresent(List<KeyedSet> sets, int[] image, SetFamily target) {
        for (KeyedSet set : sets) {
            BitSet bits = new BitSet();
            for (int element : set.elements()) {
                bits.set(image[element]);
            }
            if (!target.partition(set.key()).contains(ElementSet.of(bits))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Counts subsets per (key, size) pair.
     */
    private static Object2IntOpenHashMap<LongArrayList> shapeHistogram(SetFamily family) {
        Object2IntOpenHashMap<LongArrayList> histogram = new Object2IntOpenHashMap<>();
        for (int key : family.keys()) {
            for (ElementSet set : family.partition(key)) {
                histogram.addTo(LongArrayList.wrap(new long[]{key, set.cardinality()}), 1);
            }
        }
        return histogram;
    }

    private static LongArrayList[] signatures(SetFamily family) {
        int n = family.groundSetSize();
        LongArrayList[] signatures = new LongArrayList[n];
        for (int i = 0; i < n; i++) {
            signatures[i] = new LongArrayList();
        }
        for (int key : family.keys()) {
            for (ElementSet set : family.partition(key)) {
                long code = (long) key * (n + 1L) + set.cardinality();
                for (int element : set.toArray()) {
                    signatures[element].add(code);
                }
            }
        }
        for (LongArrayList signature : signatures) {
            Arrays.sort(signature.elements(), 0, signature.size());
        }
        return signatures;
    }

    private static Object2ObjectOpenHashMap<LongArrayList, IntArrayList> classes(LongArrayList[] signatures) {
        Object2ObjectOpenHashMap<LongArrayList, IntArrayList> classes = new Object2ObjectOpenHashMap<>();
        for (int i = 0; i < signatures.length; i++) {
            classes.computeIfAbsent(signatures[i], k -> new IntArrayList()).add(i);
        }
        return classes;
    }

    /**
     * Orders source elements: rarest signature class first, then by number of subsets
     * shared with already ordered elements.
     */
    private static int[] assignmentOrder(
            int n,
            List<KeyedSet> sets,
            LongArrayList[] signatures,
            Object2ObjectOpenHashMap<LongArrayList, IntArrayList> classes
    ) {
        List<IntArrayList> incidence = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            incidence.add(new IntArrayList());
        }
        for (int s = 0; s < sets.size(); s++) {
            for (int element : sets.get(s).elements()) {
                incidence.get(element).add(s);
            }
        }

        int[] order = new int[n];
        boolean[] ordered = new boolean[n];
        int[] touched = new int[sets.size()];
        for (int depth = 0; depth < n; depth++) {
            int best = -1;
            int bestClassSize = Integer.MAX_VALUE;
            int bestLinks = -1;
            for (int i = 0; i < n; i++) {
                if (ordered[i]) {
                    continue;
                }
                int links = 0;
                for (int s : incidence.get(i)) {
                    links += touched[s];
                }
                int classSize = classes.get(signatures[i]).size();
                if (links > bestLinks || (links == bestLinks && classSize < bestClassSize)) {
                    best = i;
                    bestLinks = links;
                    bestClassSize = classSize;
                }
            }
            order[depth] = best;
            ordered[best] = true;
            for (int s : incidence.get(best)) {
                touched[s]++;
            }
        }
        return order;
    }

    /**
     * Groups source subsets by the depth at which their last element gets assigned.
     * Empty subsets are checked at depth 0.
     */
    private static List<List<KeyedSet>> completionSchedule(int n, int[] order, List<KeyedSet> sets) {
        int[] position = new int[n];
        for (int depth = 0; depth < n; depth++) {
            position[order[depth]] = depth;
        }
        List<List<KeyedSet>> completedAt = new ArrayList<>(n);
        for (int depth = 0; depth < n; depth++) {
            completedAt.add(new ArrayList<>());
        }
        for (KeyedSet set : sets) {
            int last = 0;
            for (int element : set.elements()) {
                last = Math.max(last, position[element]);
            }
            if (n > 0) {
                completedAt.get(last).add(set);
            }
        }
        return completedAt;
    }

    private record KeyedSet(int key, int[] elements) {
    }
}
