package org.matroid.engine.core;

import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import lombok.experimental.UtilityClass;
import org.jboss.logging.Logger;
import org.matroid.core.SearchBudget;
import org.matroid.core.set.ElementSet;
import org.matroid.core.set.SetFamily;
import org.matroid.engine.lattice.InclusionPoset;
import org.matroid.engine.oracle.RankOracle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Brute-force derivation of defining families from a rank oracle.
 *
 * <p>Used by encodings that do not store the requested family. Work is exponential in the
 * ground-set size and charged against a {@link SearchBudget}.</p>
 */
@UtilityClass
class MatroidEnumeration {

    private static final Logger LOG = Logger.getLogger(MatroidEnumeration.class);

    /**
     * Enumerates circuits by increasing size: a dependent set is a circuit when no smaller
     * circuit lies inside it.
     */
    static SetFamily circuits(RankOracle oracle, SearchBudget budget) {
        Objects.requireNonNull(oracle, "oracle");
        SearchBudget.Tracker tracker = budget.start("circuit enumeration");
        int n = oracle.groundSetSize();
        int rank = oracle.fullRank();
        SetFamily.Builder builder = new SetFamily.Builder(n);
        List<ElementSet> found = new ArrayList<>();
        for (int k = 0; k <= Math.min(n, rank + 1); k++) {
            int size = k;
            forEachSubset(n, k, tracker, candidate -> {
                if (oracle.rank(candidate) == size) {
                    return;
                }
                for (ElementSet circuit : found) {
                    if (circuit.isSubsetOf(candidate)) {
                        return;
                    }
                }
                found.add(candidate);
                builder.add(size, candidate);
            });
        }
        LOG.tracef("enumerated %d circuits on %d elements", found.size(), n);
        return builder.build();
    }

    /**
     * Enumerates flats rank by rank: the closures of one-element extensions of the previous rank.
     */
    static SetFamily flats(RankOracle oracle, SearchBudget budget) {
        Objects.requireNonNull(oracle, "oracle");
        SearchBudget.Tracker tracker = budget.start("flat enumeration");
        int n = oracle.groundSetSize();
        SetFamily.Builder builder = new SetFamily.Builder(n);
        ObjectLinkedOpenHashSet<ElementSet> level = new ObjectLinkedOpenHashSet<>();
        level.add(oracle.closure(ElementSet.empty()));
        int rank = 0;
        int total = 0;
        while (!level.isEmpty()) {
            ObjectLinkedOpenHashSet<ElementSet> next = new ObjectLinkedOpenHashSet<>();
            for (ElementSet flat : level) {
                builder.add(rank, flat);
                total++;
                for (int e = 0; e < n; e++) {
                    if (!flat.contains(e)) {
                        tracker.step();
                        next.add(oracle.closure(flat.with(e)));
                    }
                }
            }
            level = next;
            rank++;
        }
        LOG.tracef("enumerated %d flats on %d elements", total, n);
        return builder.build();
    }

    /**
     * Enumerates bases as the full-rank subsets of size {@code rank}.
     */
    static List<ElementSet> bases(RankOracle oracle, SearchBudget budget) {
        SearchBudget.Tracker tracker = budget.start("basis enumeration");
        int rank = oracle.fullRank();
        List<ElementSet> bases = new ArrayList<>();
        forEachSubset(oracle.groundSetSize(), rank, tracker, candidate -> {
            if (oracle.isIndependent(candidate)) {
                bases.add(candidate);
            }
        });
        return bases;
    }

    /**
     * Returns Whitney numbers of the first kind: {@code |sum of μ(0, x)|} over lattice elements of each rank.
     */
    static int[] whitneyNumbers(InclusionPoset lattice) {
        int bottom = lattice.bottom();
        if (bottom < 0) {
            return new int[0];
        }
        int[] sums = new int[lattice.rank() + 1];
        for (int x = 0; x < lattice.size(); x++) {
            int r = lattice.rank(x);
            if (r < sums.length) {
                sums[r] += lattice.mobius(bottom, x);
            }
        }
        for (int i = 0; i < sums.length; i++) {
            sums[i] = Math.abs(sums[i]);
        }
        return sums;
    }

    /**
     * Returns Whitney numbers of the second kind: the number of flats at each rank.
     */
    static int[] whitneyNumbers2(SetFamily flats) {
        int[] counts = new int[Math.max(flats.maxKey() + 1, 0)];
        for (int key : flats.keys()) {
            counts[key] = flats.partition(key).size();
        }
        return counts;
    }

    /**
     * Visits every {@code k}-subset of {@code {0..n-1}} in lexicographic order.
     */
    static void forEachSubset(int n, int k, SearchBudget.Tracker tracker, Consumer<ElementSet> visitor) {
        if (k < 0 || k > n) {
            return;
        }
        int[] combination = new int[k];
        for (int i = 0; i < k; i++) {
            combination[i] = i;
        }
        while (true) {
            tracker.step();
            visitor.accept(ElementSet.of(combination));
            int i = k - 1;
            while (i >= 0 && combination[i] == n - k + i) {
                i--;
            }
            if (i < 0) {
                return;
            }
            combination[i]++;
            for (int j = i + 1; j < k; j++) {
                combination[j] = combination[j - 1] + 1;
            }
        }
    }
}
