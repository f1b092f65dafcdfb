package org.matroid.engine.lattice;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.matroid.core.set.ElementSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Finite poset of distinct subsets ordered by inclusion.
 *
 * <p>Elements are indexed {@code 0..size()-1} in {@link ElementSet} order (cardinality first),
 * which is a linear extension of inclusion. Rank is the length of the longest chain
 * from a minimal element; it coincides with the grading when the poset is graded.</p>
 *
 * <p>Immutable. Rank and Möbius tables are computed on first use and published once
 * through {@link AtomicReference#compareAndSet}; racing first callers may both compute,
 * the first published table wins.</p>
 */
public final class InclusionPoset {
    private final List<ElementSet> elements;
    private final Object2IntOpenHashMap<ElementSet> indexByElement;
    private final IntList[] upperCovers;
    private final IntList[] lowerCovers;

    private final AtomicReference<int[]> rankCache = new AtomicReference<>();
    private final AtomicReference<int[][]> mobiusCache = new AtomicReference<>();

    private InclusionPoset(List<ElementSet> elements) {
        this.elements = Collections.unmodifiableList(elements);
        int n = elements.size();
        this.indexByElement = new Object2IntOpenHashMap<>(n);
        this.indexByElement.defaultReturnValue(-1);
        for (int i = 0; i < n; i++) {
            indexByElement.put(elements.get(i), i);
        }

        IntArrayList[] up = new IntArrayList[n];
        IntArrayList[] down = new IntArrayList[n];
        for (int i = 0; i < n; i++) {
            up[i] = new IntArrayList();
            down[i] = new IntArrayList();
        }
        // j covers i iff i < j strictly and no k lies strictly between them.
        for (int j = 0; j < n; j++) {
            ElementSet top = elements.get(j);
            IntArrayList below = new IntArrayList();
            for (int i = j - 1; i >= 0; i--) {
                ElementSet candidate = elements.get(i);
                if (!candidate.isProperSubsetOf(top)) {
                    continue;
                }
                boolean covered = true;
                for (int k : below) {
                    if (candidate.isProperSubsetOf(elements.get(k))) {
                        covered = false;
                        break;
                    }
                }
                if (covered) {
                    below.add(i);
                }
            }
            for (int i : below) {
                up[i].add(j);
                down[j].add(i);
            }
        }
        this.upperCovers = new IntList[n];
        this.lowerCovers = new IntList[n];
        for (int i = 0; i < n; i++) {
            IntArrays.quickSort(down[i].elements(), 0, down[i].size());
            upperCovers[i] = IntLists.unmodifiable(up[i]);
            lowerCovers[i] = IntLists.unmodifiable(down[i]);
        }
    }

    /**
     * Builds the inclusion poset of a set family.
     *
     * @param sets subsets; duplicates are merged.
     * @return immutable poset.
     */
    public static InclusionPoset of(Collection<ElementSet> sets) {
        Objects.requireNonNull(sets, "sets");
        TreeSet<ElementSet> sorted = new TreeSet<>();
        for (ElementSet set : sets) {
            sorted.add(Objects.requireNonNull(set, "set"));
        }
        return new InclusionPoset(new ArrayList<>(sorted));
    }

    public int size() {
        return elements.size();
    }

    public ElementSet element(int index) {
        return elements.get(index);
    }

    public List<ElementSet> elements() {
        return elements;
    }

    /**
     * Returns the index of a subset, or -1 when absent.
     */
    public int indexOf(ElementSet set) {
        return set == null ? -1 : indexByElement.getInt(set);
    }

    public boolean lessOrEqual(int i, int j) {
        return elements.get(i).isSubsetOf(elements.get(j));
    }

    public IntList upperCovers(int index) {
        return upperCovers[index];
    }

    public IntList lowerCovers(int index) {
        return lowerCovers[index];
    }

    /**
     * Returns the unique minimal element, or -1.
     */
    public int bottom() {
        if (elements.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < elements.size(); i++) {
            if (!lessOrEqual(0, i)) {
                return -1;
            }
        }
        return 0;
    }

    /**
     * Returns the unique maximal element, or -1.
     */
    public int top() {
        if (elements.isEmpty()) {
            return -1;
        }
        int last = elements.size() - 1;
        for (int i = 0; i < elements.size(); i++) {
            if (!lessOrEqual(i, last)) {
                return -1;
            }
        }
        return last;
    }

    /**
     * Returns the length of the longest chain ending at {@code index}.
     */
    public int rank(int index) {
        return ranks()[index];
    }

    /**
     * Returns the poset rank: the top element's rank when bounded above, else the largest rank.
     */
    public int rank() {
        int[] ranks = ranks();
        int top = top();
        if (top >= 0) {
            return ranks[top];
        }
        int max = 0;
        for (int r : ranks) {
            max = Math.max(max, r);
        }
        return max;
    }

    private int[] ranks() {
        int[] cached = rankCache.get();
        if (cached != null) {
            return cached;
        }
        int n = elements.size();
        int[] ranks = new int[n];
        // Indices form a linear extension, so lower covers are ranked first.
        for (int j = 0; j < n; j++) {
            int r = 0;
            for (int i : lowerCovers[j]) {
                r = Math.max(r, ranks[i] + 1);
            }
            ranks[j] = r;
        }
        rankCache.compareAndSet(null, ranks);
        return rankCache.get();
    }

    /**
     * True when every cover raises rank by exactly one and all minimal elements have rank 0.
     */
    public boolean isGraded() {
        int[] ranks = ranks();
        for (int j = 0; j < elements.size(); j++) {
            for (int i : lowerCovers[j]) {
                if (ranks[j] != ranks[i] + 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns the least upper bound of two elements, or -1 when it does not exist.
     */
    public int join(int i, int j) {
        ElementSet union = elements.get(i).union(elements.get(j));
        // A least upper bound has the smallest index among all upper bounds.
        int least = -1;
        for (int k = 0; k < elements.size(); k++) {
            if (!union.isSubsetOf(elements.get(k))) {
                continue;
            }
            if (least < 0) {
                least = k;
            } else if (!lessOrEqual(least, k)) {
                return -1;
            }
        }
        return least;
    }

    /**
     * Returns the greatest lower bound of two elements, or -1 when it does not exist.
     */
    public int meet(int i, int j) {
        ElementSet intersection = elements.get(i).intersection(elements.get(j));
        int greatest = -1;
        for (int k = elements.size() - 1; k >= 0; k--) {
            if (!elements.get(k).isSubsetOf(intersection)) {
                continue;
            }
            if (greatest < 0) {
                greatest = k;
            } else if (!lessOrEqual(k, greatest)) {
                return -1;
            }
        }
        return greatest;
    }

    /**
     * True when the poset is non-empty, has a bottom, and every pair has a join.
     */
    public boolean isLattice() {
        if (bottom() < 0 || top() < 0) {
            return false;
        }
        int n = elements.size();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (join(i, j) < 0) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns the elements covering the bottom, or an empty list without a bottom.
     */
    public IntList atoms() {
        int bottom = bottom();
        return bottom < 0 ? IntLists.emptyList() : upperCovers[bottom];
    }

    /**
     * True when every element is the join of the atoms below it. Assumes {@link #isLattice()}.
     */
    public boolean isAtomistic() {
        int bottom = bottom();
        if (bottom < 0) {
            return false;
        }
        IntList atoms = atoms();
        for (int x = 0; x < elements.size(); x++) {
            int join = bottom;
            for (int atom : atoms) {
                if (lessOrEqual(atom, x)) {
                    join = join(join, atom);
                    if (join < 0) {
                        return false;
                    }
                }
            }
            if (join != x) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when {@code r(x) + r(y) >= r(x ∧ y) + r(x ∨ y)} for all pairs. Assumes {@link #isLattice()}.
     */
    public boolean isUpperSemimodular() {
        int n = elements.size();
        for (int x = 0; x < n; x++) {
            for (int y = x + 1; y < n; y++) {
                int join = join(x, y);
                int meet = meet(x, y);
                if (join < 0 || meet < 0) {
                    return false;
                }
                if (rank(x) + rank(y) < rank(join) + rank(meet)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * True for a graded, atomistic, upper semimodular lattice.
     */
    public boolean isGeometric() {
        return isLattice() && isGraded() && isAtomistic() && isUpperSemimodular();
    }

    /**
     * Returns the Möbius function value {@code μ(i, j)}; 0 when {@code i} is not below {@code j}.
     */
    public int mobius(int i, int j) {
        return mobiusMatrix()[i][j];
    }

    private int[][] mobiusMatrix() {
        int[][] cached = mobiusCache.get();
        if (cached != null) {
            return cached;
        }
        int n = elements.size();
        int[][] mu = new int[n][n];
        for (int i = 0; i < n; i++) {
            mu[i][i] = 1;
            for (int j = i + 1; j < n; j++) {
                if (!lessOrEqual(i, j)) {
                    continue;
                }
                int sum = 0;
                for (int k = i; k < j; k++) {
                    if (mu[i][k] != 0 && lessOrEqual(k, j)) {
                        sum += mu[i][k];
                    }
                }
                mu[i][j] = -sum;
            }
        }
        mobiusCache.compareAndSet(null, mu);
        return mobiusCache.get();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InclusionPoset other)) {
            return false;
        }
        return elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "InclusionPoset" + elements;
    }
}
