package org.matroid.core.set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.matroid.core.MatroidException;
import org.matroid.core.SearchBudget;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SetSystemIsomorphism Tests")
class SetSystemIsomorphismTest {

    // Fano plane lines on 0..6.
    private static final int[][] FANO = {
            {0, 1, 5}, {0, 2, 4}, {0, 3, 6}, {1, 2, 3}, {1, 4, 6}, {2, 5, 6}, {3, 4, 5}
    };

    private static SetFamily lines(int n, int[][] lines) {
        List<ElementSet> sets = new ArrayList<>();
        for (int[] line : lines) {
            sets.add(ElementSet.of(line));
        }
        return SetFamily.bySize(n, sets);
    }

    private static SetFamily permute(SetFamily family, int[] permutation) {
        SetFamily.Builder builder = new SetFamily.Builder(family.groundSetSize());
        for (int key : family.keys()) {
            for (ElementSet set : family.partition(key)) {
                builder.add(key, apply(set, permutation));
            }
        }
        return builder.build();
    }

    private static ElementSet apply(ElementSet set, int[] permutation) {
        BitSet bits = new BitSet();
        for (int e : set.toArray()) {
            bits.set(permutation[e]);
        }
        return ElementSet.of(bits);
    }

    private static void assertMapsOnto(SetFamily source, SetFamily target, int[] image) {
        assertEquals(target, permute(source, image), "certificate must carry source exactly onto target");
    }

    @Test
    @DisplayName("Finds a certificate for a shuffled Fano plane")
    void testShuffledFano() {
        SetFamily source = lines(7, FANO);
        int[] permutation = {3, 6, 0, 5, 1, 4, 2};
        SetFamily target = permute(source, permutation);

        int[] image = SetSystemIsomorphism.find(source, target, SearchBudget.unlimited()).orElseThrow();
        assertMapsOnto(source, target, image);
    }

    @Test
    @DisplayName("Random permutations of a mixed-size family are always recovered")
    void testRandomPermutations() {
        SetFamily source = SetFamily.bySize(6, List.of(
                ElementSet.of(0, 1),
                ElementSet.of(1, 2, 3),
                ElementSet.of(2, 4),
                ElementSet.of(0, 3, 4, 5),
                ElementSet.of(5)
        ));
        Random random = new Random(42);
        for (int trial = 0; trial < 25; trial++) {
            int[] permutation = shuffled(6, random);
            SetFamily target = permute(source, permutation);
            int[] image = SetSystemIsomorphism.find(source, target, SearchBudget.unlimited()).orElseThrow();
            assertMapsOnto(source, target, image);
        }
    }

    @Test
    @DisplayName("Same size histogram but different structure is rejected")
    void testStructuralMismatch() {
        // a path 0-1-2-3 against a star centred at 0
        SetFamily path = lines(4, new int[][]{{0, 1}, {1, 2}, {2, 3}});
        SetFamily star = lines(4, new int[][]{{0, 1}, {0, 2}, {0, 3}});
        assertTrue(SetSystemIsomorphism.find(path, star, SearchBudget.unlimited()).isEmpty());
        assertTrue(SetSystemIsomorphism.find(star, path, SearchBudget.unlimited()).isEmpty());
    }

    @Test
    @DisplayName("Equal signatures but no bijection: two triangles vs a hexagon")
    void testEqualSignaturesNoBijection() {
        SetFamily triangles = lines(6, new int[][]{{0, 1}, {1, 2}, {0, 2}, {3, 4}, {4, 5}, {3, 5}});
        SetFamily hexagon = lines(6, new int[][]{{0, 1}, {1, 2}, {2, 3}, {3, 4}, {4, 5}, {0, 5}});
        assertTrue(SetSystemIsomorphism.find(triangles, hexagon, SearchBudget.unlimited()).isEmpty());
    }

    @Test
    @DisplayName("Partition keys must be preserved, not just set shapes")
    void testKeysPreserved() {
        Map<Integer, List<ElementSet>> a = new TreeMap<>();
        a.put(1, List.of(ElementSet.of(0)));
        a.put(2, List.of(ElementSet.of(1)));
        Map<Integer, List<ElementSet>> b = new TreeMap<>();
        b.put(1, List.of(ElementSet.of(1)));
        b.put(2, List.of(ElementSet.of(0)));
        Map<Integer, List<ElementSet>> c = new TreeMap<>();
        c.put(1, List.of(ElementSet.of(0), ElementSet.of(1)));

        SetFamily fa = SetFamily.byKey(2, a);
        Optional<int[]> swap = SetSystemIsomorphism.find(fa, SetFamily.byKey(2, b), SearchBudget.unlimited());
        assertArrayEquals(new int[]{1, 0}, swap.orElseThrow());
        assertTrue(SetSystemIsomorphism.find(fa, SetFamily.byKey(2, c), SearchBudget.unlimited()).isEmpty());
    }

    @Test
    @DisplayName("Quick rejects: ground-set size and family size")
    void testQuickRejects() {
        SetFamily small = lines(3, new int[][]{{0, 1}});
        SetFamily wide = lines(4, new int[][]{{0, 1}});
        SetFamily bigger = lines(3, new int[][]{{0, 1}, {1, 2}});
        assertTrue(SetSystemIsomorphism.find(small, wide, SearchBudget.unlimited()).isEmpty());
        assertTrue(SetSystemIsomorphism.find(small, bigger, SearchBudget.unlimited()).isEmpty());
    }

    @Test
    @DisplayName("Empty ground set maps trivially")
    void testEmptyGroundSet() {
        SetFamily empty = SetFamily.bySize(0, List.of(ElementSet.empty()));
        assertEquals(0, SetSystemIsomorphism.find(empty, empty, SearchBudget.unlimited()).orElseThrow().length);
    }

    @Test
    @DisplayName("Budget exhaustion surfaces as SEARCH_BUDGET_EXCEEDED")
    void testBudgetExceeded() {
        // Every element shares one signature, so the search must branch.
        SetFamily source = lines(7, FANO);
        SetFamily target = permute(source, new int[]{6, 5, 4, 3, 2, 1, 0});
        MatroidException ex = assertThrows(
                MatroidException.class,
                () -> SetSystemIsomorphism.find(source, target, SearchBudget.of(2, 0))
        );
        assertEquals(MatroidException.SEARCH_BUDGET_EXCEEDED, ex.reasonCode());
    }

    private static int[] shuffled(int n, Random random) {
        int[] permutation = new int[n];
        for (int i = 0; i < n; i++) {
            permutation[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = permutation[i];
            permutation[i] = permutation[j];
            permutation[j] = tmp;
        }
        return permutation;
    }
}
