package org.matroid.engine.oracle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.matroid.core.MatroidException;
import org.matroid.core.set.ElementSet;
import org.matroid.core.set.SetFamily;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CircuitsOracle Tests")
class CircuitsOracleTest {

    // U(2,4): every 3-subset of {0,1,2,3} is a circuit.
    private static final CircuitsOracle U24 = new CircuitsOracle(SetFamily.bySize(4, List.of(
            ElementSet.of(0, 1, 2),
            ElementSet.of(0, 1, 3),
            ElementSet.of(0, 2, 3),
            ElementSet.of(1, 2, 3)
    )));

    // A loop at 0, a parallel pair {1,2}, and a free element 3.
    private static final CircuitsOracle LOOP_AND_PARALLEL = new CircuitsOracle(SetFamily.bySize(4, List.of(
            ElementSet.of(0),
            ElementSet.of(1, 2)
    )));

    private static ElementSet set(String csv) {
        if (csv == null || csv.isBlank()) {
            return ElementSet.empty();
        }
        return ElementSet.of(Arrays.stream(csv.trim().split(" ")).mapToInt(Integer::parseInt).toArray());
    }

    @ParameterizedTest(name = "rank({0}) = {1}")
    @CsvSource({
            "'', 0",
            "0, 1",
            "0 1, 2",
            "0 1 2, 2",
            "0 1 2 3, 2"
    })
    @DisplayName("U(2,4) ranks")
    void testUniformRanks(String subset, int expected) {
        assertEquals(expected, U24.rank(set(subset)));
    }

    @ParameterizedTest(name = "rank({0}) = {1}")
    @CsvSource({
            "0, 0",
            "1 2, 1",
            "0 1 2 3, 2",
            "1 3, 2"
    })
    @DisplayName("Loops and parallel pairs")
    void testLoopAndParallelRanks(String subset, int expected) {
        assertEquals(expected, LOOP_AND_PARALLEL.rank(set(subset)));
    }

    @Test
    @DisplayName("Independence only scans circuits no larger than the query")
    void testIndependence() {
        assertTrue(U24.isIndependent(ElementSet.of(0, 3)));
        assertFalse(U24.isIndependent(ElementSet.of(1, 2, 3)));
        assertFalse(LOOP_AND_PARALLEL.isIndependent(ElementSet.of(0)));
        assertTrue(LOOP_AND_PARALLEL.isIndependent(ElementSet.empty()));
    }

    @Test
    @DisplayName("Maximal independent subset is independent, inside the query, and rank-sized")
    void testMaxIndependent() {
        ElementSet all = ElementSet.range(4);
        ElementSet basis = U24.maxIndependent(all);
        assertTrue(basis.isSubsetOf(all));
        assertTrue(U24.isIndependent(basis));
        assertEquals(2, basis.cardinality());

        ElementSet other = LOOP_AND_PARALLEL.maxIndependent(all);
        assertFalse(other.contains(0));
        assertEquals(2, other.cardinality());
        assertTrue(other.contains(3));
    }

    @Test
    @DisplayName("Contained circuit and NO_CIRCUIT_FOUND")
    void testContainedCircuit() {
        assertEquals(ElementSet.of(0, 1, 2), U24.circuit(ElementSet.of(0, 1, 2)));
        assertTrue(U24.circuit(ElementSet.range(4)).isSubsetOf(ElementSet.range(4)));

        MatroidException ex = assertThrows(MatroidException.class, () -> U24.circuit(ElementSet.of(0, 1)));
        assertEquals(MatroidException.NO_CIRCUIT_FOUND, ex.reasonCode());
    }

    @Test
    @DisplayName("Closure adds elements completing a circuit")
    void testClosure() {
        assertEquals(ElementSet.range(4), U24.closure(ElementSet.of(0, 1)));
        assertEquals(ElementSet.of(1), U24.closure(ElementSet.of(1)));
        assertEquals(ElementSet.of(0), LOOP_AND_PARALLEL.closure(ElementSet.empty()));
        assertEquals(ElementSet.of(0, 1, 2), LOOP_AND_PARALLEL.closure(ElementSet.of(2)));
        assertTrue(LOOP_AND_PARALLEL.isClosed(ElementSet.of(0, 3)));
        assertFalse(LOOP_AND_PARALLEL.isClosed(ElementSet.of(3)));
    }

    @Test
    @DisplayName("Full rank of the free matroid equals the ground-set size")
    void testFreeMatroid() {
        CircuitsOracle free = new CircuitsOracle(SetFamily.bySize(3, List.of()));
        assertEquals(3, free.fullRank());
        assertEquals(ElementSet.of(1), free.closure(ElementSet.of(1)));
    }
}
