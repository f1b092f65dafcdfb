package org.matroid.core.id;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.matroid.core.set.ElementSet;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilGroundSetTest {

    private GroundSet<String> groundSet;

    @BeforeEach
    void setUp() {
        groundSet = GroundSet.of(List.of("c", "a", "b", "d"));
    }

    @Test
    @DisplayName("Baseline Correctness: labels are indexed in natural order")
    void testNaturalOrderIndexing() {
        assertEquals(4, groundSet.size());
        assertEquals(0, groundSet.indexOf("a"));
        assertEquals(2, groundSet.indexOf("c"));
        assertEquals("d", groundSet.elementAt(3));
        assertEquals(List.of("a", "b", "c", "d"), groundSet.elements());

        assertTrue(groundSet.contains("b"));
        assertFalse(groundSet.contains("z"));
        assertFalse(groundSet.contains(null));
    }

    @Test
    @DisplayName("Duplicates are merged")
    void testDuplicatesMerged() {
        GroundSet<Integer> merged = GroundSet.of(Arrays.asList(3, 1, 3, 2, 1));
        assertEquals(3, merged.size());
        assertEquals(List.of(1, 2, 3), merged.elements());
    }

    @Test
    @DisplayName("Encode/Decode: subsets map to index bit sets and back")
    void testEncodeDecode() {
        ElementSet encoded = groundSet.encode(Set.of("d", "a"));
        assertEquals(ElementSet.of(0, 3), encoded);

        SortedSet<String> decoded = groundSet.decode(ElementSet.of(1, 2));
        assertEquals(List.of("b", "c"), List.copyOf(decoded));

        assertEquals(ElementSet.range(4), groundSet.all());
        assertTrue(groundSet.encode(Set.of()).isEmpty());
    }

    @Test
    @DisplayName("Exception Path: Unknown label")
    void testUnknownLabel() {
        assertThrows(GroundSet.UnknownElementException.class, () -> groundSet.indexOf("z"));
        assertThrows(GroundSet.UnknownElementException.class, () -> groundSet.encode(List.of("a", "z")));
    }

    @Test
    @DisplayName("Exception Path: Invalid index")
    void testInvalidIndex() {
        assertThrows(IndexOutOfBoundsException.class, () -> groundSet.elementAt(4));
        assertThrows(IndexOutOfBoundsException.class, () -> groundSet.elementAt(-1));
    }

    @Test
    @DisplayName("Constructor Validation: Reject null ground set and null labels")
    void testRejectNulls() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilGroundSet<String>(null));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilGroundSet<>(Arrays.asList("a", null)));
        assertThrows(IllegalArgumentException.class, () -> groundSet.indexOf(null));
    }

    @Test
    @DisplayName("Equality follows the ordered label list")
    void testEquality() {
        GroundSet<String> same = GroundSet.of(List.of("a", "b", "c", "d"));
        GroundSet<String> other = GroundSet.of(List.of("a", "b", "c"));
        assertEquals(groundSet, same);
        assertEquals(groundSet.hashCode(), same.hashCode());
        assertNotEquals(groundSet, other);
    }

    @Test
    @DisplayName("Empty ground set")
    void testEmptyGroundSet() {
        GroundSet<String> empty = GroundSet.of(List.of());
        assertEquals(0, empty.size());
        assertTrue(empty.all().isEmpty());
        assertTrue(empty.decode(ElementSet.empty()).isEmpty());
    }

    @Test
    @DisplayName("Concurrency: Thread-safe Read Operations")
    void testConcurrentReads() throws InterruptedException {
        int threads = 8;
        int iterations = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicInteger errors = new AtomicInteger(0);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < iterations; i++) {
                        ElementSet encoded = groundSet.encode(List.of("b", "d"));
                        if (!groundSet.decode(encoded).equals(Set.of("b", "d"))) {
                            errors.incrementAndGet();
                        }
                    }
                } catch (RuntimeException e) {
                    errors.incrementAndGet();
                }
            });
        }

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not finish in time");
        assertEquals(0, errors.get(), "Concurrent reads caused errors");
    }
}
