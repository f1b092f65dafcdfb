package org.matroid.core.set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ElementSet Tests")
class ElementSetTest {

    @Test
    @DisplayName("Set algebra over element indices")
    void testSetAlgebra() {
        ElementSet a = ElementSet.of(0, 1, 2);
        ElementSet b = ElementSet.of(2, 3);

        assertEquals(ElementSet.of(0, 1, 2, 3), a.union(b));
        assertEquals(ElementSet.of(2), a.intersection(b));
        assertEquals(ElementSet.of(0, 1), a.minus(b));
        assertTrue(a.intersects(b));
        assertFalse(ElementSet.of(0).intersects(ElementSet.of(1)));
    }

    @Test
    @DisplayName("Subset and proper subset")
    void testSubsetRelations() {
        ElementSet small = ElementSet.of(1, 2);
        ElementSet large = ElementSet.of(0, 1, 2);

        assertTrue(small.isSubsetOf(large));
        assertTrue(small.isProperSubsetOf(large));
        assertTrue(large.isSubsetOf(large));
        assertFalse(large.isProperSubsetOf(large));
        assertFalse(large.isSubsetOf(small));
        assertTrue(ElementSet.empty().isSubsetOf(small));
    }

    @Test
    @DisplayName("with/without return the same instance when nothing changes")
    void testWithWithout() {
        ElementSet set = ElementSet.of(1, 4);
        assertSame(set, set.with(4));
        assertSame(set, set.without(2));
        assertEquals(ElementSet.of(1, 2, 4), set.with(2));
        assertEquals(ElementSet.of(4), set.without(1));
        assertEquals(ElementSet.of(1, 4), set, "original is unchanged");
    }

    @Test
    @DisplayName("Iteration helpers walk indices in ascending order")
    void testIterationHelpers() {
        ElementSet set = ElementSet.of(5, 1, 3, 3);
        assertEquals(3, set.cardinality());
        assertEquals(1, set.first());
        assertEquals(3, set.nextElement(2));
        assertEquals(-1, set.nextElement(6));
        assertEquals(6, set.length());
        assertArrayEquals(new int[]{1, 3, 5}, set.toArray());
        assertEquals("{1, 3, 5}", set.toString());

        assertEquals(-1, ElementSet.empty().first());
        assertEquals(0, ElementSet.empty().length());
    }

    @Test
    @DisplayName("Ordering: cardinality first, then lexicographic")
    void testOrdering() {
        TreeSet<ElementSet> sorted = new TreeSet<>(List.of(
                ElementSet.of(0, 2),
                ElementSet.of(3),
                ElementSet.of(0, 1),
                ElementSet.empty(),
                ElementSet.of(0, 1, 2)
        ));
        assertEquals(List.of(
                ElementSet.empty(),
                ElementSet.of(3),
                ElementSet.of(0, 1),
                ElementSet.of(0, 2),
                ElementSet.of(0, 1, 2)
        ), List.copyOf(sorted));
    }

    @Test
    @DisplayName("Backing bits are copied on the way in and out")
    void testDefensiveCopies() {
        BitSet bits = new BitSet();
        bits.set(2);
        ElementSet set = ElementSet.of(bits);
        bits.set(7);
        assertEquals(ElementSet.of(2), set);

        BitSet exported = set.toBitSet();
        exported.set(9);
        assertFalse(set.contains(9));
    }

    @Test
    @DisplayName("Negative indices are rejected")
    void testNegativeIndexRejected() {
        assertThrows(IllegalArgumentException.class, () -> ElementSet.of(0, -1));
        assertFalse(ElementSet.of(0).contains(-1));
    }

    @Test
    @DisplayName("range(n) holds 0..n-1")
    void testRange() {
        assertEquals(ElementSet.of(0, 1, 2), ElementSet.range(3));
        assertTrue(ElementSet.range(0).isEmpty());
        assertEquals(ElementSet.empty(), ElementSet.range(0));
        assertEquals(ElementSet.empty().hashCode(), ElementSet.range(0).hashCode());
    }
}
