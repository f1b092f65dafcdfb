package org.matroid.core.set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.matroid.core.MatroidException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SetFamily Tests")
class SetFamilyTest {

    private static SetFamily u24Circuits() {
        return SetFamily.bySize(4, List.of(
                ElementSet.of(0, 1, 2),
                ElementSet.of(0, 1, 3),
                ElementSet.of(0, 2, 3),
                ElementSet.of(1, 2, 3)
        ));
    }

    @Nested
    @DisplayName("1. Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Duplicates are stored once")
        void testDuplicatesMerged() {
            SetFamily family = SetFamily.bySize(3, List.of(
                    ElementSet.of(0, 1),
                    ElementSet.of(1, 0),
                    ElementSet.of(2)
            ));
            assertEquals(2, family.size());
            assertEquals(1, family.partition(2).size());
        }

        @Test
        @DisplayName("Out-of-range index fails with INVALID_INPUT")
        void testOutOfRangeRejected() {
            MatroidException ex = assertThrows(
                    MatroidException.class,
                    () -> SetFamily.bySize(2, List.of(ElementSet.of(0, 2)))
            );
            assertEquals(MatroidException.INVALID_INPUT, ex.reasonCode());
        }

        @Test
        @DisplayName("Explicit keys: a repeated subset keeps its lowest key")
        void testExplicitKeysLowestWins() {
            Map<Integer, List<ElementSet>> keyed = new TreeMap<>();
            keyed.put(2, List.of(ElementSet.of(0, 1)));
            keyed.put(1, List.of(ElementSet.of(0), ElementSet.of(0, 1)));
            SetFamily family = SetFamily.byKey(2, keyed);

            assertEquals(2, family.size());
            assertEquals(1, family.keyOf(ElementSet.of(0, 1)));
            assertTrue(family.partition(2).isEmpty());
            assertEquals(List.of(1), new ArrayList<>(family.keys()));
        }

        @Test
        @DisplayName("Builder reports duplicates")
        void testBuilderDuplicates() {
            SetFamily.Builder builder = new SetFamily.Builder(3);
            assertTrue(builder.add(0, ElementSet.empty()));
            assertFalse(builder.add(4, ElementSet.empty()));
            SetFamily family = builder.build();
            assertEquals(0, family.keyOf(ElementSet.empty()));
            assertThrows(IllegalArgumentException.class, () -> new SetFamily.Builder(-1));
        }
    }

    @Nested
    @DisplayName("2. Queries")
    class QueryTests {

        @Test
        @DisplayName("Membership and key bounds")
        void testMembership() {
            SetFamily family = u24Circuits();
            assertTrue(family.contains(ElementSet.of(0, 2, 3)));
            assertFalse(family.contains(ElementSet.of(0, 1)));
            assertFalse(family.contains(null));
            assertEquals(3, family.minKey());
            assertEquals(3, family.maxKey());
            assertEquals(-1, family.keyOf(ElementSet.of(0)));
        }

        @Test
        @DisplayName("Empty family")
        void testEmptyFamily() {
            SetFamily family = SetFamily.bySize(3, List.of());
            assertTrue(family.isEmpty());
            assertEquals(-1, family.maxKey());
            assertEquals(-1, family.minKey());
            assertFalse(family.iterator().hasNext());
            assertTrue(family.firstSuperset(ElementSet.of(0)).isEmpty());
        }

        @Test
        @DisplayName("Subset and superset lookups scan keys in increasing order")
        void testLookups() {
            Map<Integer, List<ElementSet>> keyed = new TreeMap<>();
            keyed.put(0, List.of(ElementSet.empty()));
            keyed.put(1, List.of(ElementSet.of(0), ElementSet.of(1)));
            keyed.put(2, List.of(ElementSet.of(0, 1)));
            SetFamily flats = SetFamily.byKey(2, keyed);

            assertEquals(1, flats.firstSupersetKey(ElementSet.of(1)));
            assertEquals(ElementSet.of(0, 1), flats.firstSuperset(ElementSet.of(0, 1)).orElseThrow());
            assertEquals(-1, flats.firstSupersetKey(ElementSet.of(2)));

            SetFamily circuits = u24Circuits();
            assertEquals(
                    ElementSet.of(0, 1, 2),
                    circuits.firstSubsetOf(ElementSet.of(0, 1, 2, 3), 3).orElseThrow()
            );
            assertTrue(circuits.firstSubsetOf(ElementSet.of(0, 1, 2), 2).isEmpty());
        }

        @Test
        @DisplayName("Iteration is restartable and follows key order")
        void testIterationOrder() {
            SetFamily family = SetFamily.bySize(3, List.of(
                    ElementSet.of(0, 1, 2),
                    ElementSet.of(1),
                    ElementSet.of(0, 2)
            ));
            List<ElementSet> first = family.toList();
            List<ElementSet> second = new ArrayList<>();
            family.forEach(second::add);

            assertEquals(first, second);
            assertEquals(List.of(ElementSet.of(1), ElementSet.of(0, 2), ElementSet.of(0, 1, 2)), first);
        }
    }

    @Nested
    @DisplayName("3. Equality")
    class EqualityTests {

        @Test
        @DisplayName("Insertion order does not affect equality")
        void testOrderIndependentEquality() {
            SetFamily a = SetFamily.bySize(3, List.of(ElementSet.of(0, 1), ElementSet.of(1, 2)));
            SetFamily b = SetFamily.bySize(3, List.of(ElementSet.of(1, 2), ElementSet.of(0, 1)));
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        @DisplayName("Keys and ground-set size take part in equality")
        void testKeysMatter() {
            SetFamily bySize = SetFamily.bySize(3, List.of(ElementSet.of(0, 1)));
            SetFamily byOther = SetFamily.byKey(3, List.of(ElementSet.of(0, 1)), set -> 1);
            SetFamily wider = SetFamily.bySize(4, List.of(ElementSet.of(0, 1)));
            assertNotEquals(bySize, byOther);
            assertNotEquals(bySize, wider);
        }
    }

    @Test
    @DisplayName("isomorphismTo delegates to the set-system search")
    void testIsomorphismDelegation() {
        SetFamily source = SetFamily.bySize(3, List.of(ElementSet.of(0, 1)));
        SetFamily target = SetFamily.bySize(3, List.of(ElementSet.of(1, 2)));
        int[] image = source.isomorphismTo(target).orElseThrow();
        assertEquals(ElementSet.of(1, 2), ElementSet.of(image[0], image[1]));
        assertEquals(0, image[2]);
    }
}
