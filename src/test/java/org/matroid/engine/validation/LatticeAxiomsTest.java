package org.matroid.engine.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.matroid.core.set.ElementSet;
import org.matroid.engine.lattice.InclusionPoset;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LatticeAxioms Tests")
class LatticeAxiomsTest {

    @Test
    @DisplayName("Boolean lattice on two elements is geometric")
    void testBooleanValid() {
        InclusionPoset lattice = InclusionPoset.of(List.of(
                ElementSet.empty(), ElementSet.of(0), ElementSet.of(1), ElementSet.of(0, 1)));
        assertTrue(LatticeAxioms.validate(lattice, 2).valid());
    }

    @Test
    @DisplayName("Missing ground set is rejected")
    void testGroundSetMissing() {
        InclusionPoset lattice = InclusionPoset.of(List.of(
                ElementSet.empty(), ElementSet.of(0), ElementSet.of(1)));
        ValidationResult result = LatticeAxioms.validate(lattice, 2);
        assertFalse(result.valid());
        assertEquals(LatticeAxioms.LATTICE_GROUND_SET_MISSING, result.reasonCode());
    }

    @Test
    @DisplayName("A chain of length two is not atomistic")
    void testChainNotGeometric() {
        InclusionPoset chain = InclusionPoset.of(List.of(
                ElementSet.empty(), ElementSet.of(0), ElementSet.of(0, 1)));
        ValidationResult result = LatticeAxioms.validate(chain, 2);
        assertFalse(result.valid());
        assertEquals(LatticeAxioms.LATTICE_NOT_GEOMETRIC, result.reasonCode());
    }

    @Test
    @DisplayName("A pair without a least upper bound is not a lattice")
    void testNotLattice() {
        // {0} and {1} have two minimal upper bounds, {0,1,2} and {0,1,3}.
        InclusionPoset poset = InclusionPoset.of(List.of(
                ElementSet.empty(),
                ElementSet.of(0),
                ElementSet.of(1),
                ElementSet.of(0, 1, 2),
                ElementSet.of(0, 1, 3),
                ElementSet.of(0, 1, 2, 3)));
        ValidationResult result = LatticeAxioms.validate(poset, 4);
        assertFalse(result.valid());
        assertEquals(LatticeAxioms.LATTICE_NOT_GEOMETRIC, result.reasonCode());
    }

    @Test
    @DisplayName("Pentagon N5 is a lattice but not geometric")
    void testPentagon() {
        InclusionPoset pentagon = InclusionPoset.of(List.of(
                ElementSet.empty(),
                ElementSet.of(0),
                ElementSet.of(0, 1),
                ElementSet.of(2),
                ElementSet.of(0, 1, 2)));
        assertTrue(pentagon.isLattice());
        assertFalse(LatticeAxioms.validate(pentagon, 3).valid());
    }
}
