package org.matroid.engine.validation;

import lombok.experimental.UtilityClass;
import org.jboss.logging.Logger;
import org.matroid.core.set.ElementSet;
import org.matroid.engine.lattice.InclusionPoset;

import java.util.Objects;

/**
 * Lattice-of-flats axioms: the ground set belongs to the poset and the poset is a geometric lattice.
 */
@UtilityClass
public class LatticeAxioms {
    public static final String LATTICE_GROUND_SET_MISSING = "LATTICE_GROUND_SET_MISSING";
    public static final String LATTICE_NOT_GEOMETRIC = "LATTICE_NOT_GEOMETRIC";

    private static final Logger LOG = Logger.getLogger(LatticeAxioms.class);

    /**
     * Validates a lattice of flats.
     *
     * @param lattice inclusion poset of candidate flats.
     * @param groundSetSize number of ground-set elements.
     * @return first violation, or valid.
     */
    public static ValidationResult validate(InclusionPoset lattice, int groundSetSize) {
        Objects.requireNonNull(lattice, "lattice");
        ElementSet groundSet = ElementSet.range(groundSetSize);
        if (lattice.indexOf(groundSet) < 0) {
            return reject(LATTICE_GROUND_SET_MISSING, "ground set " + groundSet + " is not in the lattice");
        }
        if (!lattice.isLattice()) {
            return reject(LATTICE_NOT_GEOMETRIC, "poset is not a lattice");
        }
        if (!lattice.isGraded()) {
            return reject(LATTICE_NOT_GEOMETRIC, "lattice is not graded");
        }
        if (!lattice.isAtomistic()) {
            return reject(LATTICE_NOT_GEOMETRIC, "lattice is not atomistic");
        }
        if (!lattice.isUpperSemimodular()) {
            return reject(LATTICE_NOT_GEOMETRIC, "lattice is not upper semimodular");
        }
        return ValidationResult.ok();
    }

    private static ValidationResult reject(String reasonCode, String message) {
        LOG.debugf("lattice of flats rejected [%s]: %s", reasonCode, message);
        return ValidationResult.violation(reasonCode, message);
    }
}
