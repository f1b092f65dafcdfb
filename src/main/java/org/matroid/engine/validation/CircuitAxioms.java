package org.matroid.engine.validation;

import lombok.experimental.UtilityClass;
import org.jboss.logging.Logger;
import org.matroid.core.SearchBudget;
import org.matroid.core.set.ElementSet;
import org.matroid.core.set.SetFamily;

import java.util.Objects;

/**
 * Circuit axioms: non-empty, pairwise incomparable, and closed under circuit elimination.
 */
@UtilityClass
public class CircuitAxioms {
    public static final String CIRCUIT_EMPTY = "CIRCUIT_EMPTY";
    public static final String CIRCUIT_NOT_MINIMAL = "CIRCUIT_NOT_MINIMAL";
    public static final String CIRCUIT_ELIMINATION = "CIRCUIT_ELIMINATION";

    private static final Logger LOG = Logger.getLogger(CircuitAxioms.class);

    /**
     * Checks every pair {@code C1, C2} with {@code |C1| <= |C2|}.
     *
     * @param circuits circuits keyed by size.
     * @param budget search budget; one step per pair.
     * @return first violation, or valid.
     */
    public static ValidationResult validate(SetFamily circuits, SearchBudget budget) {
        Objects.requireNonNull(circuits, "circuits");
        SearchBudget.Tracker tracker = Objects.requireNonNull(budget, "budget").start("circuit axioms");

        for (int i : circuits.keys()) {
            for (ElementSet c1 : circuits.partition(i)) {
                if (c1.isEmpty()) {
                    return reject(CIRCUIT_EMPTY, "the empty set is not a circuit");
                }
                for (int j : circuits.keys().tailSet(i)) {
                    for (ElementSet c2 : circuits.partition(j)) {
                        if (c1.equals(c2)) {
                            continue;
                        }
                        tracker.step();
                        if (c1.isSubsetOf(c2)) {
                            return reject(CIRCUIT_NOT_MINIMAL, "circuit " + c1 + " is a proper subset of " + c2);
                        }
                        ElementSet union = c1.union(c2);
                        ElementSet common = c1.intersection(c2);
                        for (int e = common.first(); e >= 0; e = common.nextElement(e + 1)) {
                            ElementSet eliminated = union.without(e);
                            if (circuits.firstSubsetOf(eliminated, eliminated.cardinality()).isEmpty()) {
                                return reject(
                                        CIRCUIT_ELIMINATION,
                                        "no circuit inside (" + c1 + " ∪ " + c2 + ") - " + e
                                );
                            }
                        }
                    }
                }
            }
        }
        return ValidationResult.ok();
    }

    private static ValidationResult reject(String reasonCode, String message) {
        LOG.debugf("circuit family rejected [%s]: %s", reasonCode, message);
        return ValidationResult.violation(reasonCode, message);
    }
}
