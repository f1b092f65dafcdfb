package org.matroid.engine.validation;

import lombok.experimental.UtilityClass;
import org.jboss.logging.Logger;
import org.matroid.core.SearchBudget;
import org.matroid.core.set.ElementSet;
import org.matroid.core.set.SetFamily;

import java.util.Objects;

/**
 * Flat axioms over a rank-keyed family: a single rank-0 flat, the ground set present,
 * unique covers for every one-element extension, and closure under intersection.
 */
@UtilityClass
public class FlatAxioms {
    public static final String FLATS_RANK_ZERO = "FLATS_RANK_ZERO";
    public static final String FLATS_GROUND_SET_MISSING = "FLATS_GROUND_SET_MISSING";
    public static final String FLATS_COVERING = "FLATS_COVERING";
    public static final String FLATS_INTERSECTION = "FLATS_INTERSECTION";

    private static final Logger LOG = Logger.getLogger(FlatAxioms.class);

    /**
     * Validates a flat family.
     *
     * @param flats flats keyed by rank.
     * @param budget search budget; one step per checked extension or pair.
     * @return first violation, or valid.
     */
    public static ValidationResult validate(SetFamily flats, SearchBudget budget) {
        Objects.requireNonNull(flats, "flats");
        SearchBudget.Tracker tracker = Objects.requireNonNull(budget, "budget").start("flat axioms");
        int n = flats.groundSetSize();
        ElementSet groundSet = ElementSet.range(n);

        if (flats.partition(0).size() != 1 || flats.minKey() != 0) {
            return reject(FLATS_RANK_ZERO, "expected exactly one flat of rank 0, found " + flats.partition(0).size());
        }
        if (!flats.contains(groundSet)) {
            return reject(FLATS_GROUND_SET_MISSING, "ground set " + groundSet + " is not a flat");
        }

        for (int i : flats.keys()) {
            for (ElementSet flat : flats.partition(i)) {
                for (int e = 0; e < n; e++) {
                    if (flat.contains(e)) {
                        continue;
                    }
                    tracker.step();
                    ElementSet extended = flat.with(e);
                    int covers = 0;
                    for (ElementSet upper : flats.partition(i + 1)) {
                        if (extended.isSubsetOf(upper)) {
                            covers++;
                        }
                    }
                    if (covers != 1) {
                        return reject(
                                FLATS_COVERING,
                                flat + " + " + e + " is covered by " + covers + " flats of rank " + (i + 1)
                        );
                    }
                }
            }
        }

        for (int i : flats.keys()) {
            for (ElementSet f1 : flats.partition(i)) {
                for (int j : flats.keys().tailSet(i)) {
                    for (ElementSet f2 : flats.partition(j)) {
                        tracker.step();
                        ElementSet meet = f1.intersection(f2);
                        if (!isFlatUpToRank(flats, meet, i)) {
                            return reject(
                                    FLATS_INTERSECTION,
                                    f1 + " ∩ " + f2 + " = " + meet + " is not a flat of rank <= " + i
                            );
                        }
                    }
                }
            }
        }
        return ValidationResult.ok();
    }

    private static boolean isFlatUpToRank(SetFamily flats, ElementSet set, int maxRank) {
        for (int k : flats.keys()) {
            if (k > maxRank) {
                return false;
            }
            if (flats.partition(k).contains(set)) {
                return true;
            }
        }
        return false;
    }

    private static ValidationResult reject(String reasonCode, String message) {
        LOG.debugf("flat family rejected [%s]: %s", reasonCode, message);
        return ValidationResult.violation(reasonCode, message);
    }
}
