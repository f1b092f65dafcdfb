package org.matroid.engine.oracle;

import org.matroid.core.set.ElementSet;
import org.matroid.core.set.SetFamily;

import java.util.Objects;

/**
 * Rank oracle answering from a flat family partitioned by rank.
 *
 * <p>Rank and closure come from the lowest-rank flat containing the query. If no flat
 * contains it (the ground set is missing from invalid data), rank falls back to the top
 * key and closure to the whole ground set.</p>
 */
public final class FlatsOracle implements RankOracle {
    private final SetFamily flats;

    /**
     * @param flats flats keyed by rank.
     */
    public FlatsOracle(SetFamily flats) {
        this.flats = Objects.requireNonNull(flats, "flats");
    }

    @Override
    public int groundSetSize() {
        return flats.groundSetSize();
    }

    @Override
    public int rank(ElementSet x) {
        int key = flats.firstSupersetKey(x);
        if (key >= 0) {
            return key;
        }
        return Math.max(flats.maxKey(), 0);
    }

    @Override
    public int fullRank() {
        return Math.max(flats.maxKey(), 0);
    }

    @Override
    public ElementSet closure(ElementSet x) {
        return flats.firstSuperset(x).orElseGet(() -> ElementSet.range(groundSetSize()));
    }

    @Override
    public boolean isClosed(ElementSet x) {
        return flats.contains(x);
    }

    public SetFamily flats() {
        return flats;
    }
}
