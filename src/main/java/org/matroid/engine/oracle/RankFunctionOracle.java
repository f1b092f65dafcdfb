package org.matroid.engine.oracle;

import org.matroid.core.set.ElementSet;

import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Rank oracle delegating to an arbitrary rank function.
 */
public final class RankFunctionOracle implements RankOracle {
    private final int groundSetSize;
    private final ToIntFunction<ElementSet> rankFunction;

    public RankFunctionOracle(int groundSetSize, ToIntFunction<ElementSet> rankFunction) {
        if (groundSetSize < 0) {
            throw new IllegalArgumentException("groundSetSize must be >= 0");
        }
        this.groundSetSize = groundSetSize;
        this.rankFunction = Objects.requireNonNull(rankFunction, "rankFunction");
    }

    @Override
    public int groundSetSize() {
        return groundSetSize;
    }

    @Override
    public int rank(ElementSet x) {
        return rankFunction.applyAsInt(x);
    }
}
