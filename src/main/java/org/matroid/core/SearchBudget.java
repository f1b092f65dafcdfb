package org.matroid.core;

/**
 * Step and wall-clock bounds for exponential searches (validation, isomorphism, enumeration).
 *
 * <p>A budget is a static policy; each search opens its own {@link Tracker} so one
 * budget can be reused across concurrent calls.</p>
 */
public final class SearchBudget {
    public static final long UNBOUNDED = Long.MAX_VALUE;

    static final String PROP_MAX_STEPS = "matroid.search.maxSteps";
    static final String PROP_TIMEOUT_MILLIS = "matroid.search.timeoutMillis";

    private static final SearchBudget UNLIMITED = new SearchBudget(UNBOUNDED, UNBOUNDED);
    // Clock reads are throttled to once per this many steps.
    private static final int CLOCK_CHECK_INTERVAL = 1024;

    private final long maxSteps;
    private final long timeoutMillis;

    private SearchBudget(long maxSteps, long timeoutMillis) {
        this.maxSteps = normalizeBound(maxSteps);
        this.timeoutMillis = normalizeBound(timeoutMillis);
    }

    /**
     * Creates a budget with explicit bounds; non-positive values mean unbounded.
     */
    public static SearchBudget of(long maxSteps, long timeoutMillis) {
        return new SearchBudget(maxSteps, timeoutMillis);
    }

    /**
     * Returns a budget without bounds.
     */
    public static SearchBudget unlimited() {
        return UNLIMITED;
    }

    /**
     * Loads bounds from the {@code matroid.search.*} system properties.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(readBound(PROP_MAX_STEPS), readBound(PROP_TIMEOUT_MILLIS));
    }

    public long maxSteps() {
        return maxSteps;
    }

    public long timeoutMillis() {
        return timeoutMillis;
    }

    public boolean isUnbounded() {
        return maxSteps == UNBOUNDED && timeoutMillis == UNBOUNDED;
    }

    /**
     * Starts tracking one search against this budget.
     *
     * @param operation operation name used in failure messages.
     */
    public Tracker start(String operation) {
        return new Tracker(operation);
    }

    private static long normalizeBound(long bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static long readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    @Override
    public String toString() {
        return "SearchBudget{maxSteps=" + (maxSteps == UNBOUNDED ? "unbounded" : maxSteps)
                + ", timeoutMillis=" + (timeoutMillis == UNBOUNDED ? "unbounded" : timeoutMillis) + "}";
    }

    /**
     * Per-search step counter. Not thread-safe.
     */
    public final class Tracker {
        private final String operation;
        private final long deadlineNanos;
        private long steps;

        private Tracker(String operation) {
            this.operation = operation;
            if (timeoutMillis == UNBOUNDED) {
                this.deadlineNanos = Long.MAX_VALUE;
            } else {
                long now = System.nanoTime();
                long timeoutNanos = timeoutMillis >= Long.MAX_VALUE / 1_000_000L
                        ? Long.MAX_VALUE
                        : timeoutMillis * 1_000_000L;
                this.deadlineNanos = now + timeoutNanos < now ? Long.MAX_VALUE : now + timeoutNanos;
            }
        }

        /**
         * Records one unit of work.
         *
         * @throws MatroidException with {@link MatroidException#SEARCH_BUDGET_EXCEEDED} when exhausted.
         */
        public void step() {
            steps++;
            if (steps > maxSteps) {
                throw new MatroidException(
                        MatroidException.SEARCH_BUDGET_EXCEEDED,
                        operation + ": step budget exceeded: " + steps + " > " + maxSteps
                );
            }
            if (deadlineNanos != Long.MAX_VALUE
                    && steps % CLOCK_CHECK_INTERVAL == 0
                    && System.nanoTime() - deadlineNanos > 0) {
                throw new MatroidException(
                        MatroidException.SEARCH_BUDGET_EXCEEDED,
                        operation + ": time budget exceeded after " + steps + " steps (" + timeoutMillis + " ms)"
                );
            }
        }

        public long steps() {
            return steps;
        }
    }
}
