package org.atsp.search;

import java.util.concurrent.TimeUnit;

/**
 * Iteration and wall-clock bounds for restart-style search drivers.
 */
public final class SearchBudget {
    public static final int UNBOUNDED_ITERATIONS = Integer.MAX_VALUE;
    public static final long UNBOUNDED_MILLIS = Long.MAX_VALUE;

    private static final String PROP_MAX_ITERATIONS = "atsp.search.maxIterations";
    private static final String PROP_TIME_BUDGET_MILLIS = "atsp.search.timeBudgetMillis";

    private final int maxIterations;
    private final long timeBudgetMillis;

    private SearchBudget(int maxIterations, long timeBudgetMillis) {
        this.maxIterations = maxIterations <= 0 ? UNBOUNDED_ITERATIONS : maxIterations;
        this.timeBudgetMillis = timeBudgetMillis <= 0L ? UNBOUNDED_MILLIS : timeBudgetMillis;
    }

    /**
     * Creates a budget; non-positive values mean unbounded.
     */
    public static SearchBudget of(int maxIterations, long timeBudgetMillis) {
        return new SearchBudget(maxIterations, timeBudgetMillis);
    }

    public static SearchBudget ofIterations(int maxIterations) {
        return new SearchBudget(maxIterations, 0L);
    }

    public static SearchBudget ofMillis(long timeBudgetMillis) {
        return new SearchBudget(0, timeBudgetMillis);
    }

    /**
     * Loads budget values from {@code atsp.search.*} system properties.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(
                (int) Math.min(Integer.MAX_VALUE, readBound(PROP_MAX_ITERATIONS)),
                readBound(PROP_TIME_BUDGET_MILLIS)
        );
    }

    public int maxIterations() {
        return maxIterations;
    }

    public long timeBudgetMillis() {
        return timeBudgetMillis;
    }

    /**
     * @return true when at least one bound is finite.
     */
    public boolean isBounded() {
        return maxIterations != UNBOUNDED_ITERATIONS || timeBudgetMillis != UNBOUNDED_MILLIS;
    }

    /**
     * Starts measuring a run against this budget.
     */
    public Run start() {
        return new Run(System.nanoTime());
    }

    private static long readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }

    @Override
    public String toString() {
        return "SearchBudget{maxIterations=" + (maxIterations == UNBOUNDED_ITERATIONS ? "unbounded" : maxIterations)
                + ", timeBudgetMillis=" + (timeBudgetMillis == UNBOUNDED_MILLIS ? "unbounded" : timeBudgetMillis) + "}";
    }

    /**
     * One measured run: counts iterations and compares elapsed time with the budget.
     */
    public final class Run {
        private final long startNanos;
        private int iterations;

        private Run(long startNanos) {
            this.startNanos = startNanos;
        }

        /**
         * Records one completed iteration.
         */
        public void completeIteration() {
            iterations++;
        }

        public int iterations() {
            return iterations;
        }

        public long elapsedMillis() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }

        /**
         * @return true once either bound has been reached.
         */
        public boolean isExhausted() {
            if (iterations >= maxIterations) {
                return true;
            }
            return timeBudgetMillis != UNBOUNDED_MILLIS && elapsedMillis() >= timeBudgetMillis;
        }
    }
}
