package org.atsp.search;

import lombok.Builder;
import lombok.Value;
import org.atsp.tour.colony.AntColonyConfig;
import org.atsp.tour.core.BoundType;
import org.atsp.tour.move.MoveEngineType;

/**
 * GRASP driver configuration.
 */
@Value
@Builder
public class GraspConfig {
    private static final int DEFAULT_ITERATIONS = 100;

    /**
     * Restricted-candidate-list width in {@code [0, 1]}.
     */
    @Builder.Default
    double alpha = 0.1d;

    /**
     * Bound model ranking candidate arcs during construction.
     */
    @Builder.Default
    BoundType boundType = BoundType.ASSIGNMENT;

    /**
     * Engine used to descend from every constructed tour; {@code null} keeps raw constructions.
     */
    MoveEngineType localSearch;

    /**
     * Colony parameters when {@link #localSearch} is {@link MoveEngineType#ANT_COLONY}.
     */
    AntColonyConfig colonyConfig;

    /**
     * Stop condition; must bound iterations, time or both.
     */
    @Builder.Default
    SearchBudget budget = SearchBudget.ofIterations(DEFAULT_ITERATIONS);

    /**
     * Seed for construction and local search randomness.
     */
    @Builder.Default
    long seed = 42L;

    /**
     * Validates value ranges.
     *
     * @return this configuration.
     * @throws IllegalArgumentException when a value is out of range.
     */
    public GraspConfig validated() {
        if (!(alpha >= 0.0d && alpha <= 1.0d)) {
            throw new IllegalArgumentException("alpha must be in [0, 1]");
        }
        if (boundType == null) {
            throw new IllegalArgumentException("boundType must be provided");
        }
        if (budget == null || !budget.isBounded()) {
            throw new IllegalArgumentException("budget must bound iterations or time");
        }
        return this;
    }
}
