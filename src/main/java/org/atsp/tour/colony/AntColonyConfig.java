package org.atsp.tour.colony;

import lombok.Builder;
import lombok.Value;

/**
 * Ant-colony sampling configuration.
 */
@Value
@Builder
public class AntColonyConfig {
    private static final String PROP_ANTS = "atsp.colony.ants";
    private static final String PROP_ALPHA = "atsp.colony.alpha";
    private static final String PROP_BETA = "atsp.colony.beta";
    private static final String PROP_EVAPORATION = "atsp.colony.evaporation";
    private static final String PROP_DEPOSIT = "atsp.colony.deposit";
    private static final String PROP_PHEROMONE_FLOOR = "atsp.colony.pheromoneFloor";
    private static final String PROP_WORKERS = "atsp.colony.workers";

    private static final int DEFAULT_ANTS = 200;
    private static final double DEFAULT_ALPHA = 0.9d;
    private static final double DEFAULT_BETA = 1.5d;
    private static final double DEFAULT_EVAPORATION = 0.9d;
    private static final double DEFAULT_DEPOSIT = 10.0d;
    private static final double DEFAULT_PHEROMONE_FLOOR = 1e-5d;

    /**
     * Ants sampled per round.
     */
    @Builder.Default
    int antsPerRound = DEFAULT_ANTS;

    /**
     * Pheromone exponent.
     */
    @Builder.Default
    double alpha = DEFAULT_ALPHA;

    /**
     * Distance exponent; weights divide by {@code distance^beta}.
     */
    @Builder.Default
    double beta = DEFAULT_BETA;

    /**
     * Factor in {@code (0, 1)} applied to the whole trail after every deposit.
     */
    @Builder.Default
    double evaporation = DEFAULT_EVAPORATION;

    /**
     * Deposit numerator: each selected ant adds {@code depositScale / length} per edge.
     */
    @Builder.Default
    double depositScale = DEFAULT_DEPOSIT;

    /**
     * Lower clamp applied to pheromone levels when weighting candidates.
     */
    @Builder.Default
    double pheromoneFloor = DEFAULT_PHEROMONE_FLOOR;

    /**
     * Initial level of every trail entry.
     */
    @Builder.Default
    double initialPheromone = 0.0d;

    /**
     * Worker threads constructing ants. {@code 1} constructs ants on the calling thread.
     */
    @Builder.Default
    int workerThreads = Runtime.getRuntime().availableProcessors();

    /**
     * Loads configuration from {@code atsp.colony.*} system properties. Absent or malformed
     * values keep the built-in default.
     */
    public static AntColonyConfig defaults() {
        return AntColonyConfig.builder()
                .antsPerRound(readInt(PROP_ANTS, DEFAULT_ANTS))
                .alpha(readDouble(PROP_ALPHA, DEFAULT_ALPHA))
                .beta(readDouble(PROP_BETA, DEFAULT_BETA))
                .evaporation(readDouble(PROP_EVAPORATION, DEFAULT_EVAPORATION))
                .depositScale(readDouble(PROP_DEPOSIT, DEFAULT_DEPOSIT))
                .pheromoneFloor(readDouble(PROP_PHEROMONE_FLOOR, DEFAULT_PHEROMONE_FLOOR))
                .workerThreads(readInt(PROP_WORKERS, Runtime.getRuntime().availableProcessors()))
                .build();
    }

    /**
     * Validates value ranges.
     *
     * @return this configuration.
     * @throws IllegalArgumentException when a value is out of range.
     */
    public AntColonyConfig validated() {
        if (antsPerRound <= 0) {
            throw new IllegalArgumentException("antsPerRound must be > 0");
        }
        if (!Double.isFinite(alpha) || alpha < 0.0d) {
            throw new IllegalArgumentException("alpha must be finite and >= 0");
        }
        if (!Double.isFinite(beta) || beta < 0.0d) {
            throw new IllegalArgumentException("beta must be finite and >= 0");
        }
        if (!(evaporation > 0.0d && evaporation < 1.0d)) {
            throw new IllegalArgumentException("evaporation must be in (0, 1)");
        }
        if (!Double.isFinite(depositScale) || depositScale <= 0.0d) {
            throw new IllegalArgumentException("depositScale must be finite and > 0");
        }
        if (!Double.isFinite(pheromoneFloor) || pheromoneFloor <= 0.0d) {
            throw new IllegalArgumentException("pheromoneFloor must be finite and > 0");
        }
        if (!Double.isFinite(initialPheromone) || initialPheromone < 0.0d) {
            throw new IllegalArgumentException("initialPheromone must be finite and >= 0");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0");
        }
        return this;
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
