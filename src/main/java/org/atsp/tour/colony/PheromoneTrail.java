package org.atsp.tour.colony;

import java.util.Arrays;

/**
 * Dense matrix of learned edge desirabilities owned by one colony engine.
 *
 * <p>Worker tasks receive a {@link #snapshot()} and only read it; deposits and evaporation
 * happen on the owning thread between rounds.</p>
 */
public final class PheromoneTrail {
    private final int dimension;
    private final double[][] levels;

    /**
     * Creates a trail with every entry at {@code initialLevel}.
     */
    public PheromoneTrail(int dimension, double initialLevel) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
        this.levels = new double[dimension][dimension];
        for (double[] row : levels) {
            Arrays.fill(row, initialLevel);
        }
    }

    private PheromoneTrail(PheromoneTrail other) {
        this.dimension = other.dimension;
        this.levels = new double[dimension][];
        for (int i = 0; i < dimension; i++) {
            levels[i] = Arrays.copyOf(other.levels[i], dimension);
        }
    }

    public int dimension() {
        return dimension;
    }

    public double level(int from, int to) {
        return levels[from][to];
    }

    /**
     * Adds {@code amount} to every edge of the cyclic path, closing edge included.
     */
    public void deposit(int[] cyclicPath, double amount) {
        int length = cyclicPath.length;
        if (length < 2) {
            return;
        }
        for (int i = 0; i < length; i++) {
            levels[cyclicPath[i]][cyclicPath[(i + 1) % length]] += amount;
        }
    }

    /**
     * Multiplies every entry by {@code factor}.
     */
    public void evaporate(double factor) {
        for (double[] row : levels) {
            for (int j = 0; j < dimension; j++) {
                row[j] *= factor;
            }
        }
    }

    /**
     * Deep copy, used as the read-only view handed to ant workers.
     */
    public PheromoneTrail snapshot() {
        return new PheromoneTrail(this);
    }
}
