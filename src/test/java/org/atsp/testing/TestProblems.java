package org.atsp.testing;

import org.atsp.tour.core.Arc;
import org.atsp.tour.core.TourState;
import org.atsp.tour.problem.Problem;

import java.util.SplittableRandom;

/**
 * Shared problem fixtures for tests.
 */
public final class TestProblems {
    /**
     * Small symmetric instance where every closed tour has length 14.
     */
    public static final double[][] FOUR_CITY = {
            {0, 1, 2, 3},
            {1, 0, 4, 5},
            {2, 4, 0, 6},
            {3, 5, 6, 0}
    };

    /**
     * Regular hexagon with rounded Euclidean distances; the optimal tour walks the rim
     * ({@code 0->1->2->3->4->5->0}, length 60).
     */
    public static final double[][] HEXAGON = {
            {0, 10, 17, 20, 17, 10},
            {10, 0, 10, 17, 20, 17},
            {17, 10, 0, 10, 17, 20},
            {20, 17, 10, 0, 10, 17},
            {17, 20, 17, 10, 0, 10},
            {10, 17, 20, 17, 10, 0}
    };

    private TestProblems() {
    }

    public static Problem fourCity() {
        return Problem.fromDistanceMatrix(4, FOUR_CITY);
    }

    public static Problem hexagon() {
        return Problem.fromDistanceMatrix(6, HEXAGON);
    }

    /**
     * Random asymmetric integer instance. Small weight ranges are mixed in to force ties.
     */
    public static Problem randomAsymmetric(int dimension, SplittableRandom random) {
        double[][] matrix = new double[dimension][dimension];
        boolean narrow = random.nextBoolean();
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                if (i != j) {
                    matrix[i][j] = narrow ? random.nextInt(6) : random.nextInt(101);
                }
            }
        }
        return Problem.fromDistanceMatrix(dimension, matrix);
    }

    /**
     * Builds a feasible tour visiting {@code order}, which must start at the anchor.
     */
    public static TourState tourOf(Problem problem, int... order) {
        TourState tour = problem.emptyTour();
        for (int i = 1; i < order.length; i++) {
            tour.add(new Arc(order[i - 1], order[i]));
        }
        return tour;
    }

    /**
     * Builds a feasible tour along a random permutation starting at the anchor.
     */
    public static TourState randomTour(Problem problem, SplittableRandom random) {
        int n = problem.dimension();
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        for (int i = n - 1; i > 1; i--) {
            int j = 1 + random.nextInt(i);
            int swap = order[i];
            order[i] = order[j];
            order[j] = swap;
        }
        return tourOf(problem, order);
    }
}
