package org.atsp.tour.problem;

import it.unimi.dsi.fastutil.ints.IntArrays;
import org.atsp.tour.core.BoundType;
import org.atsp.tour.core.TourState;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable asymmetric TSP instance with its neighbor-rank index.
 *
 * <p>For every city {@code i} two rankings of all <em>other</em> cities are precomputed:</p>
 * <ul>
 * <li>{@code shortestOut(i, r)}: the r-th cheapest destination by {@code distance(i, .)}.</li>
 * <li>{@code shortestIn(i, r)}: the r-th cheapest source by {@code distance(., i)}.</li>
 * </ul>
 * <p>The city itself never appears in its own rankings, so each ranking has
 * {@code dimension - 1} entries. Ties are broken by ascending city id.</p>
 *
 * <p>Instances are thread-safe for concurrent reads.</p>
 */
public final class Problem {
    /** City every tour starts from and closes back to. */
    public static final int ANCHOR = 0;

    private final int dimension;
    private final double[][] distances;
    private final int[][] shortestOut;
    private final int[][] shortestIn;
    private final double emptyTourLowerBound;

    private Problem(int dimension, double[][] distances) {
        this.dimension = dimension;
        this.distances = distances;
        this.shortestOut = new int[dimension][];
        this.shortestIn = new int[dimension][];
        double raw = 0.0d;
        for (int city = 0; city < dimension; city++) {
            shortestOut[city] = rankOutgoing(city);
            shortestIn[city] = rankIncoming(city);
            if (dimension > 1) {
                raw += distances[city][shortestOut[city][0]] + distances[shortestIn[city][0]][city];
            }
        }
        this.emptyTourLowerBound = raw / 2.0d;
    }

    /**
     * Builds a problem from a square distance matrix.
     *
     * <p>The matrix is copied. Diagonal entries are ignored; off-diagonal entries must be
     * finite and non-negative.</p>
     *
     * @param dimension number of cities, must be positive.
     * @param matrix row-major distances, {@code matrix[i][j]} is the cost of {@code i -> j}.
     * @return immutable problem.
     * @throws ProblemDefinitionException when the dimension or matrix is invalid.
     */
    public static Problem fromDistanceMatrix(int dimension, double[][] matrix) {
        if (dimension <= 0) {
            throw new ProblemDefinitionException(
                    ProblemDefinitionException.REASON_DIMENSION_INVALID,
                    "dimension must be > 0, got " + dimension
            );
        }
        if (matrix == null || matrix.length != dimension) {
            throw new ProblemDefinitionException(
                    ProblemDefinitionException.REASON_MATRIX_SHAPE,
                    "matrix must have " + dimension + " rows"
            );
        }
        double[][] copy = new double[dimension][];
        for (int i = 0; i < dimension; i++) {
            double[] row = matrix[i];
            if (row == null || row.length != dimension) {
                throw new ProblemDefinitionException(
                        ProblemDefinitionException.REASON_MATRIX_SHAPE,
                        "row " + i + " must have " + dimension + " columns"
                );
            }
            for (int j = 0; j < dimension; j++) {
                if (i != j && (!Double.isFinite(row[j]) || row[j] < 0.0d)) {
                    throw new ProblemDefinitionException(
                            ProblemDefinitionException.REASON_DISTANCE_INVALID,
                            "distance(" + i + ", " + j + ") must be finite and >= 0, got " + row[j]
                    );
                }
            }
            copy[i] = Arrays.copyOf(row, dimension);
        }
        return new Problem(dimension, copy);
    }

    /**
     * Integer-matrix overload used by text inputs.
     */
    public static Problem fromDistanceMatrix(int dimension, int[][] matrix) {
        if (matrix == null) {
            return fromDistanceMatrix(dimension, (double[][]) null);
        }
        double[][] widened = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            int[] row = matrix[i];
            if (row == null) {
                continue;
            }
            widened[i] = new double[row.length];
            for (int j = 0; j < row.length; j++) {
                widened[i][j] = row[j];
            }
        }
        return fromDistanceMatrix(dimension, widened);
    }

    /**
     * Creates an anchor-only tour tracking the assignment-relaxation bound.
     */
    public TourState emptyTour() {
        return emptyTour(BoundType.ASSIGNMENT);
    }

    /**
     * Creates an anchor-only tour tracking the requested bound model.
     *
     * @param boundType bound model to maintain while the tour is built.
     * @return new mutable tour state.
     */
    public TourState emptyTour(BoundType boundType) {
        return TourState.empty(this, Objects.requireNonNull(boundType, "boundType"));
    }

    /**
     * Assignment-relaxation bound of the empty tour: half the sum over all cities of the
     * cheapest outgoing plus the cheapest incoming edge.
     */
    public double lowerBoundAtEmptyTour() {
        return emptyTourLowerBound;
    }

    public int dimension() {
        return dimension;
    }

    public double distance(int from, int to) {
        return distances[from][to];
    }

    /**
     * Returns the destination at {@code rank} in {@code city}'s ascending outgoing ranking.
     */
    public int shortestOut(int city, int rank) {
        return shortestOut[city][rank];
    }

    /**
     * Returns the source at {@code rank} in {@code city}'s ascending incoming ranking.
     */
    public int shortestIn(int city, int rank) {
        return shortestIn[city][rank];
    }

    /**
     * Number of entries in each ranking ({@code dimension - 1}).
     */
    public int rankCount() {
        return dimension - 1;
    }

    /**
     * Returns a defensive copy of one outgoing ranking.
     */
    public int[] shortestOutCopy(int city) {
        return Arrays.copyOf(shortestOut[city], shortestOut[city].length);
    }

    /**
     * Returns a defensive copy of one incoming ranking.
     */
    public int[] shortestInCopy(int city) {
        return Arrays.copyOf(shortestIn[city], shortestIn[city].length);
    }

    /**
     * Returns a defensive copy of the distance matrix.
     */
    public double[][] distanceMatrixCopy() {
        double[][] copy = new double[dimension][];
        for (int i = 0; i < dimension; i++) {
            copy[i] = Arrays.copyOf(distances[i], dimension);
        }
        return copy;
    }

    /**
     * Length of the closed tour visiting {@code order} and returning to its first city.
     */
    public double closedLength(int[] order) {
        if (order.length <= 1) {
            return 0.0d;
        }
        double total = 0.0d;
        for (int i = 0; i < order.length - 1; i++) {
            total += distances[order[i]][order[i + 1]];
        }
        return total + distances[order[order.length - 1]][order[0]];
    }

    private int[] rankOutgoing(int city) {
        int[] ranked = othersOf(city);
        double[] row = distances[city];
        IntArrays.mergeSort(ranked, (a, b) -> Double.compare(row[a], row[b]));
        return ranked;
    }

    private int[] rankIncoming(int city) {
        int[] ranked = othersOf(city);
        IntArrays.mergeSort(ranked, (a, b) -> Double.compare(distances[a][city], distances[b][city]));
        return ranked;
    }

    private int[] othersOf(int city) {
        int[] others = new int[dimension - 1];
        int next = 0;
        for (int other = 0; other < dimension; other++) {
            if (other != city) {
                others[next++] = other;
            }
        }
        return others;
    }

    @Override
    public String toString() {
        return "Problem{dimension=" + dimension + ", emptyTourLowerBound=" + emptyTourLowerBound + "}";
    }
}
