package org.atsp.tour.move;

import org.atsp.core.random.SparseFisherYates;
import org.atsp.tour.core.TourCoreException;
import org.atsp.tour.core.TourState;
import org.atsp.tour.problem.Problem;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.SplittableRandom;

/**
 * Shift-insert (Or-opt of length one) over a closed tour.
 *
 * <p>A move {@code (i, j)} takes the city at position {@code i} out from between its
 * neighbors and inserts it between {@code order[j - 1]} and {@code order[j]} (positions
 * taken before removal, modulo {@code n}). Destinations {@code i - 1}, {@code i} and
 * {@code i + 1} are excluded: {@code i} and {@code i + 1} leave the tour unchanged and
 * {@code i - 1} duplicates moving the previous city forward.</p>
 *
 * <p>Valid moves are numbered densely: index {@code m} in {@code [0, n * (n - 3))} maps to
 * {@code i = m / (n - 3)} and {@code j = (i + 2 + m % (n - 3)) mod n}, so random enumeration
 * never materializes the move list.</p>
 */
public final class ShiftInsertEngine implements LocalMoveEngine<ShiftInsertMove> {
    private final TourState tour;
    private final Problem problem;
    private final SplittableRandom random;

    /**
     * Binds the engine to a feasible tour.
     *
     * @param tour feasible tour to mutate.
     * @param random randomness for randomized enumeration.
     * @throws TourCoreException when the tour is infeasible.
     */
    public ShiftInsertEngine(TourState tour, SplittableRandom random) {
        this.tour = Objects.requireNonNull(tour, "tour");
        this.random = Objects.requireNonNull(random, "random");
        this.problem = tour.problem();
        ThreeOptEngine.requireFeasible(tour);
    }

    @Override
    public MoveEngineType type() {
        return MoveEngineType.SHIFT_INSERT;
    }

    @Override
    public TourState tour() {
        return tour;
    }

    @Override
    public Iterator<ShiftInsertMove> localMoves() {
        int n = tour.size();
        int count = moveCount(n);
        return new FailFastMoveIterator<>(tour) {
            private int next = 0;

            @Override
            protected boolean hasNextMove() {
                return next < count;
            }

            @Override
            protected ShiftInsertMove nextMove() {
                return decode(next++, n);
            }
        };
    }

    @Override
    public Iterator<ShiftInsertMove> randomizedLocalMoves() {
        int n = tour.size();
        SparseFisherYates permutation = SparseFisherYates.of(moveCount(n), random);
        return new FailFastMoveIterator<>(tour) {
            @Override
            protected boolean hasNextMove() {
                return permutation.hasNext();
            }

            @Override
            protected ShiftInsertMove nextMove() {
                return decode(permutation.nextInt(), n);
            }
        };
    }

    @Override
    public Optional<ShiftInsertMove> randomLocalMove() {
        int n = tour.size();
        if (n < 4) {
            return Optional.empty();
        }
        int i = random.nextInt(n);
        int offset = random.nextInt(2, n - 1);
        return Optional.of(new ShiftInsertMove(i, (i + offset) % n));
    }

    /**
     * Six-edge delta: removes {@code prev->city}, {@code city->next},
     * {@code prevDest->dest}; adds {@code prev->next}, {@code prevDest->city},
     * {@code city->dest}.
     */
    @Override
    public double objectiveDeltaOf(ShiftInsertMove move) {
        requireValid(move);
        int n = tour.size();
        int i = move.cityIndex();
        int j = move.destinationIndex();
        int city = tour.cityAt(i);
        int prev = tour.cityAt((i - 1 + n) % n);
        int next = tour.cityAt((i + 1) % n);
        int dest = tour.cityAt(j);
        int prevDest = tour.cityAt((j - 1 + n) % n);

        double removed = problem.distance(prev, city) + problem.distance(city, next) + problem.distance(prevDest, dest);
        double added = problem.distance(prev, next) + problem.distance(prevDest, city) + problem.distance(city, dest);
        return removed - added;
    }

    @Override
    public void applyMove(ShiftInsertMove move) {
        double delta = objectiveDeltaOf(move);
        int n = tour.size();
        int i = move.cityIndex();
        int j = move.destinationIndex();
        int insertAt;
        if (j == 0) {
            // in front of the anchor is the end of the cyclic order
            insertAt = n - 1;
        } else {
            insertAt = j > i ? j - 1 : j;
        }
        tour.moveCity(i, insertAt, delta);
    }

    /**
     * Number of valid moves for an {@code n}-city tour.
     */
    static int moveCount(int n) {
        return n < 4 ? 0 : Math.multiplyExact(n, n - 3);
    }

    static ShiftInsertMove decode(int index, int n) {
        int span = n - 3;
        int i = index / span;
        int offset = 2 + index % span;
        return new ShiftInsertMove(i, (i + offset) % n);
    }

    private void requireValid(ShiftInsertMove move) {
        Objects.requireNonNull(move, "move");
        int n = tour.size();
        int i = move.cityIndex();
        int j = move.destinationIndex();
        if (n < 4 || i < 0 || i >= n || j < 0 || j >= n) {
            throw outOfRange(move, n);
        }
        int offset = (j - i + n) % n;
        if (offset == 0 || offset == 1 || offset == n - 1) {
            throw outOfRange(move, n);
        }
    }

    private static TourCoreException outOfRange(ShiftInsertMove move, int n) {
        return new TourCoreException(
                TourCoreException.REASON_MOVE_OUT_OF_RANGE,
                "invalid shift-insert move " + move + " for a tour of " + n + " cities"
        );
    }
}
