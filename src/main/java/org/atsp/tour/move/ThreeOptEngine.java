package org.atsp.tour.move;

import org.atsp.core.random.SparseFisherYates;
import org.atsp.tour.core.TourCoreException;
import org.atsp.tour.core.TourState;
import org.atsp.tour.problem.Problem;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SplittableRandom;

/**
 * Segment-exchange 3-opt over a closed tour.
 *
 * <p>A move {@code (i, j, k)} with {@code i + 2 <= j}, {@code j + 2 <= k <= n - 1} cuts the
 * edges {@code X1->X2}, {@code Y1->Y2}, {@code Z1->Z2} where {@code X1 = order[i]},
 * {@code Y1 = order[j]}, {@code Z1 = order[k]} and {@code Z2 = order[(k + 1) mod n]}, then
 * reconnects {@code X1->Y2}, {@code Z1->X2}, {@code Y1->Z2}. Both segments keep their
 * orientation, which matters for asymmetric distances.</p>
 */
public final class ThreeOptEngine implements LocalMoveEngine<ThreeOptMove> {
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
    public ThreeOptEngine(TourState tour, SplittableRandom random) {
        this.tour = Objects.requireNonNull(tour, "tour");
        this.random = Objects.requireNonNull(random, "random");
        this.problem = tour.problem();
        requireFeasible(tour);
    }

    @Override
    public MoveEngineType type() {
        return MoveEngineType.THREE_OPT;
    }

    @Override
    public TourState tour() {
        return tour;
    }

    @Override
    public Iterator<ThreeOptMove> localMoves() {
        return new FailFastMoveIterator<>(tour) {
            private final int n = tour.size();
            private int i = 0;
            private int j = 2;
            private int k = 4;

            @Override
            protected boolean hasNextMove() {
                return k <= n - 1;
            }

            @Override
            protected ThreeOptMove nextMove() {
                ThreeOptMove move = new ThreeOptMove(i, j, k);
                advance();
                return move;
            }

            private void advance() {
                if (++k <= n - 1) {
                    return;
                }
                if (++j <= n - 3) {
                    k = j + 2;
                    return;
                }
                i++;
                j = i + 2;
                k = j + 2;
            }
        };
    }

    /**
     * Materializes the move list and walks it through a sparse Fisher-Yates permutation.
     */
    @Override
    public Iterator<ThreeOptMove> randomizedLocalMoves() {
        List<ThreeOptMove> moves = new ArrayList<>(moveCount(tour.size()));
        localMoves().forEachRemaining(moves::add);
        SparseFisherYates permutation = SparseFisherYates.of(moves.size(), random);
        return new FailFastMoveIterator<>(tour) {
            @Override
            protected boolean hasNextMove() {
                return permutation.hasNext();
            }

            @Override
            protected ThreeOptMove nextMove() {
                return moves.get(permutation.nextInt());
            }
        };
    }

    @Override
    public Optional<ThreeOptMove> randomLocalMove() {
        int n = tour.size();
        if (n < 5) {
            return Optional.empty();
        }
        int i = random.nextInt(0, n - 4);
        int j = random.nextInt(i + 2, n - 2);
        int k = random.nextInt(j + 2, n);
        return Optional.of(new ThreeOptMove(i, j, k));
    }

    @Override
    public double objectiveDeltaOf(ThreeOptMove move) {
        requireValid(move);
        int n = tour.size();
        int x1 = tour.cityAt(move.i());
        int x2 = tour.cityAt(move.i() + 1);
        int y1 = tour.cityAt(move.j());
        int y2 = tour.cityAt(move.j() + 1);
        int z1 = tour.cityAt(move.k());
        int z2 = tour.cityAt((move.k() + 1) % n);

        double removed = problem.distance(x1, x2) + problem.distance(y1, y2) + problem.distance(z1, z2);
        double added = problem.distance(x1, y2) + problem.distance(y1, z2) + problem.distance(z1, x2);
        return removed - added;
    }

    /**
     * Rebuilds the order as {@code [0..i] + [j+1..k] + [i+1..j] + [k+1..]} in O(n).
     */
    @Override
    public void applyMove(ThreeOptMove move) {
        double delta = objectiveDeltaOf(move);
        int[] current = tour.order();
        int[] next = new int[current.length];
        int write = 0;
        int i = move.i();
        int j = move.j();
        int k = move.k();
        System.arraycopy(current, 0, next, write, i + 1);
        write += i + 1;
        System.arraycopy(current, j + 1, next, write, k - j);
        write += k - j;
        System.arraycopy(current, i + 1, next, write, j - i);
        write += j - i;
        System.arraycopy(current, k + 1, next, write, current.length - k - 1);
        tour.replaceOrder(next, tour.distance() - delta);
    }

    /**
     * Number of {@code (i, j, k)} triples for an {@code n}-city tour.
     */
    static int moveCount(int n) {
        // k ranges over n - 1 - (j + 2) + 1 values for each valid (i, j)
        long count = 0L;
        for (int i = 0; i <= n - 5; i++) {
            for (int j = i + 2; j <= n - 3; j++) {
                count += n - j - 2;
            }
        }
        return Math.toIntExact(count);
    }

    private void requireValid(ThreeOptMove move) {
        Objects.requireNonNull(move, "move");
        int n = tour.size();
        if (move.i() < 0 || move.j() < move.i() + 2 || move.k() < move.j() + 2 || move.k() > n - 1) {
            throw new TourCoreException(
                    TourCoreException.REASON_MOVE_OUT_OF_RANGE,
                    "invalid 3-opt cut points " + move + " for a tour of " + n + " cities"
            );
        }
    }

    static void requireFeasible(TourState tour) {
        if (!tour.isFeasible()) {
            throw new TourCoreException(
                    TourCoreException.REASON_TOUR_INFEASIBLE,
                    "local moves require a feasible tour, " + tour.remainingCount() + " cities remain"
            );
        }
    }
}
