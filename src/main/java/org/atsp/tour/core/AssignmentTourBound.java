package org.atsp.tour.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.atsp.tour.problem.Problem;

import java.util.Arrays;

/**
 * Incrementally repaired assignment-relaxation bound.
 *
 * <p>With {@code R} the remaining cities, {@code last} the last visited city and {@code a}
 * the anchor, the bound is the partial path length plus half the cheapest valid edge of
 * every open slot:</p>
 * <ul>
 * <li>out-slot of {@code c in R}: targets {@code R \ {c}} plus {@code a}.</li>
 * <li>in-slot of {@code c in R}: sources {@code R \ {c}} plus {@code last}.</li>
 * <li>out-slot of {@code last}: targets {@code R} ({@code {a}} once R is empty).</li>
 * <li>in-slot of {@code a}: sources {@code R} ({@code {last}} once R is empty).</li>
 * </ul>
 *
 * <p>Valid sets only shrink while the tour grows, so each slot is represented by a cursor
 * into the city's neighbor ranking that only moves forward and always rests on the first
 * valid entry. Appending {@code u -> v} can only invalidate in-cursors resting on {@code u}
 * and out-cursors resting on {@code v}; reverse work-lists ({@code inWatchers[u]},
 * {@code outWatchers[v]}) find those cursors without scanning every remaining city.
 * Work-list entries are cleared lazily: an entry is live only while the owner's cursor
 * still rests on the indexed city.</p>
 */
final class AssignmentTourBound implements TourBound {
    private static final int NONE = -1;

    private final Problem problem;
    private final int[] outCursor;
    private final int[] inCursor;
    // inWatchers[s]: cities whose in-cursor rested on s when registered
    private final IntArrayList[] inWatchers;
    // outWatchers[t]: cities whose out-cursor rested on t when registered
    private final IntArrayList[] outWatchers;
    private double value;

    AssignmentTourBound(Problem problem) {
        int dimension = problem.dimension();
        this.problem = problem;
        this.outCursor = new int[dimension];
        this.inCursor = new int[dimension];
        this.inWatchers = new IntArrayList[dimension];
        this.outWatchers = new IntArrayList[dimension];
        for (int city = 0; city < dimension; city++) {
            inWatchers[city] = new IntArrayList();
            outWatchers[city] = new IntArrayList();
        }
        if (problem.rankCount() > 0) {
            for (int city = 0; city < dimension; city++) {
                inWatchers[problem.shortestIn(city, 0)].add(city);
                outWatchers[problem.shortestOut(city, 0)].add(city);
            }
        }
        this.value = problem.lowerBoundAtEmptyTour();
    }

    private AssignmentTourBound(AssignmentTourBound other) {
        this.problem = other.problem;
        this.outCursor = Arrays.copyOf(other.outCursor, other.outCursor.length);
        this.inCursor = Arrays.copyOf(other.inCursor, other.inCursor.length);
        this.inWatchers = copyLists(other.inWatchers);
        this.outWatchers = copyLists(other.outWatchers);
        this.value = other.value;
    }

    @Override
    public BoundType type() {
        return BoundType.ASSIGNMENT;
    }

    @Override
    public double value() {
        return value;
    }

    @Override
    public double deltaOfAdd(TourState tour, int source, int dest) {
        return repair(tour, source, dest, false) - value;
    }

    @Override
    public void commitAdd(TourState tour, int source, int dest) {
        value = repair(tour, source, dest, true);
    }

    @Override
    public TourBound copy() {
        return new AssignmentTourBound(this);
    }

    /**
     * Current out-cursor rank of {@code city}.
     */
    int outCursor(int city) {
        return outCursor[city];
    }

    /**
     * Current in-cursor rank of {@code city}.
     */
    int inCursor(int city) {
        return inCursor[city];
    }

    /**
     * Computes the bound after appending {@code u -> v}; writes cursors and work-lists only
     * when {@code commit} is set. Each cursor is touched at most once per call, so the
     * read-only pass sees exactly the cursors the committing pass would start from.
     */
    private double repair(TourState tour, int u, int v, boolean commit) {
        final int anchor = Problem.ANCHOR;
        final boolean closing = tour.remainingCount() == 1;
        double bound = value;

        // u's out-slot and v's in-slot are replaced by the real edge
        bound -= (inSlot(v) + outSlot(u)) / 2.0d;
        bound += problem.distance(u, v);

        if (closing) {
            // v's out-slot and the anchor's in-slot both resolve to v -> anchor already
            return bound;
        }

        // v becomes last: the anchor is no longer an acceptable target for its out-slot
        if (problem.shortestOut(v, outCursor[v]) == anchor) {
            int next = advanceOut(tour, v, outCursor[v], v, false);
            bound += (problem.distance(v, problem.shortestOut(v, next)) - outSlot(v)) / 2.0d;
            if (commit) {
                moveOut(v, next);
            }
        }

        // the anchor's in-slot draws from the remaining cities, which lose v
        if (problem.shortestIn(anchor, inCursor[anchor]) == v) {
            int next = advanceIn(tour, anchor, inCursor[anchor], v);
            bound += (problem.distance(problem.shortestIn(anchor, next), anchor) - inSlot(anchor)) / 2.0d;
            if (commit) {
                moveIn(anchor, next);
            }
        }

        // u stops being last: remaining in-cursors resting on u are stale
        IntArrayList staleIn = inWatchers[u];
        for (int i = 0, size = staleIn.size(); i < size; i++) {
            int city = staleIn.getInt(i);
            if (!isRemainingAfter(tour, city, v) || problem.shortestIn(city, inCursor[city]) != u) {
                continue;
            }
            // v stays a valid source as the new last city
            int next = advanceIn(tour, city, inCursor[city], NONE);
            bound += (problem.distance(problem.shortestIn(city, next), city) - inSlot(city)) / 2.0d;
            if (commit) {
                moveIn(city, next);
            }
        }

        // v leaves the remaining set: remaining out-cursors resting on v are stale
        IntArrayList staleOut = outWatchers[v];
        for (int i = 0, size = staleOut.size(); i < size; i++) {
            int city = staleOut.getInt(i);
            if (!isRemainingAfter(tour, city, v) || problem.shortestOut(city, outCursor[city]) != v) {
                continue;
            }
            int next = advanceOut(tour, city, outCursor[city], v, true);
            bound += (problem.distance(city, problem.shortestOut(city, next)) - outSlot(city)) / 2.0d;
            if (commit) {
                moveOut(city, next);
            }
        }

        if (commit) {
            // neither u (as a source) nor v (as a target) can become valid again
            staleIn.clear();
            staleOut.clear();
        }
        return bound;
    }

    /**
     * First rank after {@code from} whose target is still remaining once {@code leaving}
     * is placed, or the anchor when {@code anchorValid}.
     */
    private int advanceOut(TourState tour, int city, int from, int leaving, boolean anchorValid) {
        int limit = problem.rankCount();
        for (int rank = from + 1; rank < limit; rank++) {
            int target = problem.shortestOut(city, rank);
            if ((anchorValid && target == Problem.ANCHOR) || isRemainingAfter(tour, target, leaving)) {
                return rank;
            }
        }
        throw new IllegalStateException("no valid outgoing neighbor left for city " + city);
    }

    /**
     * First rank after {@code from} whose source is still remaining once {@code leaving} is
     * placed. {@code leaving == NONE} keeps the city being placed as a valid source.
     */
    private int advanceIn(TourState tour, int city, int from, int leaving) {
        int limit = problem.rankCount();
        for (int rank = from + 1; rank < limit; rank++) {
            int source = problem.shortestIn(city, rank);
            if (isRemainingAfter(tour, source, leaving)) {
                return rank;
            }
        }
        throw new IllegalStateException("no valid incoming neighbor left for city " + city);
    }

    private static boolean isRemainingAfter(TourState tour, int city, int leaving) {
        return city != leaving && tour.isRemaining(city);
    }

    private double outSlot(int city) {
        return problem.distance(city, problem.shortestOut(city, outCursor[city]));
    }

    private double inSlot(int city) {
        return problem.distance(problem.shortestIn(city, inCursor[city]), city);
    }

    private void moveOut(int city, int rank) {
        outCursor[city] = rank;
        outWatchers[problem.shortestOut(city, rank)].add(city);
    }

    private void moveIn(int city, int rank) {
        inCursor[city] = rank;
        inWatchers[problem.shortestIn(city, rank)].add(city);
    }

    private static IntArrayList[] copyLists(IntArrayList[] lists) {
        IntArrayList[] copy = new IntArrayList[lists.length];
        for (int i = 0; i < lists.length; i++) {
            copy[i] = new IntArrayList(lists[i]);
        }
        return copy;
    }
}
