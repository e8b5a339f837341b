package org.atsp.tour.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.atsp.tour.problem.Problem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Mutable partial-or-complete tour with exact length and an incrementally maintained
 * lower bound.
 *
 * <p>The visiting order always starts at {@link Problem#ANCHOR} and is closed implicitly back
 * to it. While cities remain, the tour grows through {@link #add(Arc)}; once feasible it can
 * be handed to a local-move engine that rewrites the order through
 * {@link #moveCity(int, int, double)} or {@link #replaceOrder(int[], double)}.</p>
 *
 * <p>Every mutation bumps {@link #modificationCount()}; enumerations obtained before a
 * mutation are invalid afterwards.</p>
 *
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. Exactly one engine may
 * mutate a tour at a time.</p>
 */
public final class TourState {
    private final Problem problem;
    private final IntArrayList order;
    private final IntOpenHashSet remaining;
    private final TourBound bound;
    private double distance;
    private int modificationCount;

    private TourState(Problem problem, IntArrayList order, IntOpenHashSet remaining, TourBound bound, double distance) {
        this.problem = problem;
        this.order = order;
        this.remaining = remaining;
        this.bound = bound;
        this.distance = distance;
    }

    /**
     * Creates an anchor-only tour. Prefer {@link Problem#emptyTour(BoundType)}.
     *
     * @param problem problem backing the tour.
     * @param boundType bound model to maintain.
     * @return new tour containing only the anchor city.
     */
    public static TourState empty(Problem problem, BoundType boundType) {
        Objects.requireNonNull(problem, "problem");
        Objects.requireNonNull(boundType, "boundType");
        int dimension = problem.dimension();
        IntArrayList order = new IntArrayList(dimension);
        order.add(Problem.ANCHOR);
        IntOpenHashSet remaining = new IntOpenHashSet(dimension);
        for (int city = 0; city < dimension; city++) {
            if (city != Problem.ANCHOR) {
                remaining.add(city);
            }
        }
        return new TourState(problem, order, remaining, TourBound.create(boundType, problem), 0.0d);
    }

    /**
     * Returns an independent copy: shares the problem, copies order, remaining set and
     * bound bookkeeping.
     */
    public TourState copy() {
        return new TourState(problem, new IntArrayList(order), new IntOpenHashSet(remaining), bound.copy(), distance);
    }

    public Problem problem() {
        return problem;
    }

    public BoundType boundType() {
        return bound.type();
    }

    /**
     * @return true when every city has been placed.
     */
    public boolean isFeasible() {
        return remaining.isEmpty();
    }

    /**
     * Exact closed-tour length, empty while the tour is infeasible.
     */
    public OptionalDouble exactLength() {
        return isFeasible() ? OptionalDouble.of(distance) : OptionalDouble.empty();
    }

    /**
     * Accumulated distance: the open path length while infeasible, the closed tour length
     * afterwards.
     */
    public double distance() {
        return distance;
    }

    /**
     * Lower bound on the length of any completion of this tour. Equals the exact length once
     * the tour is feasible.
     */
    public double lowerBound() {
        return isFeasible() ? distance : bound.value();
    }

    /**
     * Arcs that can extend the tour: one per remaining city, all leaving the last city,
     * ordered by ascending destination.
     */
    public List<Arc> addableArcs() {
        int last = lastCity();
        List<Arc> arcs = new ArrayList<>(remaining.size());
        for (int city = 0, dimension = problem.dimension(); city < dimension; city++) {
            if (remaining.contains(city)) {
                arcs.add(new Arc(last, city));
            }
        }
        return arcs;
    }

    /**
     * Bound increment of adding {@code arc}, computed without mutating this tour.
     *
     * @throws TourCoreException when the arc cannot extend this tour.
     */
    public double lowerBoundDeltaOfAdd(Arc arc) {
        requireAddable(arc);
        return bound.deltaOfAdd(this, arc.source(), arc.dest());
    }

    /**
     * Exact distance increment of adding {@code arc}, closing edge included when it places
     * the last city.
     *
     * @throws TourCoreException when the arc cannot extend this tour.
     */
    public double distanceDeltaOfAdd(Arc arc) {
        requireAddable(arc);
        double delta = problem.distance(arc.source(), arc.dest());
        if (remaining.size() == 1) {
            delta += problem.distance(arc.dest(), Problem.ANCHOR);
        }
        return delta;
    }

    /**
     * Appends {@code arc.dest()} to the tour and repairs the bound. Closes the tour when the
     * last city is placed.
     *
     * @throws TourCoreException when the arc cannot extend this tour.
     */
    public void add(Arc arc) {
        requireAddable(arc);
        int dest = arc.dest();
        bound.commitAdd(this, arc.source(), dest);
        order.add(dest);
        remaining.remove(dest);
        distance += problem.distance(arc.source(), dest);
        if (remaining.isEmpty()) {
            distance += problem.distance(dest, Problem.ANCHOR);
        }
        modificationCount++;
    }

    /**
     * Relocates the city at {@code fromPosition} so that it ends up at {@code toPosition}
     * of the resulting order, then re-anchors the order.
     *
     * @param fromPosition current position of the city.
     * @param toPosition insertion index into the order with the city removed.
     * @param gain length decrease caused by the relocation.
     * @throws TourCoreException when the tour is infeasible or positions are out of range.
     */
    public void moveCity(int fromPosition, int toPosition, double gain) {
        requireFeasible("moveCity");
        int size = order.size();
        if (fromPosition < 0 || fromPosition >= size || toPosition < 0 || toPosition >= size) {
            throw new TourCoreException(
                    TourCoreException.REASON_MOVE_OUT_OF_RANGE,
                    "positions out of range: from=" + fromPosition + ", to=" + toPosition + ", size=" + size
            );
        }
        int city = order.removeInt(fromPosition);
        order.add(toPosition, city);
        reanchor();
        distance -= gain;
        modificationCount++;
    }

    /**
     * Replaces the visiting order of a feasible tour. The order is rotated so that it starts
     * at the anchor.
     *
     * @param newOrder permutation of all cities.
     * @param newLength closed length of {@code newOrder}.
     * @throws TourCoreException when the tour is infeasible or the order is not a permutation.
     */
    public void replaceOrder(int[] newOrder, double newLength) {
        requireFeasible("replaceOrder");
        requirePermutation(newOrder);
        int start = 0;
        while (newOrder[start] != Problem.ANCHOR) {
            start++;
        }
        order.clear();
        order.addElements(0, newOrder, start, newOrder.length - start);
        order.addElements(order.size(), newOrder, 0, start);
        distance = newLength;
        modificationCount++;
    }

    /**
     * @return number of placed cities.
     */
    public int size() {
        return order.size();
    }

    public int cityAt(int position) {
        return order.getInt(position);
    }

    public int lastCity() {
        return order.getInt(order.size() - 1);
    }

    public int remainingCount() {
        return remaining.size();
    }

    public boolean isRemaining(int city) {
        return remaining.contains(city);
    }

    /**
     * @return copy of the visiting order.
     */
    public int[] order() {
        return order.toIntArray();
    }

    /**
     * Arcs between consecutive placed cities (the closing arc is not included).
     */
    public List<Arc> pathArcs() {
        List<Arc> arcs = new ArrayList<>(Math.max(0, order.size() - 1));
        for (int i = 0; i + 1 < order.size(); i++) {
            arcs.add(new Arc(order.getInt(i), order.getInt(i + 1)));
        }
        return Collections.unmodifiableList(arcs);
    }

    /**
     * Counter bumped by every mutation; fail-fast iterators compare against it.
     */
    public int modificationCount() {
        return modificationCount;
    }

    /**
     * Renders the path as {@code 0->3->1->2->0}; the closing city is only shown once the
     * tour is feasible.
     */
    public String describe() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < order.size(); i++) {
            if (i > 0) {
                builder.append("->");
            }
            builder.append(order.getInt(i));
        }
        if (isFeasible()) {
            builder.append("->").append(Problem.ANCHOR);
        }
        return builder.toString();
    }

    /**
     * Exposes the bound tracker to package tests.
     */
    TourBound boundContract() {
        return bound;
    }

    private void requireAddable(Arc arc) {
        if (arc == null) {
            throw new TourCoreException(TourCoreException.REASON_ARC_REQUIRED, "arc must be provided");
        }
        if (arc.dest() < 0 || arc.dest() >= problem.dimension() || !remaining.contains(arc.dest())) {
            throw new TourCoreException(
                    TourCoreException.REASON_ARC_DEST_NOT_REMAINING,
                    "destination " + arc.dest() + " is not a remaining city"
            );
        }
        if (arc.source() != lastCity()) {
            throw new TourCoreException(
                    TourCoreException.REASON_ARC_SOURCE_NOT_LAST,
                    "source " + arc.source() + " is not the last visited city " + lastCity()
            );
        }
    }

    private void requireFeasible(String operation) {
        if (!isFeasible()) {
            throw new TourCoreException(
                    TourCoreException.REASON_TOUR_INFEASIBLE,
                    operation + " requires a feasible tour, " + remaining.size() + " cities remain"
            );
        }
    }

    private void requirePermutation(int[] newOrder) {
        int dimension = problem.dimension();
        if (newOrder == null || newOrder.length != dimension) {
            throw new TourCoreException(
                    TourCoreException.REASON_ORDER_INVALID,
                    "order must list all " + dimension + " cities"
            );
        }
        boolean[] seen = new boolean[dimension];
        for (int city : newOrder) {
            if (city < 0 || city >= dimension || seen[city]) {
                throw new TourCoreException(
                        TourCoreException.REASON_ORDER_INVALID,
                        "order is not a permutation, offending city " + city
                );
            }
            seen[city] = true;
        }
    }

    private void reanchor() {
        int anchorPosition = order.indexOf(Problem.ANCHOR);
        if (anchorPosition <= 0) {
            return;
        }
        int[] rotated = new int[order.size()];
        int size = order.size();
        for (int i = 0; i < size; i++) {
            rotated[i] = order.getInt((anchorPosition + i) % size);
        }
        order.clear();
        order.addElements(0, rotated);
    }

    @Override
    public String toString() {
        return "TourState{distance=" + distance + ", lowerBound=" + lowerBound() + ", path=" + describe() + "}";
    }
}
