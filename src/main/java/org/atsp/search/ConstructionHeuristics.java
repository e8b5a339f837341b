package org.atsp.search;

import lombok.experimental.UtilityClass;
import org.atsp.tour.core.Arc;
import org.atsp.tour.core.BoundType;
import org.atsp.tour.core.TourState;
import org.atsp.tour.problem.Problem;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Builds feasible tours from the anchor-only tour by repeatedly adding one arc.
 *
 * <p>Greedy variants rank arcs by {@link TourState#lowerBoundDeltaOfAdd(Arc)}, so the bound
 * model of the empty tour decides what "greedy" means: the assignment bound looks ahead at
 * the remaining cities, the path-length bound reduces to nearest neighbor.</p>
 */
@UtilityClass
public class ConstructionHeuristics {

    /**
     * Adds uniformly random arcs until the tour is feasible.
     */
    public static TourState random(Problem problem, SplittableRandom random) {
        Objects.requireNonNull(random, "random");
        TourState tour = problem.emptyTour();
        List<Arc> arcs = tour.addableArcs();
        while (!arcs.isEmpty()) {
            tour.add(arcs.get(random.nextInt(arcs.size())));
            arcs = tour.addableArcs();
        }
        return tour;
    }

    /**
     * Greedy construction under the assignment bound.
     */
    public static TourState greedy(Problem problem) {
        return greedy(problem, BoundType.ASSIGNMENT);
    }

    /**
     * Adds the arc with the smallest bound increment; the first such arc wins ties.
     */
    public static TourState greedy(Problem problem, BoundType boundType) {
        TourState tour = problem.emptyTour(boundType);
        List<Arc> arcs = tour.addableArcs();
        while (!arcs.isEmpty()) {
            Arc best = arcs.get(0);
            double bestDelta = tour.lowerBoundDeltaOfAdd(best);
            for (int i = 1; i < arcs.size(); i++) {
                Arc arc = arcs.get(i);
                double delta = tour.lowerBoundDeltaOfAdd(arc);
                if (delta < bestDelta) {
                    best = arc;
                    bestDelta = delta;
                }
            }
            tour.add(best);
            arcs = tour.addableArcs();
        }
        return tour;
    }

    /**
     * Greedy construction that breaks exact ties uniformly at random.
     */
    public static TourState greedyRandomTieBreak(Problem problem, SplittableRandom random) {
        Objects.requireNonNull(random, "random");
        TourState tour = problem.emptyTour();
        List<Arc> arcs = tour.addableArcs();
        List<Arc> tied = new ArrayList<>();
        while (!arcs.isEmpty()) {
            tied.clear();
            double bestDelta = Double.POSITIVE_INFINITY;
            for (Arc arc : arcs) {
                double delta = tour.lowerBoundDeltaOfAdd(arc);
                if (delta < bestDelta) {
                    tied.clear();
                    tied.add(arc);
                    bestDelta = delta;
                } else if (delta == bestDelta) {
                    tied.add(arc);
                }
            }
            tour.add(tied.get(random.nextInt(tied.size())));
            arcs = tour.addableArcs();
        }
        return tour;
    }

    /**
     * Randomized adaptive construction: picks uniformly among arcs whose increment is at
     * most {@code min + alpha * (max - min)}.
     *
     * @param alpha restricted-candidate-list width in {@code [0, 1]}; 0 is greedy with random
     *              tie-breaking, 1 is uniformly random.
     * @throws IllegalArgumentException when alpha is outside {@code [0, 1]}.
     */
    public static TourState greedyRandomizedAdaptive(Problem problem, double alpha, SplittableRandom random) {
        return greedyRandomizedAdaptive(problem, BoundType.ASSIGNMENT, alpha, random);
    }

    /**
     * Randomized adaptive construction under an explicit bound model.
     */
    public static TourState greedyRandomizedAdaptive(
            Problem problem,
            BoundType boundType,
            double alpha,
            SplittableRandom random
    ) {
        if (!(alpha >= 0.0d && alpha <= 1.0d)) {
            throw new IllegalArgumentException("alpha must be in [0, 1], got " + alpha);
        }
        Objects.requireNonNull(random, "random");
        TourState tour = problem.emptyTour(boundType);
        List<Arc> arcs = tour.addableArcs();
        List<Arc> restricted = new ArrayList<>();
        while (!arcs.isEmpty()) {
            double[] deltas = new double[arcs.size()];
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < deltas.length; i++) {
                deltas[i] = tour.lowerBoundDeltaOfAdd(arcs.get(i));
                min = Math.min(min, deltas[i]);
                max = Math.max(max, deltas[i]);
            }
            double threshold = min + alpha * (max - min);
            restricted.clear();
            for (int i = 0; i < deltas.length; i++) {
                if (deltas[i] <= threshold) {
                    restricted.add(arcs.get(i));
                }
            }
            tour.add(restricted.get(random.nextInt(restricted.size())));
            arcs = tour.addableArcs();
        }
        return tour;
    }
}
