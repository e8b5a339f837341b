package org.atsp.search;

import lombok.experimental.UtilityClass;
import org.atsp.tour.core.TourState;
import org.atsp.tour.move.LocalMoveEngine;
import org.atsp.tour.move.MoveEngineFactory;
import org.atsp.tour.problem.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Greedy randomized adaptive search: repeated randomized construction, optionally followed
 * by a best-improvement descent, keeping the shortest tour seen.
 */
@UtilityClass
public class Grasp {
    private static final Logger logger = LoggerFactory.getLogger(Grasp.class);

    /**
     * Runs until the configured budget is exhausted. At least one iteration always runs.
     *
     * @return shortest feasible tour found.
     * @throws IllegalArgumentException when the configuration is invalid.
     */
    public static TourState run(Problem problem, GraspConfig config) {
        Objects.requireNonNull(problem, "problem");
        Objects.requireNonNull(config, "config").validated();
        SplittableRandom random = new SplittableRandom(config.getSeed());
        SearchBudget.Run run = config.getBudget().start();

        TourState best = null;
        do {
            TourState candidate = ConstructionHeuristics.greedyRandomizedAdaptive(
                    problem,
                    config.getBoundType(),
                    config.getAlpha(),
                    random
            );
            if (config.getLocalSearch() != null) {
                try (LocalMoveEngine<?> engine = MoveEngineFactory.create(
                        config.getLocalSearch(),
                        candidate,
                        random.split(),
                        config.getColonyConfig()
                )) {
                    LocalSearch.bestImprovement(engine);
                }
            }
            run.completeIteration();
            if (best == null || candidate.distance() < best.distance()) {
                if (best != null) {
                    logger.debug("GRASP iteration {} improved {} -> {}",
                            run.iterations(), best.distance(), candidate.distance());
                }
                best = candidate;
            }
        } while (!run.isExhausted());

        logger.info("GRASP finished after {} iterations in {} ms, best length {}",
                run.iterations(), run.elapsedMillis(), best.distance());
        return best;
    }
}
