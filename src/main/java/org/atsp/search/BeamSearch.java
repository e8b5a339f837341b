package org.atsp.search;

import lombok.experimental.UtilityClass;
import org.atsp.tour.core.Arc;
import org.atsp.tour.core.TourState;
import org.atsp.tour.problem.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Level-by-level construction keeping the {@code beamWidth} partial tours with the smallest
 * lower bound. Every level places one city, so all tours of the last level are feasible.
 */
@UtilityClass
public class BeamSearch {
    private static final Logger logger = LoggerFactory.getLogger(BeamSearch.class);

    /**
     * @param beamWidth partial tours kept per level, must be positive.
     * @return shortest feasible tour of the final level.
     * @throws IllegalArgumentException when the beam width is not positive.
     */
    public static TourState run(Problem problem, int beamWidth) {
        if (beamWidth <= 0) {
            throw new IllegalArgumentException("beamWidth must be > 0");
        }
        List<TourState> beam = new ArrayList<>();
        beam.add(problem.emptyTour());
        int level = 0;
        while (!beam.get(0).isFeasible()) {
            List<Expansion> expansions = new ArrayList<>();
            for (TourState parent : beam) {
                double parentBound = parent.lowerBound();
                for (Arc arc : parent.addableArcs()) {
                    expansions.add(new Expansion(parent, arc, parentBound + parent.lowerBoundDeltaOfAdd(arc)));
                }
            }
            // stable sort: earlier parents and arcs win ties
            expansions.sort(Comparator.comparingDouble(Expansion::bound));

            List<TourState> next = new ArrayList<>(Math.min(beamWidth, expansions.size()));
            for (int i = 0; i < expansions.size() && next.size() < beamWidth; i++) {
                Expansion expansion = expansions.get(i);
                TourState child = expansion.parent().copy();
                child.add(expansion.arc());
                next.add(child);
            }
            beam = next;
            level++;
            logger.debug("beam level {}: {} expansions, best bound {}",
                    level, expansions.size(), expansions.get(0).bound());
        }

        TourState best = beam.get(0);
        for (TourState tour : beam) {
            if (tour.distance() < best.distance()) {
                best = tour;
            }
        }
        logger.info("beam search (width {}) finished, length {}", beamWidth, best.distance());
        return best;
    }

    private record Expansion(TourState parent, Arc arc, double bound) {
    }
}
