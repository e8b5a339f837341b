package org.atsp.search;

import org.atsp.testing.TestProblems;
import org.atsp.tour.core.TourState;
import org.atsp.tour.move.LocalMoveEngine;
import org.atsp.tour.move.MoveEngineFactory;
import org.atsp.tour.move.MoveEngineType;
import org.atsp.tour.move.ShiftInsertEngine;
import org.atsp.tour.move.ThreeOptEngine;
import org.atsp.tour.problem.Problem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Iterator;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Local Search Tests")
class LocalSearchTest {

    private static <M> void assertLocalOptimum(LocalMoveEngine<M> engine) {
        for (Iterator<M> it = engine.localMoves(); it.hasNext(); ) {
            M move = it.next();
            assertTrue(engine.objectiveDeltaOf(move) <= LocalSearch.IMPROVEMENT_EPSILON,
                    "improving move left behind: " + move);
        }
    }

    @Test
    @DisplayName("First-improvement descent ends in a local optimum")
    @Timeout(20)
    void testFirstImprovement() {
        SplittableRandom random = new SplittableRandom(1L);
        for (int trial = 0; trial < 10; trial++) {
            Problem problem = TestProblems.randomAsymmetric(12, random);
            TourState tour = TestProblems.randomTour(problem, random);
            double before = tour.distance();
            ThreeOptEngine engine = new ThreeOptEngine(tour, random);
            int applied = LocalSearch.firstImprovement(engine);
            assertTrue(tour.distance() <= before);
            assertEquals(applied == 0, tour.distance() == before);
            assertEquals(problem.closedLength(tour.order()), tour.distance(), 1e-6);
            assertLocalOptimum(engine);
        }
    }

    @Test
    @DisplayName("Best-improvement descent ends in a local optimum")
    @Timeout(20)
    void testBestImprovement() {
        SplittableRandom random = new SplittableRandom(2L);
        for (int trial = 0; trial < 10; trial++) {
            Problem problem = TestProblems.randomAsymmetric(12, random);
            TourState tour = TestProblems.randomTour(problem, random);
            double before = tour.distance();
            ShiftInsertEngine engine = new ShiftInsertEngine(tour, random);
            int applied = LocalSearch.bestImprovement(engine);
            assertTrue(tour.distance() <= before);
            assertEquals(problem.closedLength(tour.order()), tour.distance(), 1e-6);
            assertTrue(applied >= 0);
            assertLocalOptimum(engine);
        }
    }

    @Test
    @DisplayName("A poor hexagon tour is improved by every engine")
    void testImprovesHexagon() {
        Problem problem = TestProblems.hexagon();
        for (MoveEngineType type : new MoveEngineType[]{MoveEngineType.THREE_OPT, MoveEngineType.SHIFT_INSERT}) {
            TourState tour = TestProblems.tourOf(problem, 0, 3, 1, 4, 2, 5);
            try (LocalMoveEngine<?> engine = MoveEngineFactory.create(type, tour, new SplittableRandom(3L))) {
                assertTrue(LocalSearch.bestImprovement(engine) > 0, type + " should find an improvement");
                assertTrue(tour.distance() < 104.0d);
            }
        }
    }

    @Test
    @DisplayName("Tours without moves are already locally optimal")
    void testNoMoves() {
        TourState tour = TestProblems.tourOf(TestProblems.fourCity(), 0, 1, 2, 3);
        assertEquals(0, LocalSearch.firstImprovement(new ThreeOptEngine(tour, new SplittableRandom(4L))));
        assertEquals(0, LocalSearch.bestImprovement(new ThreeOptEngine(tour, new SplittableRandom(4L))));
    }
}
