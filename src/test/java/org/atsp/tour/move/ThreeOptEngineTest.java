package org.atsp.tour.move;

import org.atsp.testing.TestProblems;
import org.atsp.tour.core.TourCoreException;
import org.atsp.tour.core.TourState;
import org.atsp.tour.problem.Problem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("3-opt Engine Tests")
class ThreeOptEngineTest {
    private static final double EPS = 1e-9d;

    private static List<ThreeOptMove> collect(Iterator<ThreeOptMove> moves) {
        List<ThreeOptMove> list = new ArrayList<>();
        moves.forEachRemaining(list::add);
        return list;
    }

    @Nested
    @DisplayName("1. Enumeration")
    class EnumerationTests {

        @Test
        @DisplayName("Enumerates every valid (i, j, k) once in lexicographic order")
        void testLocalMoves() {
            Problem problem = TestProblems.hexagon();
            ThreeOptEngine engine = new ThreeOptEngine(TestProblems.tourOf(problem, 0, 1, 2, 3, 4, 5), new SplittableRandom(1L));
            List<ThreeOptMove> moves = collect(engine.localMoves());
            assertEquals(List.of(
                    new ThreeOptMove(0, 2, 4),
                    new ThreeOptMove(0, 2, 5),
                    new ThreeOptMove(0, 3, 5),
                    new ThreeOptMove(1, 3, 5)
            ), moves);
            assertEquals(4, ThreeOptEngine.moveCount(6));
        }

        @Test
        @DisplayName("Move count matches the enumeration for many sizes")
        void testMoveCount() {
            SplittableRandom random = new SplittableRandom(2L);
            for (int n = 1; n <= 14; n++) {
                Problem problem = TestProblems.randomAsymmetric(n, random);
                ThreeOptEngine engine = new ThreeOptEngine(TestProblems.randomTour(problem, random), random);
                List<ThreeOptMove> moves = collect(engine.localMoves());
                assertEquals(ThreeOptEngine.moveCount(n), moves.size(), "n=" + n);
                assertEquals(n < 5, moves.isEmpty());
            }
        }

        @Test
        @DisplayName("Randomized enumeration is a permutation of the deterministic one")
        void testRandomizedIsPermutation() {
            SplittableRandom random = new SplittableRandom(3L);
            Problem problem = TestProblems.randomAsymmetric(11, random);
            ThreeOptEngine engine = new ThreeOptEngine(TestProblems.randomTour(problem, random), random);
            List<ThreeOptMove> ordered = collect(engine.localMoves());
            List<ThreeOptMove> shuffled = collect(engine.randomizedLocalMoves());
            assertEquals(ordered.size(), shuffled.size());
            assertEquals(new HashSet<>(ordered), new HashSet<>(shuffled));
            assertNotEquals(ordered, shuffled);
        }

        @Test
        @DisplayName("Random moves are always valid")
        void testRandomLocalMove() {
            SplittableRandom random = new SplittableRandom(4L);
            Problem problem = TestProblems.randomAsymmetric(9, random);
            ThreeOptEngine engine = new ThreeOptEngine(TestProblems.randomTour(problem, random), random);
            Set<ThreeOptMove> valid = new HashSet<>(collect(engine.localMoves()));
            Set<ThreeOptMove> drawn = new HashSet<>();
            for (int i = 0; i < 2_000; i++) {
                ThreeOptMove move = engine.randomLocalMove().orElseThrow();
                assertTrue(valid.contains(move), "invalid random move " + move);
                drawn.add(move);
            }
            assertEquals(valid, drawn, "every move should eventually be drawn");

            ThreeOptEngine small = new ThreeOptEngine(TestProblems.tourOf(TestProblems.fourCity(), 0, 1, 2, 3), random);
            assertEquals(Optional.empty(), small.randomLocalMove());
        }

        @Test
        @DisplayName("Iterators fail fast after the tour changes")
        void testFailFast() {
            Problem problem = TestProblems.hexagon();
            ThreeOptEngine engine = new ThreeOptEngine(TestProblems.tourOf(problem, 0, 3, 1, 4, 2, 5), new SplittableRandom(5L));
            Iterator<ThreeOptMove> ordered = engine.localMoves();
            Iterator<ThreeOptMove> randomized = engine.randomizedLocalMoves();
            engine.applyMove(ordered.next());
            assertThrows(ConcurrentModificationException.class, ordered::hasNext);
            assertThrows(ConcurrentModificationException.class, randomized::next);
        }
    }

    @Nested
    @DisplayName("2. Objective")
    class ObjectiveTests {

        @Test
        @DisplayName("Length before minus delta equals length after, for every move")
        void testDeltaMatchesApply() {
            SplittableRandom random = new SplittableRandom(6L);
            for (int trial = 0; trial < 30; trial++) {
                Problem problem = TestProblems.randomAsymmetric(5 + random.nextInt(6), random);
                TourState base = TestProblems.randomTour(problem, random);
                for (ThreeOptMove move : collect(new ThreeOptEngine(base, random).localMoves())) {
                    TourState tour = base.copy();
                    ThreeOptEngine engine = new ThreeOptEngine(tour, random);
                    double before = tour.exactLength().orElseThrow();
                    double delta = engine.objectiveDeltaOf(move);
                    engine.applyMove(move);
                    double after = tour.exactLength().orElseThrow();
                    assertEquals(before - delta, after, EPS, "move " + move);
                    assertEquals(problem.closedLength(tour.order()), after, EPS);
                    assertEquals(0, tour.cityAt(0));
                }
            }
        }

        @Test
        @DisplayName("Segments keep their orientation")
        void testSegmentExchange() {
            Problem problem = TestProblems.hexagon();
            TourState tour = TestProblems.tourOf(problem, 0, 1, 2, 3, 4, 5);
            new ThreeOptEngine(tour, new SplittableRandom(7L)).applyMove(new ThreeOptMove(0, 2, 4));
            assertArrayEquals(new int[]{0, 3, 4, 1, 2, 5}, tour.order());
        }

        @Test
        @DisplayName("Hexagon: best-improvement descent decreases monotonically to a local optimum")
        void testBestImprovementConverges() {
            Problem problem = TestProblems.hexagon();
            TourState tour = TestProblems.tourOf(problem, 0, 3, 1, 4, 2, 5);
            ThreeOptEngine engine = new ThreeOptEngine(tour, new SplittableRandom(8L));
            double previous = tour.exactLength().orElseThrow();
            assertEquals(104.0d, previous, EPS);

            int steps = 0;
            while (true) {
                ThreeOptMove best = null;
                double bestDelta = 0.0d;
                for (Iterator<ThreeOptMove> it = engine.localMoves(); it.hasNext(); ) {
                    ThreeOptMove move = it.next();
                    double delta = engine.objectiveDeltaOf(move);
                    if (delta > bestDelta) {
                        best = move;
                        bestDelta = delta;
                    }
                }
                if (best == null) {
                    break;
                }
                engine.applyMove(best);
                double current = tour.exactLength().orElseThrow();
                assertTrue(current < previous, "length must strictly decrease");
                previous = current;
                steps++;
            }

            assertEquals(3, steps);
            assertEquals(74.0d, tour.exactLength().orElseThrow(), EPS);
            assertTrue(tour.exactLength().orElseThrow() >= 60.0d, "cannot beat the optimal rim tour");
            for (Iterator<ThreeOptMove> it = engine.localMoves(); it.hasNext(); ) {
                assertTrue(engine.objectiveDeltaOf(it.next()) <= 0.0d);
            }
        }
    }

    @Nested
    @DisplayName("3. Contract")
    class ContractTests {

        @Test
        @DisplayName("Engines reject infeasible tours")
        void testInfeasible() {
            TourState tour = TestProblems.hexagon().emptyTour();
            TourCoreException ex = assertThrows(TourCoreException.class,
                    () -> new ThreeOptEngine(tour, new SplittableRandom(9L)));
            assertEquals(TourCoreException.REASON_TOUR_INFEASIBLE, ex.getReasonCode());
        }

        @Test
        @DisplayName("Out-of-range cut points are rejected")
        void testInvalidMove() {
            ThreeOptEngine engine = new ThreeOptEngine(
                    TestProblems.tourOf(TestProblems.hexagon(), 0, 1, 2, 3, 4, 5), new SplittableRandom(10L));
            for (ThreeOptMove move : List.of(
                    new ThreeOptMove(0, 1, 4),
                    new ThreeOptMove(0, 2, 3),
                    new ThreeOptMove(0, 2, 6),
                    new ThreeOptMove(-1, 2, 4))) {
                TourCoreException ex = assertThrows(TourCoreException.class, () -> engine.objectiveDeltaOf(move));
                assertEquals(TourCoreException.REASON_MOVE_OUT_OF_RANGE, ex.getReasonCode());
            }
            assertEquals(MoveEngineType.THREE_OPT, engine.type());
        }
    }
}
