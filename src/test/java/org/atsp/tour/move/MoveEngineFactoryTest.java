package org.atsp.tour.move;

import org.atsp.testing.TestProblems;
import org.atsp.tour.colony.AntColonyConfig;
import org.atsp.tour.colony.AntColonyEngine;
import org.atsp.tour.core.TourCoreException;
import org.atsp.tour.core.TourState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Move Engine Factory Tests")
class MoveEngineFactoryTest {

    private static TourState hexagonTour() {
        return TestProblems.tourOf(TestProblems.hexagon(), 0, 1, 2, 3, 4, 5);
    }

    @Test
    @DisplayName("Creates one engine per type, bound to the given tour")
    void testCreatesEachType() {
        TourState tour = hexagonTour();
        AntColonyConfig colony = AntColonyConfig.builder().antsPerRound(4).workerThreads(1).build();
        for (MoveEngineType type : MoveEngineType.values()) {
            try (LocalMoveEngine<?> engine = MoveEngineFactory.create(type, tour, new SplittableRandom(1L), colony)) {
                assertEquals(type, engine.type());
                assertSame(tour, engine.tour());
            }
        }
    }

    @Test
    @DisplayName("Concrete engine classes match their types")
    void testEngineClasses() {
        TourState tour = hexagonTour();
        assertInstanceOf(ThreeOptEngine.class, MoveEngineFactory.create(MoveEngineType.THREE_OPT, tour, new SplittableRandom(1L)));
        assertInstanceOf(ShiftInsertEngine.class, MoveEngineFactory.create(MoveEngineType.SHIFT_INSERT, tour, new SplittableRandom(1L)));
        try (LocalMoveEngine<?> colony = MoveEngineFactory.create(
                MoveEngineType.ANT_COLONY, tour, new SplittableRandom(1L),
                AntColonyConfig.builder().workerThreads(2).build())) {
            assertInstanceOf(AntColonyEngine.class, colony);
            assertEquals(2, ((AntColonyEngine) colony).config().getWorkerThreads());
        }
    }

    @Test
    @DisplayName("Missing type and infeasible tours fail with reason codes")
    void testFailures() {
        TourCoreException missing = assertThrows(TourCoreException.class,
                () -> MoveEngineFactory.create(null, hexagonTour(), new SplittableRandom(1L)));
        assertEquals(TourCoreException.REASON_ENGINE_TYPE_REQUIRED, missing.getReasonCode());

        TourState empty = TestProblems.hexagon().emptyTour();
        for (MoveEngineType type : MoveEngineType.values()) {
            TourCoreException ex = assertThrows(TourCoreException.class,
                    () -> MoveEngineFactory.create(type, empty, new SplittableRandom(1L),
                            AntColonyConfig.builder().workerThreads(1).build()));
            assertEquals(TourCoreException.REASON_TOUR_INFEASIBLE, ex.getReasonCode());
        }
    }
}
