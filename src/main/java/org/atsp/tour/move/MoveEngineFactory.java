package org.atsp.tour.move;

import lombok.experimental.UtilityClass;
import org.atsp.tour.colony.AntColonyConfig;
import org.atsp.tour.colony.AntColonyEngine;
import org.atsp.tour.core.TourCoreException;
import org.atsp.tour.core.TourState;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Creates local-move engines bound to a feasible tour.
 */
@UtilityClass
public final class MoveEngineFactory {

    /**
     * Creates an engine; colony engines use {@link AntColonyConfig#defaults()}.
     *
     * @param type requested engine kind.
     * @param tour feasible tour the engine mutates.
     * @param random randomness for randomized enumeration and sampling.
     * @return engine bound to {@code tour}; close it when done.
     */
    public static LocalMoveEngine<?> create(MoveEngineType type, TourState tour, SplittableRandom random) {
        return create(type, tour, random, null);
    }

    /**
     * Creates an engine with an explicit colony configuration.
     *
     * @param type requested engine kind.
     * @param tour feasible tour the engine mutates.
     * @param random randomness for randomized enumeration and sampling.
     * @param colonyConfig colony parameters, {@code null} for defaults; ignored by other kinds.
     * @return engine bound to {@code tour}; close it when done.
     * @throws TourCoreException when the type is missing or the tour is infeasible.
     */
    public static LocalMoveEngine<?> create(
            MoveEngineType type,
            TourState tour,
            SplittableRandom random,
            AntColonyConfig colonyConfig
    ) {
        if (type == null) {
            throw new TourCoreException(
                    TourCoreException.REASON_ENGINE_TYPE_REQUIRED,
                    "engine type must be explicitly specified (THREE_OPT, SHIFT_INSERT, ANT_COLONY)"
            );
        }
        Objects.requireNonNull(tour, "tour");
        Objects.requireNonNull(random, "random");
        return switch (type) {
            case THREE_OPT -> new ThreeOptEngine(tour, random);
            case SHIFT_INSERT -> new ShiftInsertEngine(tour, random);
            case ANT_COLONY -> new AntColonyEngine(
                    tour,
                    colonyConfig == null ? AntColonyConfig.defaults() : colonyConfig,
                    random
            );
        };
    }
}
