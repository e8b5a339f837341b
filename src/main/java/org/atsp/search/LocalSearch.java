package org.atsp.search;

import lombok.experimental.UtilityClass;
import org.atsp.tour.move.LocalMoveEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * Descent drivers over any {@link LocalMoveEngine}. Both stop at a local optimum: a full
 * randomized enumeration without a move whose gain exceeds {@link #IMPROVEMENT_EPSILON}.
 */
@UtilityClass
public class LocalSearch {
    private static final Logger logger = LoggerFactory.getLogger(LocalSearch.class);

    /**
     * Smallest gain treated as an improvement; guards against floating-point cycling.
     */
    public static final double IMPROVEMENT_EPSILON = 1e-9d;

    /**
     * Applies the first improving move of each randomized enumeration.
     *
     * @return number of applied moves.
     */
    public static <M> int firstImprovement(LocalMoveEngine<M> engine) {
        int applied = 0;
        while (true) {
            M improving = null;
            Iterator<M> moves = engine.randomizedLocalMoves();
            while (moves.hasNext()) {
                M move = moves.next();
                if (engine.objectiveDeltaOf(move) > IMPROVEMENT_EPSILON) {
                    improving = move;
                    break;
                }
            }
            if (improving == null) {
                break;
            }
            engine.applyMove(improving);
            applied++;
        }
        logger.debug("{} first-improvement descent applied {} moves, length {}",
                engine.type(), applied, engine.tour().distance());
        return applied;
    }

    /**
     * Applies the move with the largest gain of each randomized enumeration; the first move
     * seen wins ties.
     *
     * @return number of applied moves.
     */
    public static <M> int bestImprovement(LocalMoveEngine<M> engine) {
        int applied = 0;
        while (true) {
            M best = null;
            double bestDelta = IMPROVEMENT_EPSILON;
            Iterator<M> moves = engine.randomizedLocalMoves();
            while (moves.hasNext()) {
                M move = moves.next();
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
            applied++;
        }
        logger.debug("{} best-improvement descent applied {} moves, length {}",
                engine.type(), applied, engine.tour().distance());
        return applied;
    }
}
