package org.atsp.tour.move;

import org.atsp.tour.core.TourState;

import java.util.Iterator;
import java.util.Optional;

/**
 * Local-move strategy bound to one feasible {@link TourState}.
 *
 * <p>Deltas follow one sign convention across engines: {@code objectiveDeltaOf(move)} is the
 * length <em>decrease</em> the move causes, so a positive delta is an improvement and
 * {@code lengthBefore - delta == lengthAfter}.</p>
 *
 * <p>Applying a move invalidates every iterator previously obtained from the engine; such
 * iterators fail fast with {@link java.util.ConcurrentModificationException}. An exhausted
 * or empty iterator means no move is available, which is a normal terminal condition.</p>
 *
 * @param <M> move type.
 */
public interface LocalMoveEngine<M> extends AutoCloseable {

    /**
     * @return engine kind.
     */
    MoveEngineType type();

    /**
     * @return tour this engine mutates.
     */
    TourState tour();

    /**
     * Enumerates every move in a deterministic order.
     */
    Iterator<M> localMoves();

    /**
     * Enumerates every move exactly once in uniformly random order.
     */
    Iterator<M> randomizedLocalMoves();

    /**
     * Draws one random move; repeated calls may return the same move.
     *
     * @return random move, or empty when the tour admits none.
     */
    Optional<M> randomLocalMove();

    /**
     * Length decrease caused by applying {@code move} to the current tour.
     */
    double objectiveDeltaOf(M move);

    /**
     * Applies {@code move} to the tour.
     */
    void applyMove(M move);

    /**
     * Releases engine resources. Engines without resources keep the no-op default.
     */
    @Override
    default void close() {
    }
}
