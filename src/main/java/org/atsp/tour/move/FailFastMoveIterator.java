package org.atsp.tour.move;

import org.atsp.tour.core.TourState;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Move iterator that refuses to continue once its tour has been mutated.
 *
 * @param <M> move type.
 */
public abstract class FailFastMoveIterator<M> implements Iterator<M> {
    private final TourState tour;
    private final int expectedModificationCount;

    protected FailFastMoveIterator(TourState tour) {
        this.tour = tour;
        this.expectedModificationCount = tour.modificationCount();
    }

    @Override
    public final boolean hasNext() {
        checkForComodification();
        return hasNextMove();
    }

    @Override
    public final M next() {
        checkForComodification();
        if (!hasNextMove()) {
            throw new NoSuchElementException("no more moves");
        }
        return nextMove();
    }

    protected abstract boolean hasNextMove();

    protected abstract M nextMove();

    private void checkForComodification() {
        if (tour.modificationCount() != expectedModificationCount) {
            throw new ConcurrentModificationException("tour was modified after the moves were enumerated");
        }
    }
}
