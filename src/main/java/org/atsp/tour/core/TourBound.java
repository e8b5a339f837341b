package org.atsp.tour.core;

import org.atsp.tour.problem.Problem;

/**
 * Bound bookkeeping owned by one {@link TourState}.
 *
 * <p>Both operations are invoked <em>before</em> the tour applies the arc, so implementations
 * see {@code dest} still in the remaining set and {@code source} as the last visited city.</p>
 */
interface TourBound {

    /**
     * @return bound model implemented by this tracker.
     */
    BoundType type();

    /**
     * @return current bound value.
     */
    double value();

    /**
     * Computes the bound increment of appending {@code source -> dest} without mutating
     * any state.
     */
    double deltaOfAdd(TourState tour, int source, int dest);

    /**
     * Applies the bound update for appending {@code source -> dest}.
     */
    void commitAdd(TourState tour, int source, int dest);

    /**
     * @return independent deep copy.
     */
    TourBound copy();

    /**
     * Creates the tracker for an anchor-only tour.
     *
     * @param type requested bound model.
     * @param problem problem backing the tour.
     * @return fresh tracker.
     */
    static TourBound create(BoundType type, Problem problem) {
        return switch (type) {
            case ASSIGNMENT -> new AssignmentTourBound(problem);
            case PATH_LENGTH -> new PathLengthTourBound(problem);
        };
    }
}
