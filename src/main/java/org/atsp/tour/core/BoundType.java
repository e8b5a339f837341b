package org.atsp.tour.core;

/**
 * Lower-bound models a {@link TourState} can maintain while it is being built.
 *
 * <p>{@code ASSIGNMENT} tracks the assignment relaxation: every open slot contributes half of
 * its cheapest still-valid edge, maintained through per-city rank cursors.</p>
 * <p>{@code PATH_LENGTH} tracks the length of the partial path itself.</p>
 *
 * <p>Both models equal the exact tour length once the tour is feasible.</p>
 */
public enum BoundType {
    ASSIGNMENT,
    PATH_LENGTH
}
