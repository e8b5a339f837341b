package org.atsp.tour.move;

/**
 * Supported local-move strategies.
 *
 * <p>{@code THREE_OPT} swaps two adjacent tour segments.</p>
 * <p>{@code SHIFT_INSERT} relocates a single city.</p>
 * <p>{@code ANT_COLONY} replaces the tour with the best of a sampled ant population.</p>
 */
public enum MoveEngineType {
    THREE_OPT,
    SHIFT_INSERT,
    ANT_COLONY
}
