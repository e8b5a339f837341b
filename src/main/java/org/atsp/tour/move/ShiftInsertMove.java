package org.atsp.tour.move;

/**
 * Relocation of the city at {@code cityIndex} to just before the city currently at
 * {@code destinationIndex}.
 *
 * @param cityIndex position of the city to move.
 * @param destinationIndex position (before removal) of the city it is inserted in front of.
 */
public record ShiftInsertMove(int cityIndex, int destinationIndex) {
}
