package org.atsp.tour.colony;

/**
 * One sampled ant: a cyclic visiting order starting at the ant's random start city and its
 * closed length. The path array is owned by the record and must not be mutated.
 */
public record AntTour(int[] path, double length) {
}
