package org.atsp.tour.move;

/**
 * Segment exchange with cut points {@code i < j < k}: the tour
 * {@code [0..i] [i+1..j] [j+1..k] [k+1..]} becomes {@code [0..i] [j+1..k] [i+1..j] [k+1..]}.
 *
 * @param i position of the last city before the first segment.
 * @param j position of the last city of the first segment.
 * @param k position of the last city of the second segment.
 */
public record ThreeOptMove(int i, int j, int k) {
}
