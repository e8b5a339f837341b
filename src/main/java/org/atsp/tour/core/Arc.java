package org.atsp.tour.core;

/**
 * Directed edge {@code source -> dest} that extends a partial tour.
 *
 * @param source city the tour currently ends at.
 * @param dest city to append.
 */
public record Arc(int source, int dest) {
    @Override
    public String toString() {
        return source + "->" + dest;
    }
}
