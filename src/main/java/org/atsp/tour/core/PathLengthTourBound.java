package org.atsp.tour.core;

import org.atsp.tour.problem.Problem;

/**
 * Bound equal to the exact length of the partial path, closing edge included once the
 * last city is appended.
 */
final class PathLengthTourBound implements TourBound {
    private final Problem problem;
    private double value;

    PathLengthTourBound(Problem problem) {
        this(problem, 0.0d);
    }

    private PathLengthTourBound(Problem problem, double value) {
        this.problem = problem;
        this.value = value;
    }

    @Override
    public BoundType type() {
        return BoundType.PATH_LENGTH;
    }

    @Override
    public double value() {
        return value;
    }

    @Override
    public double deltaOfAdd(TourState tour, int source, int dest) {
        double delta = problem.distance(source, dest);
        if (tour.remainingCount() == 1) {
            delta += problem.distance(dest, Problem.ANCHOR);
        }
        return delta;
    }

    @Override
    public void commitAdd(TourState tour, int source, int dest) {
        value += deltaOfAdd(tour, source, dest);
    }

    @Override
    public TourBound copy() {
        return new PathLengthTourBound(problem, value);
    }
}
