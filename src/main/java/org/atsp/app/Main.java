package org.atsp.app;

import org.atsp.search.ConstructionHeuristics;
import org.atsp.search.LocalSearch;
import org.atsp.tour.core.TourState;
import org.atsp.tour.move.LocalMoveEngine;
import org.atsp.tour.move.MoveEngineFactory;
import org.atsp.tour.move.MoveEngineType;
import org.atsp.tour.problem.DistanceMatrixReader;
import org.atsp.tour.problem.Problem;
import org.atsp.tour.problem.ProblemDefinitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.SplittableRandom;

/**
 * Command-line solver: reads a distance matrix, builds a greedy tour and improves it with
 * best-improvement local search.
 *
 * <p>Usage: {@code Main [matrix-file|-] [3opt|shift|aco]}. Without a file (or with
 * {@code -}) the matrix is read from standard input.</p>
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INPUT = 3;
    static final long SEED = 42L;

    /**
     * Launches the solver.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int status = run(args, System.in, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        if (args.length > 2) {
            err.println(usage());
            return EXIT_USAGE;
        }
        MoveEngineType engineType;
        try {
            engineType = parseEngine(args.length > 1 ? args[1] : "3opt");
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        }

        Problem problem;
        try {
            problem = readProblem(args.length > 0 ? args[0] : "-", in);
        } catch (IOException | ProblemDefinitionException ex) {
            err.println("cannot read distance matrix: " + ex.getMessage());
            return EXIT_INPUT;
        }

        TourState tour = ConstructionHeuristics.greedy(problem);
        logger.info("greedy construction: length {}", tour.distance());
        try (LocalMoveEngine<?> engine = MoveEngineFactory.create(engineType, tour, new SplittableRandom(SEED))) {
            int applied = LocalSearch.bestImprovement(engine);
            logger.info("{} local search applied {} moves: length {}", engineType, applied, tour.distance());
        }

        out.println("The shortest path is:");
        out.println(tour.describe());
        out.println(" with a total distance of " + formatLength(tour.distance()) + ".");
        return EXIT_OK;
    }

    static MoveEngineType parseEngine(String name) {
        return switch (name) {
            case "3opt" -> MoveEngineType.THREE_OPT;
            case "shift" -> MoveEngineType.SHIFT_INSERT;
            case "aco" -> MoveEngineType.ANT_COLONY;
            default -> throw new IllegalArgumentException("unknown engine: " + name);
        };
    }

    static String formatLength(double length) {
        if (length == Math.rint(length) && Math.abs(length) < 1e15) {
            return Long.toString((long) length);
        }
        return Double.toString(length);
    }

    private static Problem readProblem(String source, InputStream in) throws IOException {
        if ("-".equals(source)) {
            Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
            return DistanceMatrixReader.read(reader);
        }
        return DistanceMatrixReader.read(Path.of(source));
    }

    private static String usage() {
        return "usage: Main [matrix-file|-] [3opt|shift|aco]";
    }
}
