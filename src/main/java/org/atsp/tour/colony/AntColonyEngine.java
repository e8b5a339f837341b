package org.atsp.tour.colony;

import org.atsp.tour.core.TourCoreException;
import org.atsp.tour.core.TourState;
import org.atsp.tour.move.FailFastMoveIterator;
import org.atsp.tour.move.LocalMoveEngine;
import org.atsp.tour.move.MoveEngineType;
import org.atsp.tour.problem.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SplittableRandom;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Population move engine: each move is a whole round of ants sampled against the current
 * pheromone trail.
 *
 * <p>Ants only read the distance matrix and a trail snapshot, so a round is built on a
 * fixed worker pool; deposit and evaporation run on the calling thread after all ants have
 * returned. Every ant draws from a generator split off the engine's random in ant order, so
 * a seeded engine samples the same rounds regardless of the worker count.</p>
 *
 * <p>Engines owning a pool must be closed.</p>
 */
public final class AntColonyEngine implements LocalMoveEngine<AntColonyRound> {
    private static final Logger logger = LoggerFactory.getLogger(AntColonyEngine.class);

    private final TourState tour;
    private final Problem problem;
    private final AntColonyConfig config;
    private final SplittableRandom random;
    private final PheromoneTrail trail;
    private final ExecutorService workers;
    private int roundsApplied;

    /**
     * Binds a colony to a feasible tour.
     *
     * @param tour feasible tour to mutate.
     * @param config colony parameters.
     * @param random randomness source for ant construction.
     * @throws TourCoreException when the tour is infeasible.
     * @throws IllegalArgumentException when the configuration is out of range.
     */
    public AntColonyEngine(TourState tour, AntColonyConfig config, SplittableRandom random) {
        this.tour = Objects.requireNonNull(tour, "tour");
        this.config = Objects.requireNonNull(config, "config").validated();
        this.random = Objects.requireNonNull(random, "random");
        if (!tour.isFeasible()) {
            throw new TourCoreException(
                    TourCoreException.REASON_TOUR_INFEASIBLE,
                    "ant colony requires a feasible tour, " + tour.remainingCount() + " cities remain"
            );
        }
        this.problem = tour.problem();
        this.trail = new PheromoneTrail(problem.dimension(), config.getInitialPheromone());
        this.workers = config.getWorkerThreads() > 1
                ? Executors.newFixedThreadPool(config.getWorkerThreads(), new AntThreadFactory())
                : null;
    }

    @Override
    public MoveEngineType type() {
        return MoveEngineType.ANT_COLONY;
    }

    @Override
    public TourState tour() {
        return tour;
    }

    /**
     * Yields a single freshly sampled round; sampling happens on the first {@code next()}.
     */
    @Override
    public Iterator<AntColonyRound> localMoves() {
        return new FailFastMoveIterator<>(tour) {
            private boolean consumed;

            @Override
            protected boolean hasNextMove() {
                return !consumed;
            }

            @Override
            protected AntColonyRound nextMove() {
                consumed = true;
                return sampleRound();
            }
        };
    }

    /**
     * Same as {@link #localMoves()}: a round is random already.
     */
    @Override
    public Iterator<AntColonyRound> randomizedLocalMoves() {
        return localMoves();
    }

    @Override
    public Optional<AntColonyRound> randomLocalMove() {
        return Optional.of(sampleRound());
    }

    /**
     * Current length minus the best ant's length.
     */
    @Override
    public double objectiveDeltaOf(AntColonyRound round) {
        Objects.requireNonNull(round, "round");
        return tour.distance() - round.best().length();
    }

    /**
     * Reinforces the shortest half of the round, with the current tour ranked among the
     * ants, evaporates the whole trail and replaces the tour with the round's best ant.
     */
    @Override
    public void applyMove(AntColonyRound round) {
        Objects.requireNonNull(round, "round");
        List<AntTour> ants = round.ants();
        // the current tour competes for reinforcement as one more ant
        List<AntTour> candidates = new ArrayList<>(ants.size() + 1);
        candidates.addAll(ants);
        candidates.add(new AntTour(tour.order(), tour.distance()));
        candidates.sort(Comparator.comparingDouble(AntTour::length));
        int selected = Math.max(1, ants.size() / 2);
        for (int i = 0; i < selected; i++) {
            deposit(candidates.get(i));
        }
        trail.evaporate(config.getEvaporation());

        AntTour best = round.best();
        double before = tour.distance();
        tour.replaceOrder(best.path(), best.length());
        roundsApplied++;
        if (logger.isDebugEnabled()) {
            logger.debug("colony round {} applied: {} -> {} ({} ants, {} reinforced)",
                    roundsApplied, before, best.length(), ants.size(), selected);
        }
    }

    /**
     * Samples {@code antsPerRound} ants against a snapshot of the current trail.
     *
     * @throws TourCoreException when a worker fails or the calling thread is interrupted.
     */
    public AntColonyRound sampleRound() {
        PheromoneTrail snapshot = trail.snapshot();
        List<Callable<AntTour>> tasks = new ArrayList<>(config.getAntsPerRound());
        for (int ant = 0; ant < config.getAntsPerRound(); ant++) {
            SplittableRandom antRandom = random.split();
            tasks.add(() -> constructAnt(snapshot, antRandom));
        }

        List<AntTour> ants = new ArrayList<>(tasks.size());
        if (workers == null) {
            for (Callable<AntTour> task : tasks) {
                ants.add(runInline(task));
            }
        } else {
            try {
                for (Future<AntTour> future : workers.invokeAll(tasks)) {
                    ants.add(future.get());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TourCoreException(
                        TourCoreException.REASON_COLONY_SAMPLING_FAILED,
                        "interrupted while sampling ants",
                        ex
                );
            } catch (ExecutionException ex) {
                throw new TourCoreException(
                        TourCoreException.REASON_COLONY_SAMPLING_FAILED,
                        "ant construction failed: " + ex.getCause(),
                        ex.getCause()
                );
            }
        }
        AntColonyRound round = new AntColonyRound(ants);
        logger.debug("sampled {}", round);
        return round;
    }

    /**
     * @return copy of the current trail.
     */
    public PheromoneTrail pheromoneTrail() {
        return trail.snapshot();
    }

    public AntColonyConfig config() {
        return config;
    }

    public int roundsApplied() {
        return roundsApplied;
    }

    /**
     * Shuts the worker pool down; sampling afterwards fails.
     */
    @Override
    public void close() {
        if (workers != null) {
            workers.shutdown();
        }
    }

    private AntTour constructAnt(PheromoneTrail levels, SplittableRandom antRandom) {
        int n = problem.dimension();
        int start = antRandom.nextInt(n);
        int[] path = new int[n];
        boolean[] visited = new boolean[n];
        int[] candidates = new int[n];
        double[] weights = new double[n];
        path[0] = start;
        visited[start] = true;

        int current = start;
        double length = 0.0d;
        for (int step = 1; step < n; step++) {
            int count = 0;
            double total = 0.0d;
            for (int city = 0; city < n; city++) {
                if (visited[city]) {
                    continue;
                }
                double weight = weight(levels, current, city);
                candidates[count] = city;
                weights[count] = weight;
                total += weight;
                count++;
            }
            int next = candidates[pick(weights, count, total, antRandom)];
            length += problem.distance(current, next);
            visited[next] = true;
            path[step] = next;
            current = next;
        }
        if (n > 1) {
            length += problem.distance(current, start);
        }
        return new AntTour(path, length);
    }

    private double weight(PheromoneTrail levels, int from, int to) {
        double pheromone = Math.max(levels.level(from, to), config.getPheromoneFloor());
        double distance = problem.distance(from, to);
        double visibility = distance != 0.0d ? Math.pow(distance, config.getBeta()) : 1.0d;
        return Math.pow(pheromone, config.getAlpha()) / visibility;
    }

    /**
     * Roulette-wheel choice; degenerate weights fall back to a uniform pick.
     */
    private static int pick(double[] weights, int count, double total, SplittableRandom antRandom) {
        if (!(total > 0.0d) || !Double.isFinite(total)) {
            return antRandom.nextInt(count);
        }
        double target = antRandom.nextDouble() * total;
        double cumulative = 0.0d;
        for (int i = 0; i < count; i++) {
            cumulative += weights[i];
            if (target < cumulative) {
                return i;
            }
        }
        return count - 1;
    }

    private void deposit(AntTour ant) {
        double amount = ant.length() > 0.0d
                ? config.getDepositScale() / ant.length()
                : config.getDepositScale();
        trail.deposit(ant.path(), amount);
    }

    private static AntTour runInline(Callable<AntTour> task) {
        try {
            return task.call();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new TourCoreException(
                    TourCoreException.REASON_COLONY_SAMPLING_FAILED,
                    "ant construction failed: " + ex,
                    ex
            );
        }
    }

    private static final class AntThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger threads = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "ant-colony-" + pool + "-worker-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
