package org.atsp.tour.colony;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Ants sampled in one round, sorted by ascending length. This is the move type of
 * {@link AntColonyEngine}.
 */
public final class AntColonyRound {
    private final List<AntTour> ants;

    AntColonyRound(List<AntTour> sampled) {
        if (sampled.isEmpty()) {
            throw new IllegalArgumentException("a round needs at least one ant");
        }
        List<AntTour> sorted = new ArrayList<>(sampled);
        sorted.sort(Comparator.comparingDouble(AntTour::length));
        this.ants = Collections.unmodifiableList(sorted);
    }

    /**
     * @return ants by ascending length.
     */
    public List<AntTour> ants() {
        return ants;
    }

    /**
     * @return shortest ant of the round.
     */
    public AntTour best() {
        return ants.get(0);
    }

    public int size() {
        return ants.size();
    }

    @Override
    public String toString() {
        return "AntColonyRound{ants=" + ants.size() + ", best=" + best().length() + "}";
    }
}
