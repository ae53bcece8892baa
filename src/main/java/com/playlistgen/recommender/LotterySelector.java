package com.playlistgen.recommender;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Weighted lottery over artists.
 * <p>
 * Each draw is independent and with replacement: a uniform value in {@code [0, total)} selects the first
 * artist, in the map's iteration order, whose cumulative weight exceeds it. Zero-weight artists can never win.
 * Pass an insertion-ordered map for reproducible draws under a seeded {@link Random}.
 */
public class LotterySelector {
    private final Random random;

    public LotterySelector(Random random) {
        this.random = random == null ? new Random() : random;
    }

    public LotterySelector() {
        this(new Random());
    }

    /**
     * Draws one winner.
     * @param weights artist → non-negative weight
     * @return winning artist
     * @throws EmptyPoolException if no artist has positive weight
     */
    public String draw(Map<String, Double> weights) throws EmptyPoolException {
        double total = totalWeight(weights);
        double target = random.nextDouble() * total;
        double cumulative = 0.0;
        String lastPositive = null;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            double w = entry.getValue();
            if (w <= 0.0) continue;
            cumulative += w;
            lastPositive = entry.getKey();
            if (cumulative > target) {
                return entry.getKey();
            }
        }
        // floating point rounding can leave target == cumulative on the last entry
        return lastPositive;
    }

    /**
     * Draws {@code count} independent winners.
     * @param weights artist → non-negative weight
     * @param count number of draws
     * @return winners in draw order
     * @throws EmptyPoolException if no artist has positive weight
     */
    public List<String> drawMany(Map<String, Double> weights, int count) throws EmptyPoolException {
        if (count < 0) throw new IllegalArgumentException("Draw count cannot be negative: " + count);
        totalWeight(weights);
        List<String> winners = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            winners.add(draw(weights));
        }
        return winners;
    }

    private static double totalWeight(Map<String, Double> weights) throws EmptyPoolException {
        if (weights == null || weights.isEmpty()) {
            throw new EmptyPoolException("Artist pool is empty");
        }
        double total = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            Double w = entry.getValue();
            if (w == null || w < 0.0 || w.isNaN()) {
                throw new IllegalArgumentException("Invalid weight for artist '" + entry.getKey() + "': " + w);
            }
            total += w;
        }
        if (total <= 0.0) {
            throw new EmptyPoolException("No artist in the pool has a positive weight");
        }
        return total;
    }
}
