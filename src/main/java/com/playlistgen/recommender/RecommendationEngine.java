package com.playlistgen.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Run controller: turns a listener profile into up to N recommendations.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Derive artist weights from the profile ({@link ArtistWeights}) and draw N winners up front.</li>
 *   <li>For each winner in order: ensure a seed through {@link SeedIngestion}.</li>
 *   <li>Seed exhausted: drop the artist from the pool and draw one replacement winner.</li>
 *   <li>Seed ready: ask {@link SimilarityMatcher} for a candidate, excluding every liked artist and every artist
 *       already recommended. On no match the winner is skipped (no re-roll) and the artist's weight is halved.</li>
 *   <li>Stop at N results, when the queue of winners is empty, when no replacement can be drawn,
 *       or when total draws reach {@value #SAFETY_CAP_FACTOR} × N.</li>
 * </ul>
 * Winners are processed one at a time. Runs are best-effort: the result may be shorter than N, and
 * {@link RunResult#termination()} says why.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public class RecommendationEngine {
    private static final Logger logger = LoggerFactory.getLogger(RecommendationEngine.class);

    public static final int SAFETY_CAP_FACTOR = 3;
    public static final double NO_MATCH_PENALTY = 0.5;

    private final SeedIngestion ingestion;
    private final SimilarityMatcher matcher;
    private final LotterySelector lottery;
    private final Random random;

    public RecommendationEngine(SeedIngestion ingestion, SimilarityMatcher matcher, Random random) {
        this.ingestion = ingestion;
        this.matcher = matcher;
        this.random = random == null ? new Random() : random;
        this.lottery = new LotterySelector(this.random);
    }

    /**
     * Loads the profile and runs.
     * @param provider Listener profile source, read once
     * @param count Number of recommendations requested
     * @return RunResult
     * @throws RecommenderException if the profile cannot be loaded or the pool is empty
     */
    public RunResult run(ListenerProfileProvider provider, int count) throws RecommenderException {
        return run(provider.loadProfile(), count);
    }

    /**
     * Produces up to {@code count} recommendations for a profile.
     * @param profile Listener profile
     * @param count Number of recommendations requested
     * @return RunResult with the accepted candidates in acceptance order
     * @throws EmptyPoolException if no artist has a positive weight at the start of the run
     */
    public RunResult run(ListenerProfile profile, int count) throws EmptyPoolException {
        if (count < 0) throw new IllegalArgumentException("Recommendation count cannot be negative: " + count);

        Map<String, Double> weights = new LinkedHashMap<>(ArtistWeights.fromProfile(profile));
        logger.info("Starting run for {} recommendations over {} weighted artists", count, weights.size());
        List<String> initialWinners = lottery.drawMany(weights, count);

        Map<String, List<Track>> tracksByArtist = tracksByArtist(profile.likedTracks());
        Set<String> likedArtists = new HashSet<>(tracksByArtist.keySet());
        Set<String> recommendedArtists = new HashSet<>();
        Set<String> exhaustedKeys = new HashSet<>();
        Set<String> exhaustedArtists = new LinkedHashSet<>();
        List<CandidateResult> results = new ArrayList<>();

        Deque<String> queue = new ArrayDeque<>(initialWinners);
        int drawn = initialWinners.size();
        int cap = SAFETY_CAP_FACTOR * count;
        RunResult.Termination termination = null;

        while (results.size() < count) {
            String winner = queue.poll();
            if (winner == null) {
                termination = RunResult.Termination.WINNERS_CONSUMED;
                break;
            }
            String key = Utils.normalizeArtist(winner);

            if (exhaustedKeys.contains(key)) {
                logger.debug("Discarding queued winner '{}': seed ingestion already exhausted", winner);
                termination = drawReplacement(weights, queue, drawn, cap);
                if (termination != null) break;
                drawn++;
                continue;
            }

            List<Track> candidates = new ArrayList<>(tracksByArtist.getOrDefault(key, List.of()));
            Collections.shuffle(candidates, random);

            Seed seed;
            try {
                seed = ingestion.ensureSeed(winner, candidates);
            } catch (SeedExhaustedException e) {
                logger.warn("Re-rolling winner '{}': {}", winner, e.getMessage());
                exhaustedKeys.add(key);
                exhaustedArtists.add(winner);
                weights.put(winner, 0.0);
                termination = drawReplacement(weights, queue, drawn, cap);
                if (termination != null) break;
                drawn++;
                continue;
            }

            Set<String> excluded = new HashSet<>(likedArtists);
            excluded.addAll(recommendedArtists);
            try {
                CandidateResult result = matcher.findMatch(seed, winner, excluded);
                results.add(result);
                for (String artist : result.track().artists()) {
                    recommendedArtists.add(Utils.normalizeArtist(artist));
                }
                logger.info("[{}/{}] '{}' by {} (seed '{}' by {})", results.size(), count, result.track().title(),
                    result.track().artistDisplay(), seed.track().title(), winner);
            } catch (NoMatchException e) {
                weights.computeIfPresent(winner, (artist, w) -> w * NO_MATCH_PENALTY);
                logger.warn("Skipping winner '{}': {}", winner, e.getMessage());
            }
        }
        if (results.size() >= count) {
            termination = RunResult.Termination.COMPLETED;
        }

        RunResult runResult = new RunResult(results, count, drawn, exhaustedArtists, termination);
        if (runResult.isComplete()) {
            logger.info("Run complete: {} recommendations from {} winner draws", results.size(), drawn);
        } else {
            logger.warn("Run ended with {}/{} recommendations after {} winner draws ({}); exhausted artists: {}",
                results.size(), count, drawn, termination, exhaustedArtists);
        }
        return runResult;
    }

    /**
     * Queues one replacement winner.
     * @return null when a winner was queued, otherwise the reason the run must stop
     */
    private RunResult.Termination drawReplacement(Map<String, Double> weights, Deque<String> queue, int drawn, int cap) {
        if (drawn >= cap) {
            logger.warn("Safety cap of {} winner draws reached", cap);
            return RunResult.Termination.SAFETY_CAP_REACHED;
        }
        try {
            String replacement = lottery.draw(weights);
            queue.add(replacement);
            logger.info("Drew replacement winner '{}' (draw {}/{})", replacement, drawn + 1, cap);
            return null;
        } catch (EmptyPoolException e) {
            logger.warn("No replacement winner available: {}", e.getMessage());
            return RunResult.Termination.POOL_EXHAUSTED;
        }
    }

    private static Map<String, List<Track>> tracksByArtist(List<Track> likedTracks) {
        Map<String, List<Track>> byArtist = new LinkedHashMap<>();
        for (Track track : likedTracks) {
            for (String artist : track.artists()) {
                String key = Utils.normalizeArtist(artist);
                if (!key.isEmpty()) byArtist.computeIfAbsent(key, k -> new ArrayList<>()).add(track);
            }
        }
        return byArtist;
    }
}
