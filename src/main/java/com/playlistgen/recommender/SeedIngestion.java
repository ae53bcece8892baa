package com.playlistgen.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Guarantees that a winner has a seed track with a cached feature vector.
 * <p>
 * Per-winner state machine:
 * <pre>
 *   TRYING(track, attempt) --cached or extracted--> READY(vector)
 *   TRYING(track, attempt) --failure, attempt &lt; max, untried track left--> TRYING(next, attempt + 1)
 *   TRYING(track, attempt) --failure, attempt == max or no track left--> EXHAUSTED
 * </pre>
 * A track already in the Feature Store is READY without an extractor call and consumes no attempt.
 * Extracted vectors are upserted before the state becomes READY. Rate-limit failures back off exponentially
 * before the next attempt; the attempt budget is the same for every failure kind and is never shared between winners.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public class SeedIngestion {
    private static final Logger logger = LoggerFactory.getLogger(SeedIngestion.class);

    public static final int MAX_ATTEMPTS = 5;

    public enum State { TRYING, READY, EXHAUSTED }

    /**
     * Attempt bookkeeping for one winner. Lives only while that winner is processed.
     */
    static final class RetryState {
        private final int maxAttempts;
        private final List<Track> remaining;
        private State state = State.TRYING;
        private Track current;
        private int attempt;

        RetryState(List<Track> candidates, int maxAttempts) {
            this.maxAttempts = maxAttempts;
            Map<String, Track> distinct = new LinkedHashMap<>();
            for (Track t : candidates) distinct.putIfAbsent(t.id(), t);
            this.remaining = new ArrayList<>(distinct.values());
        }

        /** Moves to the next untried track, or to EXHAUSTED when none is left. */
        boolean advance() {
            if (remaining.isEmpty()) {
                state = State.EXHAUSTED;
                return false;
            }
            current = remaining.remove(0);
            return true;
        }

        int beginAttempt() {
            return ++attempt;
        }

        void fail() {
            if (attempt >= maxAttempts) {
                state = State.EXHAUSTED;
            }
        }

        void ready() {
            state = State.READY;
        }

        State state() {
            return state;
        }

        Track current() {
            return current;
        }

        int attempt() {
            return attempt;
        }
    }

    private final FeatureStoreInterface store;
    private final FeatureExtractor extractor;
    private final int maxAttempts;
    private final long rateLimitBackoffMillis;
    private final Utils.Sleeper sleeper;

    public SeedIngestion(FeatureStoreInterface store, FeatureExtractor extractor, int maxAttempts, long rateLimitBackoffMillis) {
        this(store, extractor, maxAttempts, rateLimitBackoffMillis, Thread::sleep);
    }

    SeedIngestion(FeatureStoreInterface store, FeatureExtractor extractor, int maxAttempts, long rateLimitBackoffMillis,
                  Utils.Sleeper sleeper) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        this.store = store;
        this.extractor = extractor;
        this.maxAttempts = maxAttempts;
        this.rateLimitBackoffMillis = rateLimitBackoffMillis;
        this.sleeper = sleeper;
    }

    public SeedIngestion(FeatureStoreInterface store, FeatureExtractor extractor) {
        this(store, extractor, MAX_ATTEMPTS, 1000L);
    }

    /**
     * Ensures one of the winner's tracks has a feature vector.
     * @param winnerArtist Winner artist
     * @param candidateTracks The winner's tracks in the order they should be tried
     * @return the ready seed
     * @throws SeedExhaustedException after {@code maxAttempts} failed extractions or when no untried track is left
     */
    public Seed ensureSeed(String winnerArtist, List<Track> candidateTracks) throws SeedExhaustedException {
        RetryState retry = new RetryState(candidateTracks == null ? List.of() : candidateTracks, maxAttempts);
        while (retry.state() == State.TRYING) {
            if (!retry.advance()) break;
            Track track = retry.current();

            Optional<FeatureVector> cached = store.findFeatures(track.id());
            if (cached.isPresent()) {
                retry.ready();
                logger.info("Seed for '{}' already cached: '{}' ({})", winnerArtist, track.title(), track.id());
                return new Seed(track, cached.get());
            }

            int attempt = retry.beginAttempt();
            try {
                FeatureVector features = extractor.extract(track);
                store.upsertFeatures(track, features);
                retry.ready();
                logger.info("Extracted seed for '{}' on attempt {}: '{}' ({})", winnerArtist, attempt, track.title(), track.id());
                return new Seed(track, features);
            } catch (ExtractionException e) {
                logger.warn("Extraction attempt {}/{} for '{}' failed on {} [{}]: {}", attempt, maxAttempts,
                    winnerArtist, track.id(), e.getKind(), e.getMessage());
                retry.fail();
                if (retry.state() == State.TRYING && e.getKind() == ExtractionException.Kind.RATE_LIMITED) {
                    Utils.backoff(attempt, rateLimitBackoffMillis, "extraction for " + winnerArtist, sleeper);
                }
            }
        }
        logger.warn("Seed ingestion exhausted for '{}' after {} attempt(s)", winnerArtist, retry.attempt());
        throw new SeedExhaustedException(winnerArtist, retry.attempt(),
            "No seed track could be ingested for '" + winnerArtist + "' after " + retry.attempt() + " attempt(s)");
    }
}
