package com.playlistgen.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Utility class for common helper methods used by the recommender and its exporters.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * Normalizes an artist name for comparison and cache keys: trimmed, whitespace collapsed, lower-cased.
     * @param artist Artist display name (may be null)
     * @return Normalized key, empty for null input
     */
    public static String normalizeArtist(String artist) {
        if (artist == null) return "";
        return artist.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * Pause used between retries.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    /**
     * @return {@code baseMillis * 2^(attempt-1)}, with the exponent capped at 10
     */
    public static long backoffDelay(int attempt, long baseMillis) {
        return baseMillis * (1L << Math.min(Math.max(attempt - 1, 0), 10));
    }

    /**
     * Sleeps for an exponential backoff of {@code baseMillis * 2^(attempt-1)}.
     * Restores the interrupt flag and returns early if interrupted.
     * @param attempt 1-based attempt number that just failed
     * @param baseMillis base delay; zero or negative disables the wait
     * @param actionDesc Description for logging
     */
    public static void backoff(int attempt, long baseMillis, String actionDesc) {
        backoff(attempt, baseMillis, actionDesc, Thread::sleep);
    }

    public static void backoff(int attempt, long baseMillis, String actionDesc, Sleeper sleeper) {
        if (baseMillis <= 0) return;
        long delay = backoffDelay(attempt, baseMillis);
        logger.info("Backing off {} ms before retrying {} (attempt {})", delay, actionDesc, attempt);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Backoff for {} interrupted", actionDesc);
        }
    }
}
