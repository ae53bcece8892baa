package com.playlistgen.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Runtime settings. Every key is read from the environment first, then from JVM system properties,
 * then falls back to a default.
 */
public final class RecommenderConfig {
    private static final Logger logger = LoggerFactory.getLogger(RecommenderConfig.class);

    private RecommenderConfig() {}

    public static String dbUrl() { return envOrProp("DB_URL", ""); }
    public static String dbUser() { return envOrProp("DB_USER", "postgres"); }
    public static String dbPass() { return envOrProp("DB_PASS", "postgres"); }
    public static int embeddedPgPort() { return intValue("EMBEDDED_PG_PORT", 5432); }
    public static String embeddedPgDataDir() { return envOrProp("EMBEDDED_PG_DATA_DIR", "playlist-data/pgdata"); }

    public static String spotifyAccessToken() { return envOrProp("SPOTIFY_ACCESS_TOKEN", ""); }
    public static String lastFmApiKey() { return envOrProp("LASTFM_API_KEY", ""); }
    public static Duration httpTimeout() { return Duration.ofSeconds(intValue("HTTP_TIMEOUT_SECONDS", 10)); }

    public static String featureExtractorCommand() { return envOrProp("FEATURE_EXTRACTOR_COMMAND", "python3 extract_features.py"); }
    public static Duration extractionTimeout() { return Duration.ofSeconds(intValue("EXTRACTION_TIMEOUT_SECONDS", 120)); }
    public static long rateLimitBackoffMillis() { return intValue("RATE_LIMIT_BACKOFF_MS", 2000); }

    /**
     * Follower ceiling for candidate artists: {@code MAX_FOLLOWER_COUNT} when numeric, otherwise the
     * {@code POPULARITY_PRESET} ceiling. Empty means no ceiling.
     */
    public static OptionalLong maxFollowerCount() {
        String raw = envOrProp("MAX_FOLLOWER_COUNT", "");
        if (!raw.isBlank()) {
            try {
                return OptionalLong.of(Long.parseLong(raw.trim()));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric value '{}' for MAX_FOLLOWER_COUNT", raw);
            }
        }
        return popularityPreset().maxFollowers();
    }

    public static PopularityPreset popularityPreset() {
        String raw = envOrProp("POPULARITY_PRESET", PopularityPreset.POPULAR.label());
        try {
            return PopularityPreset.fromName(raw);
        } catch (IllegalArgumentException e) {
            logger.warn("{}; using {}", e.getMessage(), PopularityPreset.POPULAR.label());
            return PopularityPreset.POPULAR;
        }
    }

    public static String likedTracksCsv() { return envOrProp("LIKED_TRACKS_CSV", "playlist-data/liked_tracks.csv"); }
    public static String playCountsCsv() { return envOrProp("PLAY_COUNTS_CSV", ""); }
    public static String outputDir() { return envOrProp("OUTPUT_DIR", "playlist-data"); }
    public static int recommendationCount() { return intValue("RECOMMENDATION_COUNT", 10); }

    static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }

    static int intValue(String key, int defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }
}
