package com.playlistgen.recommender;

/**
 * Which stage of the similarity matcher accepted a candidate.
 */
public enum MatchPhase {
    /** Phase 1: genre overlap reached the strict threshold within the bounded scan. */
    STRICT_GENRE,
    /** Phase 2: unbounded rescan accepting any genre overlap. */
    RELAXED_GENRE,
    /** Seed artist had no genres: minimum feature distance over all eligible candidates. */
    NEAREST_FEATURES
}
