package com.playlistgen.recommender;

import java.util.List;

/**
 * One external genre-metadata provider in the resolver's fallback chain.
 */
public interface GenreSource {
    /**
     * Short provider name used in logs.
     */
    String name();

    /**
     * Whether the source is configured (credentials present). Unavailable sources are skipped.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Looks up genre tags for an artist.
     * @param artistName Artist display name
     * @return tags, empty if the provider knows none
     * @throws GenreSourceException if the provider call fails
     */
    List<String> lookup(String artistName) throws GenreSourceException;
}
