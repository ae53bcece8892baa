package com.playlistgen.recommender;

import java.util.OptionalLong;

/**
 * Source of artist follower counts.
 */
public interface ArtistPopularity {
    /**
     * @param artistName Artist display name
     * @return follower count, empty when the provider does not know the artist or is not configured
     * @throws GenreSourceException if the provider call fails
     */
    OptionalLong followers(String artistName) throws GenreSourceException;
}
