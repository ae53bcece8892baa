package com.playlistgen.recommender;

import java.util.List;

/**
 * Immutable record representing a track observed on the music service.
 * <p>
 * The {@code id} is the stable source-of-truth key used by the Feature Store.
 * {@code artists} keeps the credited artists in order; the first entry is the primary artist,
 * which is the one used for genre lookups.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public record Track(String id, List<String> artists, String title, String link) {

    public Track {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Track id cannot be null or blank");
        }
        artists = artists == null ? List.of() : List.copyOf(artists);
    }

    /**
     * Returns the primary (first credited) artist, or an empty string when none is known.
     */
    public String primaryArtist() {
        return artists.isEmpty() ? "" : artists.get(0);
    }

    /**
     * Returns the credited artists joined for display, e.g. "Artist A, Artist B".
     */
    public String artistDisplay() {
        return String.join(", ", artists);
    }
}
