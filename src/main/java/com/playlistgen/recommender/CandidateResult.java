package com.playlistgen.recommender;

/**
 * Immutable record of one accepted recommendation.
 * <p>
 * The match rationale is either the genre overlap count (genre phases, {@code distance} is null)
 * or the feature distance to the seed ({@link MatchPhase#NEAREST_FEATURES}). {@code candidateGenres}
 * is informational only.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public record CandidateResult(
    String seedArtist,
    Track track,
    int genreOverlap,
    Double distance,
    MatchPhase phase,
    GenreSet candidateGenres
) {
    public String link() {
        return track.link();
    }
}
