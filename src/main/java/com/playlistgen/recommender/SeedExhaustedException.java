package com.playlistgen.recommender;

/**
 * Thrown when a winner's seed ingestion failed on every attempt. The caller re-rolls the winner.
 */
public class SeedExhaustedException extends RecommenderException {
    private final String artist;
    private final int attempts;

    public SeedExhaustedException(String artist, int attempts, String message) {
        super(message);
        this.artist = artist;
        this.attempts = attempts;
    }

    public String getArtist() {
        return artist;
    }

    public int getAttempts() {
        return attempts;
    }
}
