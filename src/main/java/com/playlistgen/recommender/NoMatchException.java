package com.playlistgen.recommender;

/**
 * Thrown when the candidate population holds no qualifying match for a seed.
 */
public class NoMatchException extends RecommenderException {
    public NoMatchException(String message) {
        super(message);
    }
}
