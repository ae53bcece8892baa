package com.playlistgen.recommender;

/**
 * Thrown when no artist has a positive lottery weight.
 */
public class EmptyPoolException extends RecommenderException {
    public EmptyPoolException(String message) {
        super(message);
    }
}
