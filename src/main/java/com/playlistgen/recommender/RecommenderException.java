package com.playlistgen.recommender;

/**
 * Base type for recoverable failures raised by the recommendation engine and its collaborators.
 */
public class RecommenderException extends Exception {
    public RecommenderException(String message) {
        super(message);
    }

    public RecommenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
