package com.playlistgen.recommender;

/**
 * Unchecked wrapper for Feature Store infrastructure failures (e.g. SQL errors).
 */
public class FeatureStoreException extends RuntimeException {
    public FeatureStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
