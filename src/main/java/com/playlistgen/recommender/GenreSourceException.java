package com.playlistgen.recommender;

/**
 * Failure of one external genre source. The resolver skips to the next source.
 */
public class GenreSourceException extends RecommenderException {
    public GenreSourceException(String message) {
        super(message);
    }

    public GenreSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
