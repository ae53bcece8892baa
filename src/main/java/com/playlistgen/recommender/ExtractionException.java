package com.playlistgen.recommender;

/**
 * Failure of a single feature extraction call.
 * <p>
 * The {@link Kind} lets the ingestion orchestrator apply backoff on rate limiting; the retry
 * budget itself is the same for every kind.
 */
public class ExtractionException extends RecommenderException {

    public enum Kind {
        SOURCE_UNAVAILABLE,
        RATE_LIMITED,
        TIMEOUT,
        INVALID_OUTPUT
    }

    private final Kind kind;

    public ExtractionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
