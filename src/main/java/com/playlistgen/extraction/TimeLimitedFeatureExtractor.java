package com.playlistgen.extraction;

import com.playlistgen.recommender.ExtractionException;
import com.playlistgen.recommender.FeatureExtractor;
import com.playlistgen.recommender.FeatureVector;
import com.playlistgen.recommender.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wraps a {@link FeatureExtractor} with a per-call timeout.
 * <p>
 * Each call runs on a worker thread; a call that does not finish within the timeout is cancelled
 * (interrupted) and reported as {@link ExtractionException.Kind#TIMEOUT}.
 */
public class TimeLimitedFeatureExtractor implements FeatureExtractor, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TimeLimitedFeatureExtractor.class);

    private final FeatureExtractor delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeLimitedFeatureExtractor(FeatureExtractor delegate, Duration timeout) {
        if (delegate == null) throw new IllegalArgumentException("Delegate extractor cannot be null");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "feature-extraction");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public FeatureVector extract(Track track) throws ExtractionException {
        Future<FeatureVector> future = executor.submit(() -> delegate.extract(track));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Extraction of {} timed out after {} ms", track.id(), timeout.toMillis());
            throw new ExtractionException(ExtractionException.Kind.TIMEOUT,
                "Extraction of " + track.id() + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionException) {
                throw (ExtractionException) cause;
            }
            throw new ExtractionException(ExtractionException.Kind.SOURCE_UNAVAILABLE,
                "Extractor failed for " + track.id() + ": " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionException(ExtractionException.Kind.TIMEOUT,
                "Interrupted while waiting for extraction of " + track.id(), e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
