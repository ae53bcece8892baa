package com.playlistgen.recommender;

/**
 * Opaque, slow and failure-prone producer of feature vectors.
 */
@FunctionalInterface
public interface FeatureExtractor {
    /**
     * Computes the feature vector of a track.
     * @param track Track to analyze
     * @return FeatureVector
     * @throws ExtractionException on any failure, classified by {@link ExtractionException.Kind}
     */
    FeatureVector extract(Track track) throws ExtractionException;
}
