package com.playlistgen.recommender;

/**
 * A seed track whose feature vector is guaranteed to be in the Feature Store.
 */
public record Seed(Track track, FeatureVector features) {}
