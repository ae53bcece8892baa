package com.playlistgen.recommender;

/**
 * A Feature Store row: the track and its cached feature vector.
 */
public record StoredTrack(Track track, FeatureVector features) {}
