package com.playlistgen.recommender;

import java.util.List;
import java.util.Map;

/**
 * Listener preferences consumed once at the start of a run.
 * <p>
 * {@code likedTracks} are the listener's saved tracks. {@code playMap} is the recent-listening signal
 * keyed by normalized artist name (see {@link Utils#normalizeArtist(String)}); it may be empty.
 */
public record ListenerProfile(List<Track> likedTracks, Map<String, Double> playMap) {
    public ListenerProfile {
        likedTracks = likedTracks == null ? List.of() : List.copyOf(likedTracks);
        playMap = playMap == null ? Map.of() : Map.copyOf(playMap);
    }
}
