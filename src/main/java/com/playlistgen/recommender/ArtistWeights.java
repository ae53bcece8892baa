package com.playlistgen.recommender;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives lottery weights from a listener profile.
 * <p>
 * Fewer liked songs means more room for discovery, so the base weight falls with the liked count:
 * 1 → 10, 2 → 5, 3 → 2, 4+ → 1. Artists present in the recent-listening play map get a ×1.5 boost.
 * Weights are recomputed for every run and never persisted.
 */
public final class ArtistWeights {
    public static final double RECENT_LISTENING_BOOST = 1.5;

    /** Play-map increments per listening source. */
    public static final double RECENTLY_PLAYED_WEIGHT = 3.0;
    public static final double SHORT_TERM_TOP_WEIGHT = 2.0;
    public static final double MEDIUM_TERM_TOP_WEIGHT = 1.0;

    private ArtistWeights() {}

    /**
     * Base weight for an artist with {@code likedCount} liked tracks.
     */
    public static double baseWeight(int likedCount) {
        if (likedCount <= 0) return 0.0;
        return switch (likedCount) {
            case 1 -> 10.0;
            case 2 -> 5.0;
            case 3 -> 2.0;
            default -> 1.0;
        };
    }

    /**
     * Counts liked tracks per artist (every credited artist counts) and converts them to weights.
     * <p>
     * Keys are display names as first observed; lookups against the play map use normalized names.
     * @param profile listener profile
     * @return insertion-ordered artist → weight
     */
    public static Map<String, Double> fromProfile(ListenerProfile profile) {
        Map<String, String> displayByKey = new LinkedHashMap<>();
        Map<String, Integer> likedByKey = new LinkedHashMap<>();
        for (Track track : profile.likedTracks()) {
            for (String artist : track.artists()) {
                String key = Utils.normalizeArtist(artist);
                if (key.isEmpty()) continue;
                displayByKey.putIfAbsent(key, artist.trim());
                likedByKey.merge(key, 1, Integer::sum);
            }
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : likedByKey.entrySet()) {
            double weight = baseWeight(entry.getValue());
            Double plays = profile.playMap().get(entry.getKey());
            if (plays != null && plays > 0) {
                weight *= RECENT_LISTENING_BOOST;
            }
            weights.put(displayByKey.get(entry.getKey()), weight);
        }
        return weights;
    }

    /**
     * Builds a play map from the listener's listening sources, weighting recency over frequency.
     * @param recentlyPlayed artists of recently played tracks (one entry per play)
     * @param shortTermTop artists of short-term top tracks
     * @param mediumTermTop artists of medium-term top tracks
     * @return normalized artist → accumulated play score
     */
    public static Map<String, Double> buildPlayMap(List<String> recentlyPlayed, List<String> shortTermTop, List<String> mediumTermTop) {
        Map<String, Double> playMap = new LinkedHashMap<>();
        accumulate(playMap, recentlyPlayed, RECENTLY_PLAYED_WEIGHT);
        accumulate(playMap, shortTermTop, SHORT_TERM_TOP_WEIGHT);
        accumulate(playMap, mediumTermTop, MEDIUM_TERM_TOP_WEIGHT);
        return playMap;
    }

    private static void accumulate(Map<String, Double> playMap, List<String> artists, double increment) {
        if (artists == null) return;
        for (String artist : artists) {
            String key = Utils.normalizeArtist(artist);
            if (!key.isEmpty()) playMap.merge(key, increment, Double::sum);
        }
    }
}
