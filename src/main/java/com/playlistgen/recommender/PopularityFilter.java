package com.playlistgen.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rejects candidates whose primary artist has more followers than a ceiling.
 * <p>
 * An artist with an unknown count, or whose lookup fails, is treated as having zero followers.
 * Counts are looked up once per artist for the lifetime of the filter.
 */
public class PopularityFilter {
    private static final Logger logger = LoggerFactory.getLogger(PopularityFilter.class);

    private static final PopularityFilter DISABLED = new PopularityFilter(null, OptionalLong.empty());

    private final ArtistPopularity popularity;
    private final OptionalLong maxFollowers;
    private final Map<String, Long> followerCache = new ConcurrentHashMap<>();

    public PopularityFilter(ArtistPopularity popularity, OptionalLong maxFollowers) {
        if (maxFollowers.isPresent() && popularity == null) {
            throw new IllegalArgumentException("A follower ceiling needs a popularity source");
        }
        this.popularity = popularity;
        this.maxFollowers = maxFollowers;
    }

    public PopularityFilter(ArtistPopularity popularity, PopularityPreset preset) {
        this(popularity, preset.maxFollowers());
    }

    public static PopularityFilter disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return maxFollowers.isPresent();
    }

    /**
     * @param candidate candidate track
     * @return true when the filter is off or the primary artist is within the ceiling
     */
    public boolean allows(Track candidate) {
        if (!isEnabled()) return true;
        String artist = candidate.primaryArtist();
        if (artist == null || artist.isBlank()) return true;
        long followers = followerCache.computeIfAbsent(Utils.normalizeArtist(artist), key -> lookup(artist));
        if (followers > maxFollowers.getAsLong()) {
            logger.debug("Skipping '{}' by {}: {} followers exceeds {}", candidate.title(), artist, followers,
                maxFollowers.getAsLong());
            return false;
        }
        return true;
    }

    private long lookup(String artist) {
        try {
            return popularity.followers(artist).orElse(0L);
        } catch (GenreSourceException e) {
            logger.warn("Follower lookup failed for '{}': {}", artist, e.getMessage());
            return 0L;
        }
    }
}
