package com.playlistgen.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.playlistgen.recommender.ArtistPopularity;
import com.playlistgen.recommender.GenreSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * Genres and follower counts from the Spotify Web API artist search.
 * <p>
 * Prefers the search hit whose name equals the requested artist (case-insensitive) and falls back to the first hit.
 * Requires a bearer token; without one the source reports itself unavailable.
 */
public class SpotifyGenreSource extends HttpGenreSource implements ArtistPopularity {
    private static final Logger logger = LoggerFactory.getLogger(SpotifyGenreSource.class);
    private static final String SEARCH_URL = "https://api.spotify.com/v1/search?type=artist&limit=5&q=%s";

    private final String accessToken;

    public SpotifyGenreSource(String accessToken, Duration timeout) {
        super(timeout);
        this.accessToken = accessToken;
    }

    @Override
    public String name() {
        return "Spotify";
    }

    @Override
    public boolean isAvailable() {
        return accessToken != null && !accessToken.isBlank();
    }

    @Override
    protected URI buildUri(String artistName) {
        return URI.create(String.format(SEARCH_URL, encode(artistName)));
    }

    @Override
    protected HttpRequest.Builder decorate(HttpRequest.Builder builder) {
        return super.decorate(builder).header("Authorization", "Bearer " + accessToken);
    }

    @Override
    public List<String> lookup(String artistName) throws GenreSourceException {
        JsonNode root = fetchJson(buildUri(artistName));
        return genresFor(root, artistName);
    }

    @Override
    protected List<String> extractGenres(JsonNode root) {
        return genresFor(root, null);
    }

    @Override
    public OptionalLong followers(String artistName) throws GenreSourceException {
        if (!isAvailable()) return OptionalLong.empty();
        return followersFor(fetchJson(buildUri(artistName)), artistName);
    }

    static List<String> genresFor(JsonNode root, String artistName) {
        JsonNode best = bestMatch(root, artistName);
        if (best == null) return List.of();
        List<String> genres = new ArrayList<>();
        for (JsonNode genre : best.path("genres")) {
            genres.add(genre.asText());
        }
        logger.debug("Spotify artist '{}' has genres {}", best.path("name").asText(), genres);
        return genres;
    }

    static OptionalLong followersFor(JsonNode root, String artistName) {
        JsonNode best = bestMatch(root, artistName);
        if (best == null) return OptionalLong.empty();
        JsonNode total = best.path("followers").path("total");
        return total.isNumber() ? OptionalLong.of(total.asLong()) : OptionalLong.empty();
    }

    private static JsonNode bestMatch(JsonNode root, String artistName) {
        JsonNode items = root.path("artists").path("items");
        if (!items.isArray() || items.isEmpty()) return null;
        if (artistName != null) {
            String wanted = artistName.trim().toLowerCase(Locale.ROOT);
            for (JsonNode item : items) {
                if (item.path("name").asText("").trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                    return item;
                }
            }
        }
        return items.get(0);
    }
}
