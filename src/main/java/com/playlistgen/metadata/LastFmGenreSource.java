package com.playlistgen.metadata;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Genres from Last.fm {@code artist.gettoptags}: the names of the top five tags.
 */
public class LastFmGenreSource extends HttpGenreSource {
    private static final String TOP_TAGS_URL =
        "https://ws.audioscrobbler.com/2.0/?method=artist.gettoptags&artist=%s&api_key=%s&format=json&autocorrect=1";
    static final int MAX_TAGS = 5;

    private final String apiKey;

    public LastFmGenreSource(String apiKey, Duration timeout) {
        super(timeout);
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return "Last.fm";
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    protected URI buildUri(String artistName) {
        return URI.create(String.format(TOP_TAGS_URL, encode(artistName), encode(apiKey)));
    }

    @Override
    protected List<String> extractGenres(JsonNode root) {
        // unknown artists come back as {"error": 6, "message": "..."} with HTTP 200
        if (root.has("error")) return List.of();
        List<String> tags = new ArrayList<>();
        for (JsonNode tag : root.path("toptags").path("tag")) {
            if (tags.size() >= MAX_TAGS) break;
            String name = tag.path("name").asText("");
            if (!name.isBlank()) tags.add(name);
        }
        return tags;
    }
}
