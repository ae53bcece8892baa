package com.playlistgen.metadata;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Genres from TheAudioDB artist search: the first artist's {@code strGenre} and {@code strStyle}.
 * Uses the public test key.
 */
public class TheAudioDbGenreSource extends HttpGenreSource {
    private static final String SEARCH_URL = "https://www.theaudiodb.com/api/v1/json/2/search.php?s=%s";

    public TheAudioDbGenreSource(Duration timeout) {
        super(timeout);
    }

    @Override
    public String name() {
        return "TheAudioDB";
    }

    @Override
    protected URI buildUri(String artistName) {
        return URI.create(String.format(SEARCH_URL, encode(artistName)));
    }

    @Override
    protected List<String> extractGenres(JsonNode root) {
        JsonNode artists = root.path("artists");
        if (!artists.isArray() || artists.isEmpty()) return List.of();
        JsonNode artist = artists.get(0);
        List<String> genres = new ArrayList<>();
        for (String field : List.of("strGenre", "strStyle")) {
            JsonNode value = artist.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                genres.add(value.asText());
            }
        }
        return genres;
    }
}
