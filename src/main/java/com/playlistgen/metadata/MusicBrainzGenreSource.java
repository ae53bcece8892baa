package com.playlistgen.metadata;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Genres from the MusicBrainz artist search.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Queries {@code /ws/2/artist} by name (JSON response); MusicBrainz requires an identifying User-Agent.</li>
 *   <li>Takes the best (first) matching artist and returns its community tag names, most voted first.</li>
 * </ul>
 */
public class MusicBrainzGenreSource extends HttpGenreSource {
    private static final String SEARCH_URL = "https://musicbrainz.org/ws/2/artist/?query=artist:%s&limit=1&fmt=json";

    public MusicBrainzGenreSource(Duration timeout) {
        super(timeout);
    }

    @Override
    public String name() {
        return "MusicBrainz";
    }

    @Override
    protected URI buildUri(String artistName) {
        return URI.create(String.format(SEARCH_URL, encode("\"" + artistName + "\"")));
    }

    @Override
    protected List<String> extractGenres(JsonNode root) {
        JsonNode artists = root.path("artists");
        if (!artists.isArray() || artists.isEmpty()) return List.of();
        List<JsonNode> tags = new ArrayList<>();
        artists.get(0).path("tags").forEach(tags::add);
        tags.sort((a, b) -> Integer.compare(b.path("count").asInt(0), a.path("count").asInt(0)));
        List<String> names = new ArrayList<>();
        for (JsonNode tag : tags) {
            String name = tag.path("name").asText("");
            if (!name.isBlank()) names.add(name);
        }
        return names;
    }
}
