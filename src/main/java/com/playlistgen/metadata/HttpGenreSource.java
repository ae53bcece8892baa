package com.playlistgen.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playlistgen.recommender.GenreSource;
import com.playlistgen.recommender.GenreSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Base class for genre sources backed by a JSON-over-HTTP API.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Subclasses build the request URI for an artist and may add headers (credentials, User-Agent).</li>
 *   <li>The response is fetched with the JDK {@link HttpClient} under a request timeout and parsed with Jackson.</li>
 *   <li>Non-200 status, transport errors and malformed JSON become {@link GenreSourceException}.</li>
 *   <li>Subclasses turn the parsed document into tag names in {@link #extractGenres(JsonNode)}.</li>
 * </ul>
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public abstract class HttpGenreSource implements GenreSource {
    private static final Logger logger = LoggerFactory.getLogger(HttpGenreSource.class);
    protected static final ObjectMapper mapper = new ObjectMapper();
    protected static final String USER_AGENT = "PlaylistGenerator/1.0 (contact@example.com)";

    private final HttpClient httpClient;
    private final Duration timeout;

    protected HttpGenreSource(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    protected HttpGenreSource(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).followRedirects(HttpClient.Redirect.NORMAL).build(), timeout);
    }

    /**
     * @return request URI for an artist lookup
     */
    protected abstract URI buildUri(String artistName);

    /**
     * Extracts tag names from a parsed response.
     * @param root response document
     * @return tag names, empty if the provider knows none
     */
    protected abstract List<String> extractGenres(JsonNode root);

    /**
     * Adds provider-specific headers; the default sets only the User-Agent.
     */
    protected HttpRequest.Builder decorate(HttpRequest.Builder builder) {
        return builder.header("User-Agent", USER_AGENT);
    }

    @Override
    public List<String> lookup(String artistName) throws GenreSourceException {
        JsonNode root = fetchJson(buildUri(artistName));
        List<String> genres = extractGenres(root);
        logger.debug("{} returned {} tag(s) for '{}'", name(), genres.size(), artistName);
        return genres;
    }

    protected JsonNode fetchJson(URI uri) throws GenreSourceException {
        HttpRequest request = decorate(HttpRequest.newBuilder(uri).timeout(timeout).GET()).build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GenreSourceException(name() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenreSourceException(name() + " request interrupted", e);
        }
        if (response.statusCode() != 200) {
            throw new GenreSourceException(name() + " returned HTTP " + response.statusCode());
        }
        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new GenreSourceException(name() + " returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
