package com.playlistgen.recommender;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared builders and fakes for recommender tests.
 */
final class Fixtures {
    private Fixtures() {}

    static Track track(String id, String... artists) {
        return new Track(id, List.of(artists), "Title " + id, "https://open.spotify.com/track/" + id);
    }

    /** Vector whose first dimension is {@code x} and the rest zero, so distances equal |x1 - x2|. */
    static FeatureVector vectorAt(double x) {
        double[] values = new double[FeatureVector.DIMENSIONS];
        values[0] = x;
        return FeatureVector.of(values);
    }

    /** Genre source answering from a fixed map and counting calls. */
    static class CountingGenreSource implements GenreSource {
        private final String name;
        private final Map<String, List<String>> answers;
        int calls;

        CountingGenreSource(String name, Map<String, List<String>> answers) {
            this.name = name;
            this.answers = answers;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<String> lookup(String artistName) {
            calls++;
            return answers.getOrDefault(artistName, List.of());
        }
    }

    /** Genre source that always fails. */
    static final class FailingGenreSource implements GenreSource {
        int calls;

        @Override
        public String name() {
            return "Failing";
        }

        @Override
        public List<String> lookup(String artistName) throws GenreSourceException {
            calls++;
            throw new GenreSourceException("HTTP 503");
        }
    }

    /** Extractor that fails a scripted number of times, then returns a vector, recording each track it was asked for. */
    static final class ScriptedExtractor implements FeatureExtractor {
        private final int failures;
        private final ExtractionException.Kind kind;
        private final FeatureVector result;
        final List<String> requested = new ArrayList<>();

        ScriptedExtractor(int failures, ExtractionException.Kind kind, FeatureVector result) {
            this.failures = failures;
            this.kind = kind;
            this.result = result;
        }

        static ScriptedExtractor alwaysFailing() {
            return new ScriptedExtractor(Integer.MAX_VALUE, ExtractionException.Kind.SOURCE_UNAVAILABLE, null);
        }

        @Override
        public FeatureVector extract(Track track) throws ExtractionException {
            requested.add(track.id());
            if (requested.size() <= failures) {
                throw new ExtractionException(kind, "scripted failure " + requested.size());
            }
            return result;
        }
    }
}
