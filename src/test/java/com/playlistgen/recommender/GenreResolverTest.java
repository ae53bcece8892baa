package com.playlistgen.recommender;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GenreResolverTest {

    @Test
    void testSecondLookupIsCacheHit() {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Fixtures.CountingGenreSource source = new Fixtures.CountingGenreSource("Primary",
            Map.of("Radiohead", List.of("Alternative Rock", "art rock")));
        GenreResolver resolver = new GenreResolver(store, List.of(source));

        GenreSet first = resolver.resolveGenres("Radiohead");
        GenreSet second = resolver.resolveGenres("  radiohead ");

        assertEquals(GenreSet.of("alternative rock", "art rock"), first);
        assertEquals(first, second);
        assertEquals(1, source.calls);
    }

    @Test
    void testFirstNonEmptySourceWinsWithoutUnion() {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Fixtures.CountingGenreSource empty = new Fixtures.CountingGenreSource("Empty", Map.of());
        Fixtures.CountingGenreSource second = new Fixtures.CountingGenreSource("Second", Map.of("Bjork", List.of("electronic")));
        Fixtures.CountingGenreSource third = new Fixtures.CountingGenreSource("Third", Map.of("Bjork", List.of("art pop")));
        GenreResolver resolver = new GenreResolver(store, List.of(empty, second, third));

        assertEquals(GenreSet.of("electronic"), resolver.resolveGenres("Bjork"));
        assertEquals(1, empty.calls);
        assertEquals(1, second.calls);
        assertEquals(0, third.calls);
        assertEquals(GenreSet.of("electronic"), store.findGenres("bjork").orElseThrow());
    }

    @Test
    void testFailingSourceIsSkipped() {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Fixtures.FailingGenreSource failing = new Fixtures.FailingGenreSource();
        Fixtures.CountingGenreSource fallback = new Fixtures.CountingGenreSource("Fallback", Map.of("Low", List.of("slowcore")));
        GenreResolver resolver = new GenreResolver(store, List.of(failing, fallback));

        assertEquals(GenreSet.of("slowcore"), resolver.resolveGenres("Low"));
        assertEquals(1, failing.calls);
    }

    @Test
    void testUnavailableSourceIsNotCalled() {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Fixtures.CountingGenreSource unconfigured = new Fixtures.CountingGenreSource("Unconfigured", Map.of("Low", List.of("x"))) {
            @Override
            public boolean isAvailable() {
                return false;
            }
        };
        GenreResolver resolver = new GenreResolver(store, List.of(unconfigured));

        assertTrue(resolver.resolveGenres("Low").isEmpty());
        assertEquals(0, unconfigured.calls);
    }

    @Test
    void testEmptyResultIsCachedAsHit() {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Fixtures.CountingGenreSource source = new Fixtures.CountingGenreSource("Only", Map.of());
        GenreResolver resolver = new GenreResolver(store, List.of(source));

        assertTrue(resolver.resolveGenres("Nobody Knows").isEmpty());
        assertTrue(resolver.resolveGenres("Nobody Knows").isEmpty());
        assertEquals(1, source.calls);
        assertTrue(store.findGenres("nobody knows").isPresent());
    }
}
