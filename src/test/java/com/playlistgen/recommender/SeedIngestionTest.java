package com.playlistgen.recommender;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.playlistgen.recommender.Fixtures.track;
import static com.playlistgen.recommender.Fixtures.vectorAt;
import static org.junit.jupiter.api.Assertions.*;

public class SeedIngestionTest {

    private static List<Track> tracksBy(String artist, int count) {
        List<Track> tracks = new ArrayList<>();
        for (int i = 1; i <= count; i++) tracks.add(track(artist + "-" + i, artist));
        return tracks;
    }

    @Test
    void testFiveFailuresExhaustWithoutSixthAttempt() {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Fixtures.ScriptedExtractor extractor = Fixtures.ScriptedExtractor.alwaysFailing();
        SeedIngestion ingestion = new SeedIngestion(store, extractor, SeedIngestion.MAX_ATTEMPTS, 0);

        SeedExhaustedException e = assertThrows(SeedExhaustedException.class,
            () -> ingestion.ensureSeed("Flaky", tracksBy("flaky", 8)));

        assertEquals(5, extractor.requested.size());
        assertEquals(5, e.getAttempts());
        assertEquals("Flaky", e.getArtist());
        assertEquals(5, extractor.requested.stream().distinct().count());
        assertEquals(0, store.size());
    }

    @Test
    void testSuccessOnThirdAttemptIsStored() throws Exception {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Fixtures.ScriptedExtractor extractor = new Fixtures.ScriptedExtractor(2, ExtractionException.Kind.TIMEOUT, vectorAt(4.0));
        SeedIngestion ingestion = new SeedIngestion(store, extractor, SeedIngestion.MAX_ATTEMPTS, 0);

        Seed seed = ingestion.ensureSeed("Slow", tracksBy("slow", 5));

        assertEquals("slow-3", seed.track().id());
        assertEquals(vectorAt(4.0), seed.features());
        assertEquals(List.of("slow-1", "slow-2", "slow-3"), extractor.requested);
        assertEquals(vectorAt(4.0), store.findFeatures("slow-3").orElseThrow());
    }

    @Test
    void testCachedTrackSkipsExtraction() throws Exception {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Track cached = track("cached-1", "Known");
        store.upsertFeatures(cached, vectorAt(1.5));
        Fixtures.ScriptedExtractor extractor = Fixtures.ScriptedExtractor.alwaysFailing();
        SeedIngestion ingestion = new SeedIngestion(store, extractor, SeedIngestion.MAX_ATTEMPTS, 0);

        Seed seed = ingestion.ensureSeed("Known", List.of(cached));

        assertSame(cached, seed.track());
        assertEquals(vectorAt(1.5), seed.features());
        assertTrue(extractor.requested.isEmpty());
    }

    @Test
    void testCachedTrackAfterFailuresDoesNotConsumeAttempt() throws Exception {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        List<Track> tracks = tracksBy("mixed", 6);
        store.upsertFeatures(tracks.get(4), vectorAt(5.0));
        Fixtures.ScriptedExtractor extractor = Fixtures.ScriptedExtractor.alwaysFailing();
        SeedIngestion ingestion = new SeedIngestion(store, extractor, SeedIngestion.MAX_ATTEMPTS, 0);

        Seed seed = ingestion.ensureSeed("Mixed", tracks);

        assertEquals("mixed-5", seed.track().id());
        assertEquals(List.of("mixed-1", "mixed-2", "mixed-3", "mixed-4"), extractor.requested);
    }

    @Test
    void testRunningOutOfTracksExhaustsEarly() {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Fixtures.ScriptedExtractor extractor = Fixtures.ScriptedExtractor.alwaysFailing();
        SeedIngestion ingestion = new SeedIngestion(store, extractor, SeedIngestion.MAX_ATTEMPTS, 0);

        SeedExhaustedException e = assertThrows(SeedExhaustedException.class,
            () -> ingestion.ensureSeed("Sparse", tracksBy("sparse", 2)));

        assertEquals(2, e.getAttempts());
        assertEquals(2, extractor.requested.size());
    }

    @Test
    void testNoTracksExhaustsImmediately() {
        SeedIngestion ingestion = new SeedIngestion(new InMemoryFeatureStore(), Fixtures.ScriptedExtractor.alwaysFailing(),
            SeedIngestion.MAX_ATTEMPTS, 0);
        SeedExhaustedException e = assertThrows(SeedExhaustedException.class, () -> ingestion.ensureSeed("Nobody", List.of()));
        assertEquals(0, e.getAttempts());
    }

    @Test
    void testDuplicateTracksAreTriedOnce() {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Fixtures.ScriptedExtractor extractor = Fixtures.ScriptedExtractor.alwaysFailing();
        SeedIngestion ingestion = new SeedIngestion(store, extractor, SeedIngestion.MAX_ATTEMPTS, 0);
        Track repeated = track("same", "Echo");

        assertThrows(SeedExhaustedException.class,
            () -> ingestion.ensureSeed("Echo", List.of(repeated, repeated, repeated)));
        assertEquals(List.of("same"), extractor.requested);
    }

    @Test
    void testRateLimitedFailuresStillCountTowardBudget() {
        InMemoryFeatureStore store = new InMemoryFeatureStore();
        Fixtures.ScriptedExtractor extractor = new Fixtures.ScriptedExtractor(Integer.MAX_VALUE,
            ExtractionException.Kind.RATE_LIMITED, null);
        SeedIngestion ingestion = new SeedIngestion(store, extractor, SeedIngestion.MAX_ATTEMPTS, 0);

        assertThrows(SeedExhaustedException.class, () -> ingestion.ensureSeed("Busy", tracksBy("busy", 10)));
        assertEquals(5, extractor.requested.size());
    }

    @Test
    void testRateLimitBackoffDoublesAndSkipsFinalAttempt() {
        List<Long> delays = new ArrayList<>();
        Fixtures.ScriptedExtractor extractor = new Fixtures.ScriptedExtractor(Integer.MAX_VALUE,
            ExtractionException.Kind.RATE_LIMITED, null);
        SeedIngestion ingestion = new SeedIngestion(new InMemoryFeatureStore(), extractor, SeedIngestion.MAX_ATTEMPTS, 100,
            delays::add);

        assertThrows(SeedExhaustedException.class, () -> ingestion.ensureSeed("Busy", tracksBy("busy", 10)));

        assertEquals(List.of(100L, 200L, 400L, 800L), delays);
    }

    @Test
    void testTimeoutFailuresDoNotBackOff() {
        List<Long> delays = new ArrayList<>();
        Fixtures.ScriptedExtractor extractor = new Fixtures.ScriptedExtractor(Integer.MAX_VALUE,
            ExtractionException.Kind.TIMEOUT, null);
        SeedIngestion ingestion = new SeedIngestion(new InMemoryFeatureStore(), extractor, SeedIngestion.MAX_ATTEMPTS, 100,
            delays::add);

        assertThrows(SeedExhaustedException.class, () -> ingestion.ensureSeed("Slow", tracksBy("slow", 10)));

        assertTrue(delays.isEmpty());
    }

    @Test
    void testBackoffOnlyBeforeRetries() throws Exception {
        List<Long> delays = new ArrayList<>();
        Fixtures.ScriptedExtractor extractor = new Fixtures.ScriptedExtractor(2, ExtractionException.Kind.RATE_LIMITED, vectorAt(2.0));
        SeedIngestion ingestion = new SeedIngestion(new InMemoryFeatureStore(), extractor, SeedIngestion.MAX_ATTEMPTS, 50,
            delays::add);

        Seed seed = ingestion.ensureSeed("Busy", tracksBy("busy", 5));

        assertEquals("busy-3", seed.track().id());
        assertEquals(List.of(50L, 100L), delays);
    }
}
