package com.playlistgen.extraction;

import com.playlistgen.recommender.ExtractionException;
import com.playlistgen.recommender.FeatureVector;
import com.playlistgen.recommender.Track;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class TimeLimitedFeatureExtractorTest {
    private static final Track TRACK = new Track("slow-track", List.of("Artist"), "Slow", "");
    private static final FeatureVector VECTOR = FeatureVector.of(new double[FeatureVector.DIMENSIONS]);

    @Test
    void testSlowExtractionTimesOut() {
        try (TimeLimitedFeatureExtractor extractor = new TimeLimitedFeatureExtractor(track -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return VECTOR;
        }, Duration.ofMillis(100))) {
            ExtractionException e = assertThrows(ExtractionException.class, () -> extractor.extract(TRACK));
            assertEquals(ExtractionException.Kind.TIMEOUT, e.getKind());
        }
    }

    @Test
    void testFastExtractionPassesThrough() throws Exception {
        try (TimeLimitedFeatureExtractor extractor = new TimeLimitedFeatureExtractor(track -> VECTOR, Duration.ofSeconds(5))) {
            assertSame(VECTOR, extractor.extract(TRACK));
        }
    }

    @Test
    void testDelegateFailureKindIsPreserved() {
        try (TimeLimitedFeatureExtractor extractor = new TimeLimitedFeatureExtractor(track -> {
            throw new ExtractionException(ExtractionException.Kind.RATE_LIMITED, "429");
        }, Duration.ofSeconds(5))) {
            ExtractionException e = assertThrows(ExtractionException.class, () -> extractor.extract(TRACK));
            assertEquals(ExtractionException.Kind.RATE_LIMITED, e.getKind());
        }
    }

    @Test
    void testTimedOutCommandProcessIsKilled(@TempDir Path dir) throws Exception {
        assumeTrue(new File("/bin/sh").canExecute(), "needs /bin/sh");
        Path pidFile = dir.resolve("extractor.pid");
        CommandFeatureExtractor command = new CommandFeatureExtractor(
            List.of("/bin/sh", "-c", "echo $$ > '" + pidFile + "'; exec sleep 30"));

        try (TimeLimitedFeatureExtractor extractor = new TimeLimitedFeatureExtractor(command, Duration.ofMillis(500))) {
            ExtractionException e = assertThrows(ExtractionException.class, () -> extractor.extract(TRACK));
            assertEquals(ExtractionException.Kind.TIMEOUT, e.getKind());
        }

        assertTrue(Files.exists(pidFile), "extractor never started");
        long pid = Long.parseLong(Files.readString(pidFile, StandardCharsets.UTF_8).trim());
        boolean alive = true;
        for (int i = 0; i < 100 && alive; i++) {
            Optional<ProcessHandle> handle = ProcessHandle.of(pid);
            alive = handle.isPresent() && handle.get().isAlive();
            if (alive) Thread.sleep(50);
        }
        assertFalse(alive, "extractor process " + pid + " still running after timeout");
    }
}
