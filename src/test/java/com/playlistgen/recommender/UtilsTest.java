package com.playlistgen.recommender;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

    @Test
    void testSanitizeFilename() {
        assertEquals("My_Playlist_Name_____", Utils.sanitizeFilename("My:Playlist/Name?*<>|"));
        assertEquals("Recommendations_2024-05-01", Utils.sanitizeFilename("Recommendations 2024-05-01"));
    }

    @Test
    void testNormalizeArtist() {
        assertEquals("sigur rós", Utils.normalizeArtist("  Sigur   RÓS "));
        assertEquals("", Utils.normalizeArtist(null));
    }

    @Test
    void testBackoffWithoutBaseReturnsImmediately() {
        long start = System.nanoTime();
        Utils.backoff(5, 0, "test action");
        assertTrue(System.nanoTime() - start < 1_000_000_000L);
    }

    @Test
    void testBackoffDelayDoublesAndCaps() {
        assertEquals(1000L, Utils.backoffDelay(1, 1000));
        assertEquals(8000L, Utils.backoffDelay(4, 1000));
        assertEquals(1024L, Utils.backoffDelay(40, 1));
    }

    @Test
    void testInterruptedBackoffRestoresFlag() {
        List<Long> delays = new ArrayList<>();
        Utils.backoff(2, 10, "test action", millis -> {
            delays.add(millis);
            throw new InterruptedException();
        });
        assertEquals(List.of(20L), delays);
        assertTrue(Thread.interrupted());
    }
}
