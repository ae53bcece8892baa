package com.playlistgen.recommender;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvListenerProfileProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadsLikedTracksAndPlayCounts() throws Exception {
        Path liked = tempDir.resolve("liked.csv");
        Files.writeString(liked, String.join("\n",
            "TrackId,Artists,Title,Link",
            "id1,\"Daft Punk; Pharrell Williams\",Get Lucky,https://open.spotify.com/track/id1",
            ",Nobody,Missing Id,",
            "id2,Air,La Femme d'Argent,https://open.spotify.com/track/id2",
            ""));
        Path plays = tempDir.resolve("plays.csv");
        Files.writeString(plays, String.join("\n",
            "Artist,Plays",
            "Air,3",
            " air ,2",
            "Daft Punk,lots",
            ""));

        ListenerProfile profile = new CsvListenerProfileProvider(liked, plays).loadProfile();

        assertEquals(2, profile.likedTracks().size());
        Track first = profile.likedTracks().get(0);
        assertEquals(List.of("Daft Punk", "Pharrell Williams"), first.artists());
        assertEquals("Get Lucky", first.title());
        assertEquals(5.0, profile.playMap().get("air"));
        assertFalse(profile.playMap().containsKey("daft punk"));
    }

    @Test
    void testPlayCountsAreOptional() throws Exception {
        Path liked = tempDir.resolve("liked.csv");
        Files.writeString(liked, "TrackId,Artists,Title,Link\nid1,Air,Playground Love,\n");
        ListenerProfile profile = new CsvListenerProfileProvider(liked, null).loadProfile();
        assertEquals(1, profile.likedTracks().size());
        assertTrue(profile.playMap().isEmpty());
    }

    @Test
    void testMissingLikedFileFails() {
        CsvListenerProfileProvider provider = new CsvListenerProfileProvider(tempDir.resolve("absent.csv"), null);
        assertThrows(RecommenderException.class, provider::loadProfile);
    }
}
