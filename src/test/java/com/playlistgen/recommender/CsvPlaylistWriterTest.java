package com.playlistgen.recommender;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static com.playlistgen.recommender.Fixtures.track;
import static org.junit.jupiter.api.Assertions.*;

public class CsvPlaylistWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWritesResultsInOrder() throws Exception {
        CsvPlaylistWriter writer = new CsvPlaylistWriter(tempDir.resolve("out"));
        List<CandidateResult> results = List.of(
            new CandidateResult("Seed One", track("t1", "Band, The", "Guest"), 2, null, MatchPhase.STRICT_GENRE, GenreSet.of("rock")),
            new CandidateResult("Seed Two", track("t2", "Solo"), 0, 2.1, MatchPhase.NEAREST_FEATURES, GenreSet.empty())
        );

        writer.writePlaylist("Mix: Today", results);

        Path file = writer.pathFor("Mix: Today");
        assertEquals("Mix__Today.csv", file.getFileName().toString());
        assertTrue(Files.exists(file));
        try (CSVReader reader = new CSVReader(new FileReader(file.toFile(), StandardCharsets.UTF_8))) {
            List<String[]> rows = reader.readAll();
            assertEquals(3, rows.size());
            assertArrayEquals(CsvPlaylistWriter.HEADER, rows.get(0));
            assertArrayEquals(new String[]{"t1", "Band, The, Guest", "Title t1", "https://open.spotify.com/track/t1",
                "Seed One", "STRICT_GENRE", "2", ""}, rows.get(1));
            assertEquals("2.1000", rows.get(2)[7]);
            assertEquals("NEAREST_FEATURES", rows.get(2)[5]);
        }
    }

    @Test
    void testRejectsInvalidInput() {
        CsvPlaylistWriter writer = new CsvPlaylistWriter(tempDir);
        assertThrows(IllegalArgumentException.class, () -> writer.writePlaylist("name", null));
        assertThrows(IllegalArgumentException.class, () -> writer.writePlaylist(" ", List.of()));
    }

    @Test
    void testDistanceUsesDotDecimalInAnyLocale() throws Exception {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            CsvPlaylistWriter writer = new CsvPlaylistWriter(tempDir);
            writer.writePlaylist("german", List.of(
                new CandidateResult("Seed", track("t9", "Band"), 0, 0.12345, MatchPhase.NEAREST_FEATURES, GenreSet.empty())));
            try (CSVReader reader = new CSVReader(new FileReader(writer.pathFor("german").toFile(), StandardCharsets.UTF_8))) {
                assertEquals("0.1235", reader.readAll().get(1)[7]);
            }
        } finally {
            Locale.setDefault(previous);
        }
    }
}
