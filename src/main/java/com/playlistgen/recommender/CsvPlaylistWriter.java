package com.playlistgen.recommender;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Exports accepted recommendations to a CSV file using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Creates the output directory if needed and writes {@code <sanitized playlist name>.csv} into it.</li>
 *   <li>One row per result in acceptance order: track id, artists, title, link, seed artist, match phase,
 *       genre overlap and distance (blank for genre-phase matches).</li>
 * </ul>
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public class CsvPlaylistWriter implements PlaylistWriterInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvPlaylistWriter.class);

    static final String[] HEADER = {
        "TrackId", "Artist", "Title", "Link", "SeedArtist", "MatchPhase", "GenreOverlap", "Distance"
    };

    private final Path outputDir;

    public CsvPlaylistWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * @return path the playlist with the given name is written to
     */
    public Path pathFor(String playlistName) {
        return outputDir.resolve(Utils.sanitizeFilename(playlistName) + ".csv");
    }

    @Override
    public void writePlaylist(String playlistName, List<CandidateResult> results) throws IOException {
        if (results == null) {
            logger.warn("Attempted to write null result list for playlist: {}", playlistName);
            throw new IllegalArgumentException("Result list cannot be null");
        }
        if (playlistName == null || playlistName.trim().isEmpty()) {
            logger.warn("Attempted to write playlist with invalid name: {}", playlistName);
            throw new IllegalArgumentException("Playlist name cannot be null or empty");
        }
        if (!Files.exists(outputDir)) Files.createDirectories(outputDir);
        Path file = pathFor(playlistName);
        try (CSVWriter writer = new CSVWriter(new FileWriter(file.toFile(), StandardCharsets.UTF_8))) {
            writer.writeNext(HEADER);
            for (CandidateResult result : results) {
                Track track = result.track();
                writer.writeNext(new String[]{
                    track.id(),
                    safe(track.artistDisplay()),
                    safe(track.title()),
                    safe(track.link()),
                    safe(result.seedArtist()),
                    result.phase().name(),
                    Integer.toString(result.genreOverlap()),
                    result.distance() == null ? "" : String.format(Locale.ROOT, "%.4f", result.distance())
                });
            }
        }
        logger.info("Wrote {} recommendations to CSV file: {}", results.size(), file);
    }

    /**
     * Collapses line breaks so every result stays on one row.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
