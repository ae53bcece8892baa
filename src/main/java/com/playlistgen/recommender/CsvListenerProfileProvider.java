package com.playlistgen.recommender;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a listener profile from CSV exports.
 * <p>
 * Liked tracks: header {@code TrackId,Artists,Title,Link}, artists separated by {@code ;}.
 * Play counts (optional): header {@code Artist,Plays}; repeated artists accumulate.
 * Rows without a track id or with a non-numeric play count are skipped with a warning.
 */
public class CsvListenerProfileProvider implements ListenerProfileProvider {
    private static final Logger logger = LoggerFactory.getLogger(CsvListenerProfileProvider.class);

    private final Path likedTracksFile;
    private final Path playCountsFile;

    /**
     * @param likedTracksFile liked tracks CSV
     * @param playCountsFile play counts CSV, or null when there is no listening history
     */
    public CsvListenerProfileProvider(Path likedTracksFile, Path playCountsFile) {
        this.likedTracksFile = likedTracksFile;
        this.playCountsFile = playCountsFile;
    }

    @Override
    public ListenerProfile loadProfile() throws RecommenderException {
        List<Track> liked = readLikedTracks();
        Map<String, Double> playMap = playCountsFile == null || !Files.exists(playCountsFile)
            ? Map.of()
            : readPlayCounts();
        logger.info("Loaded profile: {} liked tracks, {} artists with recent plays", liked.size(), playMap.size());
        return new ListenerProfile(liked, playMap);
    }

    private List<Track> readLikedTracks() throws RecommenderException {
        List<Track> tracks = new ArrayList<>();
        try (CSVReader reader = new CSVReader(new FileReader(likedTracksFile.toFile(), StandardCharsets.UTF_8))) {
            reader.readNext();
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 0 || row[0].isBlank()) {
                    logger.warn("Skipping liked track row without id at line {}", reader.getLinesRead());
                    continue;
                }
                List<String> artists = row.length > 1
                    ? Arrays.stream(row[1].split(";")).map(String::trim).filter(a -> !a.isEmpty()).toList()
                    : List.of();
                String title = row.length > 2 ? row[2].trim() : "";
                String link = row.length > 3 ? row[3].trim() : "";
                tracks.add(new Track(row[0].trim(), artists, title, link));
            }
        } catch (IOException | CsvValidationException e) {
            logger.error("Failed to read liked tracks from {}: {}", likedTracksFile, e.getMessage());
            throw new RecommenderException("Cannot read liked tracks from " + likedTracksFile, e);
        }
        return tracks;
    }

    private Map<String, Double> readPlayCounts() throws RecommenderException {
        Map<String, Double> playMap = new LinkedHashMap<>();
        try (CSVReader reader = new CSVReader(new FileReader(playCountsFile.toFile(), StandardCharsets.UTF_8))) {
            reader.readNext();
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length < 2) continue;
                String key = Utils.normalizeArtist(row[0]);
                if (key.isEmpty()) continue;
                try {
                    playMap.merge(key, Double.parseDouble(row[1].trim()), Double::sum);
                } catch (NumberFormatException e) {
                    logger.warn("Skipping play count '{}' for '{}': not a number", row[1], row[0]);
                }
            }
        } catch (IOException | CsvValidationException e) {
            logger.error("Failed to read play counts from {}: {}", playCountsFile, e.getMessage());
            throw new RecommenderException("Cannot read play counts from " + playCountsFile, e);
        }
        return playMap;
    }
}
