package com.playlistgen.recommender;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Feature Store backed by PostgreSQL.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@code audio_features} holds one row per track id with the 16 feature columns; artists are a JSONB array.</li>
 *   <li>{@code artist_genres} holds one row per normalized artist name with a JSONB array of tags.</li>
 *   <li>All writes are single {@code INSERT ... ON CONFLICT ... DO UPDATE} statements, so each upsert is atomic per key
 *       and replaces the whole record.</li>
 *   <li>Enumeration order is {@code ORDER BY id}; the serial id survives upserts, so re-extracting a track keeps its position.</li>
 * </ul>
 * <p>
 * Error Handling: every {@link SQLException} is logged and rethrown as {@link FeatureStoreException};
 * a broken store must not be mistaken for a cache miss.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public class PostgresFeatureStore implements FeatureStoreInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresFeatureStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final String url;
    private final String user;
    private final String password;
    private final ObjectMapper mapper = new ObjectMapper();

    private static final String FEATURE_COLUMNS = String.join(", ", FeatureVector.DIMENSION_NAMES);

    /**
     * Constructs a PostgresFeatureStore with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresFeatureStore(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public void createTables() {
        StringBuilder featureTable = new StringBuilder("CREATE TABLE IF NOT EXISTS audio_features (" +
                "id SERIAL PRIMARY KEY, " +
                "track_id VARCHAR(64) UNIQUE NOT NULL, " +
                "artists JSONB NOT NULL, " +
                "track_name TEXT, " +
                "link TEXT, ");
        for (String column : FeatureVector.DIMENSION_NAMES) {
            featureTable.append(column).append(" DOUBLE PRECISION NOT NULL, ");
        }
        featureTable.append("created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)");
        String genreTable = "CREATE TABLE IF NOT EXISTS artist_genres (" +
                "artist_name TEXT PRIMARY KEY, " +
                "genres JSONB NOT NULL, " +
                "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP" +
                ")";
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(featureTable.toString());
            stmt.execute(genreTable);
            logger.info("Ensured audio_features and artist_genres tables exist.");
        } catch (SQLException e) {
            logger.error("Error creating tables: {}", e.getMessage());
            throw new FeatureStoreException("Failed to create feature store tables", e);
        }
    }

    @Override
    public Optional<FeatureVector> findFeatures(String trackId) {
        String sql = "SELECT " + FEATURE_COLUMNS + " FROM audio_features WHERE track_id = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, trackId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(readFeatures(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            logger.error("Error reading features for track {}: {}", trackId, e.getMessage());
            throw new FeatureStoreException("Failed to read features for track " + trackId, e);
        }
    }

    @Override
    public void upsertFeatures(Track track, FeatureVector features) {
        if (track == null || features == null) {
            throw new IllegalArgumentException("Track and features are required for upsert");
        }
        StringBuilder placeholders = new StringBuilder();
        StringBuilder updates = new StringBuilder("artists = EXCLUDED.artists, track_name = EXCLUDED.track_name, link = EXCLUDED.link");
        for (String column : FeatureVector.DIMENSION_NAMES) {
            placeholders.append(", ?");
            updates.append(", ").append(column).append(" = EXCLUDED.").append(column);
        }
        String sql = "INSERT INTO audio_features (track_id, artists, track_name, link, " + FEATURE_COLUMNS + ") " +
                "VALUES (?, ?, ?, ?" + placeholders + ") " +
                "ON CONFLICT (track_id) DO UPDATE SET " + updates;
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, track.id());
            ps.setObject(2, mapper.writeValueAsString(track.artists()), Types.OTHER);
            ps.setString(3, track.title());
            ps.setString(4, track.link());
            double[] values = features.toArray();
            for (int i = 0; i < values.length; i++) {
                ps.setDouble(5 + i, values[i]);
            }
            ps.executeUpdate();
            logger.debug("Upserted features for track {}", track.id());
        } catch (SQLException e) {
            logger.error("Error upserting features for track {}: {}", track.id(), e.getMessage());
            throw new FeatureStoreException("Failed to upsert features for track " + track.id(), e);
        } catch (JsonProcessingException e) {
            throw new FeatureStoreException("Failed to serialize artists for track " + track.id(), e);
        }
    }

    @Override
    public List<StoredTrack> snapshot() {
        String sql = "SELECT track_id, artists, track_name, link, " + FEATURE_COLUMNS + " FROM audio_features ORDER BY id";
        List<StoredTrack> rows = new ArrayList<>();
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                List<String> artists = readStringList(rs.getString("artists"));
                Track track = new Track(rs.getString("track_id"), artists, rs.getString("track_name"), rs.getString("link"));
                rows.add(new StoredTrack(track, readFeatures(rs)));
            }
        } catch (SQLException e) {
            logger.error("Error enumerating feature store: {}", e.getMessage());
            throw new FeatureStoreException("Failed to enumerate feature store", e);
        }
        return List.copyOf(rows);
    }

    @Override
    public Optional<GenreSet> findGenres(String artistName) {
        String sql = "SELECT genres FROM artist_genres WHERE artist_name = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Utils.normalizeArtist(artistName));
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(GenreSet.of(readStringList(rs.getString("genres"))));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            logger.error("Error reading genres for artist '{}': {}", artistName, e.getMessage());
            throw new FeatureStoreException("Failed to read genres for artist " + artistName, e);
        }
    }

    @Override
    public void upsertGenres(String artistName, GenreSet genres) {
        String sql = "INSERT INTO artist_genres (artist_name, genres, updated_at) VALUES (?, ?, CURRENT_TIMESTAMP) " +
                "ON CONFLICT (artist_name) DO UPDATE SET genres = EXCLUDED.genres, updated_at = EXCLUDED.updated_at";
        GenreSet value = genres == null ? GenreSet.empty() : genres;
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Utils.normalizeArtist(artistName));
            ps.setObject(2, mapper.writeValueAsString(value.genres()), Types.OTHER);
            ps.executeUpdate();
            logger.debug("Cached {} genres for artist '{}'", value.size(), artistName);
        } catch (SQLException e) {
            logger.error("Error caching genres for artist '{}': {}", artistName, e.getMessage());
            throw new FeatureStoreException("Failed to cache genres for artist " + artistName, e);
        } catch (JsonProcessingException e) {
            throw new FeatureStoreException("Failed to serialize genres for artist " + artistName, e);
        }
    }

    private FeatureVector readFeatures(ResultSet rs) throws SQLException {
        double[] values = new double[FeatureVector.DIMENSIONS];
        for (int i = 0; i < values.length; i++) {
            values[i] = rs.getDouble(FeatureVector.DIMENSION_NAMES.get(i));
        }
        return FeatureVector.of(values);
    }

    private List<String> readStringList(String json) throws SQLException {
        if (json == null || json.isBlank()) return List.of();
        try {
            return mapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new SQLException("Malformed JSONB array: " + json, e);
        }
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new RuntimeException(e);
        }
    }
}
