package com.playlistgen.recommender;

import com.playlistgen.extraction.CommandFeatureExtractor;
import com.playlistgen.extraction.TimeLimitedFeatureExtractor;
import com.playlistgen.metadata.LastFmGenreSource;
import com.playlistgen.metadata.MusicBrainzGenreSource;
import com.playlistgen.metadata.SpotifyGenreSource;
import com.playlistgen.metadata.TheAudioDbGenreSource;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Main entry point for the playlist generator.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code db}: start the embedded PostgreSQL Feature Store and keep it running until Enter is pressed.</li>
 *   <li>{@code recommend} (default): load the listener profile, run the engine and export the playlist to CSV.</li>
 * </ul>
 * The Feature Store is the PostgreSQL database at {@code DB_URL} when set, otherwise an embedded instance.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Connects to the configured database, starting the embedded one when {@code embedded} is given,
     * and ensures tables exist.
     * @param embedded running embedded instance, or null to use {@code DB_URL}
     * @return FeatureStoreInterface
     */
    private static FeatureStoreInterface createFeatureStore(EmbeddedPostgres embedded) {
        String dbUrl = embedded == null
            ? RecommenderConfig.dbUrl()
            : String.format("jdbc:postgresql://localhost:%d/postgres", embedded.getPort());
        String dbUser = embedded == null ? RecommenderConfig.dbUser() : "postgres";
        String dbPass = embedded == null ? RecommenderConfig.dbPass() : "postgres";
        PostgresFeatureStore store = new PostgresFeatureStore(dbUrl, dbUser, dbPass);
        store.createTables();
        return store;
    }

    /**
     * Genre sources in priority order.
     */
    static List<GenreSource> genreChain(SpotifyGenreSource spotify) {
        Duration timeout = RecommenderConfig.httpTimeout();
        return List.of(
            spotify,
            new LastFmGenreSource(RecommenderConfig.lastFmApiKey(), timeout),
            new MusicBrainzGenreSource(timeout),
            new TheAudioDbGenreSource(timeout)
        );
    }

    private static void recommend(FeatureStoreInterface store) throws RecommenderException, IOException {
        SpotifyGenreSource spotify = new SpotifyGenreSource(RecommenderConfig.spotifyAccessToken(), RecommenderConfig.httpTimeout());
        GenreResolver genreResolver = new GenreResolver(store, genreChain(spotify));
        OptionalLong maxFollowers = RecommenderConfig.maxFollowerCount();
        PopularityFilter popularityFilter = PopularityFilter.disabled();
        if (maxFollowers.isPresent()) {
            if (spotify.isAvailable()) {
                popularityFilter = new PopularityFilter(spotify, maxFollowers);
                logger.info("Limiting candidates to artists with at most {} followers", maxFollowers.getAsLong());
            } else {
                logger.warn("Follower ceiling {} ignored: SPOTIFY_ACCESS_TOKEN is not set", maxFollowers.getAsLong());
            }
        }
        String playCounts = RecommenderConfig.playCountsCsv();
        ListenerProfileProvider profileProvider = new CsvListenerProfileProvider(
            Paths.get(RecommenderConfig.likedTracksCsv()),
            playCounts.isBlank() ? null : Paths.get(playCounts));

        try (TimeLimitedFeatureExtractor extractor = new TimeLimitedFeatureExtractor(
                CommandFeatureExtractor.fromCommandLine(RecommenderConfig.featureExtractorCommand()),
                RecommenderConfig.extractionTimeout())) {
            SeedIngestion ingestion = new SeedIngestion(store, extractor, SeedIngestion.MAX_ATTEMPTS,
                RecommenderConfig.rateLimitBackoffMillis());
            RecommendationEngine engine = new RecommendationEngine(ingestion, new SimilarityMatcher(store, genreResolver, popularityFilter), new Random());

            RunResult result = engine.run(profileProvider, RecommenderConfig.recommendationCount());
            if (result.results().isEmpty()) {
                logger.warn("No recommendations produced ({}).", result.termination());
                return;
            }
            CsvPlaylistWriter writer = new CsvPlaylistWriter(Paths.get(RecommenderConfig.outputDir()));
            String playlistName = "Recommendations " + LocalDate.now();
            writer.writePlaylist(playlistName, result.results());
            for (CandidateResult r : result.results()) {
                System.out.println(r.track().title() + " - " + r.track().artistDisplay() + "  " + r.link());
            }
            System.out.println("Playlist written to " + writer.pathFor(playlistName));
        }
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments: optional mode ({@code db} or {@code recommend})
     */
    public static void main(String[] args) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase(Locale.ROOT) : "recommend";
        if (!mode.equals("db") && !mode.equals("recommend")) {
            logger.error("Unknown mode '{}'. Use 'db' or 'recommend'.", mode);
            return;
        }
        EmbeddedPostgres postgres = null;
        try {
            boolean useEmbedded = mode.equals("db") || RecommenderConfig.dbUrl().isBlank();
            if (useEmbedded) {
                postgres = PostgresFeatureStore.startEmbedded(RecommenderConfig.embeddedPgDataDir(), RecommenderConfig.embeddedPgPort());
            }
            FeatureStoreInterface store = createFeatureStore(postgres);

            if (mode.equals("db")) {
                System.out.println("Embedded Postgres started.");
                System.out.println("JDBC URL: " + String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort()));
                System.out.println("DB user: postgres");
                System.out.println("DB password: postgres");
                System.out.println("Data directory: " + Path.of(RecommenderConfig.embeddedPgDataDir()).toAbsolutePath());
                System.out.println("Press Enter to stop the embedded DB and exit.");
                try {
                    System.in.read();
                } catch (IOException e) {
                    logger.warn("Failed to read from stdin: {}", e.getMessage());
                }
                return;
            }
            recommend(store);
        } catch (EmptyPoolException e) {
            logger.error("Cannot recommend: {}", e.getMessage());
        } catch (Exception e) {
            logger.error("Recommendation run failed: {}", e.getMessage(), e);
        } finally {
            if (postgres != null) {
                try {
                    postgres.close();
                    logger.info("Embedded PostgreSQL stopped.");
                } catch (IOException e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
    }
}
