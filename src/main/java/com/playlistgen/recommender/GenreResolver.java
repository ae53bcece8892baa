package com.playlistgen.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves an artist's genres through the Feature Store's genre cache and an ordered chain of external sources.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Cache hit (including a cached empty set): return immediately, no external calls.</li>
 *   <li>Miss: query sources in priority order; the first non-empty answer wins, answers are never unioned.</li>
 *   <li>Write the result back to the cache, replacing any earlier value. An all-empty chain caches an empty set.</li>
 * </ul>
 * A failing or unconfigured source is logged and skipped.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public class GenreResolver {
    private static final Logger logger = LoggerFactory.getLogger(GenreResolver.class);

    private final FeatureStoreInterface store;
    private final List<GenreSource> sources;

    public GenreResolver(FeatureStoreInterface store, List<GenreSource> sources) {
        if (store == null) throw new IllegalArgumentException("Feature store cannot be null");
        this.store = store;
        this.sources = sources == null ? List.of() : List.copyOf(sources);
    }

    /**
     * Resolves genres for an artist, consulting the cache first.
     * @param artistName Artist name
     * @return GenreSet, possibly empty
     */
    public GenreSet resolveGenres(String artistName) {
        if (artistName == null || artistName.isBlank()) {
            return GenreSet.empty();
        }
        Optional<GenreSet> cached = store.findGenres(artistName);
        if (cached.isPresent()) {
            logger.debug("Genre cache hit for '{}': {}", artistName, cached.get().genres());
            return cached.get();
        }
        GenreSet resolved = queryChain(artistName);
        store.upsertGenres(artistName, resolved);
        return resolved;
    }

    private GenreSet queryChain(String artistName) {
        for (GenreSource source : sources) {
            if (!source.isAvailable()) {
                logger.debug("Genre source {} not configured, skipping.", source.name());
                continue;
            }
            try {
                GenreSet genres = GenreSet.of(source.lookup(artistName));
                if (!genres.isEmpty()) {
                    logger.info("Resolved genres for '{}' from {}: {}", artistName, source.name(), genres.genres());
                    return genres;
                }
                logger.debug("{} returned no genres for '{}'", source.name(), artistName);
            } catch (GenreSourceException e) {
                logger.warn("Genre source {} failed for '{}': {}", source.name(), artistName, e.getMessage());
            } catch (RuntimeException e) {
                logger.warn("Genre source {} raised an unexpected error for '{}': {}", source.name(), artistName, e.toString());
            }
        }
        logger.info("No genre source knew '{}'; caching empty result.", artistName);
        return GenreSet.empty();
    }
}
