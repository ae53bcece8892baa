package com.playlistgen.recommender;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store for audio feature vectors (track id → vector) and the artist genre cache (artist → genres).
 * <p>
 * Contract:
 * <ul>
 *   <li>Both caches are upsert-only: a write replaces the whole record, never merges fields.</li>
 *   <li>Reads and upserts are atomic per key; concurrent writers to one key resolve last-writer-wins.</li>
 *   <li>{@link #snapshot()} enumerates tracks in a deterministic order (insertion order) that an upsert of an
 *       existing track does not change.</li>
 *   <li>Genre cache keys are normalized artist names ({@link Utils#normalizeArtist(String)}).</li>
 * </ul>
 * Retention is unbounded; the store is a growing knowledge base.
 */
public interface FeatureStoreInterface {
    /**
     * Creates the backing tables or structures if they do not already exist.
     */
    void createTables();

    /**
     * Looks up the cached feature vector for a track.
     * @param trackId Track identifier
     * @return the vector, or empty on a cache miss
     */
    Optional<FeatureVector> findFeatures(String trackId);

    /**
     * Inserts or replaces the feature vector of a track.
     * @param track Track metadata stored with the vector
     * @param features Feature vector
     */
    void upsertFeatures(Track track, FeatureVector features);

    /**
     * Returns every stored track with its vector, in enumeration order.
     * @return immutable snapshot
     */
    List<StoredTrack> snapshot();

    /**
     * Looks up the cached genres for an artist. A cached empty set is a hit.
     * @param artistName Artist name (normalized by the store)
     * @return cached genres, or empty on a cache miss
     */
    Optional<GenreSet> findGenres(String artistName);

    /**
     * Inserts or replaces the cached genres for an artist.
     * @param artistName Artist name (normalized by the store)
     * @param genres Genres to store, possibly empty
     */
    void upsertGenres(String artistName, GenreSet genres);
}
