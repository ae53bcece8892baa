package com.playlistgen.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local Feature Store.
 * <p>
 * Vectors live in an insertion-ordered map guarded by a read/write lock so {@link #snapshot()} has a stable
 * order; replacing an existing key keeps its position. The genre cache is a {@link ConcurrentHashMap}.
 */
public class InMemoryFeatureStore implements FeatureStoreInterface {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryFeatureStore.class);

    private final Map<String, StoredTrack> tracks = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, GenreSet> genres = new ConcurrentHashMap<>();

    @Override
    public void createTables() {
        logger.debug("In-memory feature store needs no tables.");
    }

    @Override
    public Optional<FeatureVector> findFeatures(String trackId) {
        lock.readLock().lock();
        try {
            StoredTrack stored = tracks.get(trackId);
            return stored == null ? Optional.empty() : Optional.of(stored.features());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void upsertFeatures(Track track, FeatureVector features) {
        if (track == null || features == null) {
            throw new IllegalArgumentException("Track and features are required for upsert");
        }
        lock.writeLock().lock();
        try {
            tracks.put(track.id(), new StoredTrack(track, features));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<StoredTrack> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(new ArrayList<>(tracks.values()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<GenreSet> findGenres(String artistName) {
        return Optional.ofNullable(genres.get(Utils.normalizeArtist(artistName)));
    }

    @Override
    public void upsertGenres(String artistName, GenreSet genreSet) {
        genres.put(Utils.normalizeArtist(artistName), genreSet == null ? GenreSet.empty() : genreSet);
    }

    public int size() {
        lock.readLock().lock();
        try {
            return tracks.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
