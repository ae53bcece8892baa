package com.playlistgen.recommender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Two-phase, genre-gated nearest-neighbor search over the Feature Store.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Take one snapshot of the store; both phases enumerate it in the same (insertion) order.</li>
 *   <li>A candidate is eligible unless it is the seed track itself or any of its artists is the seed artist
 *       or in the excluded set, or its primary artist is above the {@link PopularityFilter} ceiling when one is set.</li>
 *   <li>Seed artist without genres: return the eligible candidate nearest to the seed in Euclidean distance
 *       (first encountered wins ties).</li>
 *   <li>Phase 1: examine at most {@value #STRICT_SCAN_LIMIT} eligible candidates and return the first whose genre
 *       overlap with the seed artist reaches {@code min(3, |seed genres|)}.</li>
 *   <li>Phase 2: rescan from the start with no bound and return the first candidate with any overlap.</li>
 * </ul>
 * Genre lookups go through {@link GenreResolver}, so scanning may populate the genre cache.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public class SimilarityMatcher {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityMatcher.class);

    public static final int STRICT_SCAN_LIMIT = 100;
    public static final int STRICT_OVERLAP = 3;
    public static final int RELAXED_OVERLAP = 1;

    private final FeatureStoreInterface store;
    private final GenreResolver genreResolver;
    private final PopularityFilter popularityFilter;

    public SimilarityMatcher(FeatureStoreInterface store, GenreResolver genreResolver) {
        this(store, genreResolver, PopularityFilter.disabled());
    }

    public SimilarityMatcher(FeatureStoreInterface store, GenreResolver genreResolver, PopularityFilter popularityFilter) {
        this.store = store;
        this.genreResolver = genreResolver;
        this.popularityFilter = popularityFilter == null ? PopularityFilter.disabled() : popularityFilter;
    }

    /**
     * Finds one accepted candidate for a seed.
     * @param seed Seed track and its vector
     * @param seedArtist Winner artist the seed belongs to
     * @param excludedArtists Artists that may not appear on the candidate (any case)
     * @return CandidateResult
     * @throws NoMatchException if no eligible candidate qualifies
     */
    public CandidateResult findMatch(Seed seed, String seedArtist, Set<String> excludedArtists) throws NoMatchException {
        Set<String> excluded = normalizedExclusions(seedArtist, excludedArtists);
        List<StoredTrack> population = store.snapshot();
        GenreSet seedGenres = genreResolver.resolveGenres(seedArtist);

        if (seedGenres.isEmpty()) {
            logger.info("Seed artist '{}' has no genres; matching on feature distance only.", seedArtist);
            return nearestByFeatures(seed, seedArtist, population, excluded);
        }

        int strictThreshold = Math.min(STRICT_OVERLAP, seedGenres.size());
        CandidateResult strict = scan(seed, seedArtist, seedGenres, population, excluded, strictThreshold, STRICT_SCAN_LIMIT, MatchPhase.STRICT_GENRE);
        if (strict != null) {
            return strict;
        }
        logger.info("No strict genre match for '{}' within {} candidates; relaxing to overlap >= {}.",
            seedArtist, STRICT_SCAN_LIMIT, RELAXED_OVERLAP);
        CandidateResult relaxed = scan(seed, seedArtist, seedGenres, population, excluded, RELAXED_OVERLAP, Integer.MAX_VALUE, MatchPhase.RELAXED_GENRE);
        if (relaxed != null) {
            return relaxed;
        }
        throw new NoMatchException("No candidate shares a genre with '" + seedArtist + "' among " + population.size() + " stored tracks");
    }

    private CandidateResult scan(Seed seed, String seedArtist, GenreSet seedGenres, List<StoredTrack> population,
                                 Set<String> excluded, int threshold, int limit, MatchPhase phase) {
        int examined = 0;
        for (StoredTrack candidate : population) {
            if (examined >= limit) break;
            if (!isEligible(candidate.track(), seed.track(), excluded)) continue;
            examined++;
            GenreSet candidateGenres = genreResolver.resolveGenres(candidate.track().primaryArtist());
            int overlap = seedGenres.overlap(candidateGenres);
            if (overlap >= threshold) {
                logger.info("{} match for '{}': '{}' by {} (overlap {}, examined {})", phase, seedArtist,
                    candidate.track().title(), candidate.track().artistDisplay(), overlap, examined);
                return new CandidateResult(seedArtist, candidate.track(), overlap, null, phase, candidateGenres);
            }
        }
        logger.debug("{} scan for '{}' examined {} eligible candidates without a match", phase, seedArtist, examined);
        return null;
    }

    private CandidateResult nearestByFeatures(Seed seed, String seedArtist, List<StoredTrack> population, Set<String> excluded)
            throws NoMatchException {
        StoredTrack best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (StoredTrack candidate : population) {
            if (!isEligible(candidate.track(), seed.track(), excluded)) continue;
            double distance = seed.features().distanceTo(candidate.features());
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        if (best == null) {
            throw new NoMatchException("No eligible candidate for '" + seedArtist + "' among " + population.size() + " stored tracks");
        }
        GenreSet candidateGenres = genreResolver.resolveGenres(best.track().primaryArtist());
        logger.info("Nearest match for '{}': '{}' by {} (distance {})", seedArtist, best.track().title(),
            best.track().artistDisplay(), String.format("%.4f", bestDistance));
        return new CandidateResult(seedArtist, best.track(), 0, bestDistance, MatchPhase.NEAREST_FEATURES, candidateGenres);
    }

    private boolean isEligible(Track candidate, Track seedTrack, Set<String> excluded) {
        if (candidate.id().equals(seedTrack.id())) return false;
        if (candidate.artists().isEmpty()) return false;
        for (String artist : candidate.artists()) {
            if (excluded.contains(Utils.normalizeArtist(artist))) return false;
        }
        return popularityFilter.allows(candidate);
    }

    private static Set<String> normalizedExclusions(String seedArtist, Set<String> excludedArtists) {
        Set<String> excluded = new HashSet<>();
        excluded.add(Utils.normalizeArtist(seedArtist));
        if (excludedArtists != null) {
            for (String artist : excludedArtists) excluded.add(Utils.normalizeArtist(artist));
        }
        excluded.remove("");
        return excluded;
    }
}
