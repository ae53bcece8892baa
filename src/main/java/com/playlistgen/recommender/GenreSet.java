package com.playlistgen.recommender;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable set of lowercase genre tags for one artist.
 * Tags are trimmed and lower-cased on construction; blank tags are dropped.
 */
public record GenreSet(Set<String> genres) {

    private static final GenreSet EMPTY = new GenreSet(Set.of());

    public GenreSet {
        Set<String> normalized = new LinkedHashSet<>();
        if (genres != null) {
            for (String g : genres) {
                if (g == null) continue;
                String tag = g.trim().toLowerCase(Locale.ROOT);
                if (!tag.isEmpty()) normalized.add(tag);
            }
        }
        genres = Collections.unmodifiableSet(normalized);
    }

    public static GenreSet empty() {
        return EMPTY;
    }

    public static GenreSet of(Collection<String> tags) {
        return new GenreSet(tags == null ? Set.of() : new LinkedHashSet<>(tags));
    }

    public static GenreSet of(String... tags) {
        return of(Arrays.asList(tags));
    }

    public boolean isEmpty() {
        return genres.isEmpty();
    }

    public int size() {
        return genres.size();
    }

    /**
     * Number of tags shared with another set.
     */
    public int overlap(GenreSet other) {
        if (other == null) return 0;
        int count = 0;
        for (String g : genres) {
            if (other.genres.contains(g)) count++;
        }
        return count;
    }
}
