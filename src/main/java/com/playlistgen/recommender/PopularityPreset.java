package com.playlistgen.recommender;

import java.util.Locale;
import java.util.OptionalLong;

/**
 * Named follower-count ceilings for candidate artists. {@link #POPULAR} applies no ceiling.
 */
public enum PopularityPreset {
    POPULAR("Popular", -1),
    SOMEWHAT_POPULAR("Somewhat Popular", 100_000),
    BALANCED("Balanced", 75_000),
    NICHE("Niche", 50_000),
    VERY_NICHE("Very Niche", 25_000);

    private final String label;
    private final long maxFollowers;

    PopularityPreset(String label, long maxFollowers) {
        this.label = label;
        this.maxFollowers = maxFollowers;
    }

    public String label() {
        return label;
    }

    public OptionalLong maxFollowers() {
        return maxFollowers < 0 ? OptionalLong.empty() : OptionalLong.of(maxFollowers);
    }

    /**
     * Accepts either the label ("Very Niche") or the constant name ("VERY_NICHE"), in any case.
     * @throws IllegalArgumentException for an unknown name
     */
    public static PopularityPreset fromName(String name) {
        if (name != null) {
            String wanted = name.trim().replace('_', ' ').toLowerCase(Locale.ROOT);
            for (PopularityPreset preset : values()) {
                if (preset.label.toLowerCase(Locale.ROOT).equals(wanted)) return preset;
            }
        }
        throw new IllegalArgumentException("Unknown popularity preset: " + name);
    }
}
