package com.playlistgen.recommender;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable 16-dimension audio feature vector for one track.
 * <p>
 * Dimensions, in order:
 * <ul>
 *   <li>Rhythm: tempo (BPM), musical key (0=C .. 11=B), beat regularity.</li>
 *   <li>Spectral: brightness (centroid, Hz), treble (rolloff, Hz), fullness (bandwidth, Hz), dynamic range (contrast).</li>
 *   <li>Temporal: percussiveness (zero crossing rate), loudness (RMS energy).</li>
 *   <li>Harmonic/percussive: warmth, punch.</li>
 *   <li>Timbral: texture (MFCC mean).</li>
 *   <li>Perceptual 0-1 scores: energy, danceability, positive mood, acousticness.</li>
 * </ul>
 * Values are kept in their native scale. Distances are unweighted, so wide-range
 * dimensions such as the spectral ones dominate.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public record FeatureVector(
    double tempoBpm,
    double musicalKey,
    double beatRegularity,
    double brightnessHz,
    double trebleHz,
    double fullnessHz,
    double dynamicRange,
    double percussiveness,
    double loudness,
    double warmth,
    double punch,
    double texture,
    double energy,
    double danceability,
    double moodPositive,
    double acousticness
) {
    public static final int DIMENSIONS = 16;

    /** Column/JSON names of the dimensions, in vector order. */
    public static final List<String> DIMENSION_NAMES = List.of(
        "tempo_bpm", "key_musical", "beat_regularity",
        "brightness_hz", "treble_hz", "fullness_hz", "dynamic_range",
        "percussiveness", "loudness",
        "warmth", "punch",
        "texture",
        "energy", "danceability", "mood_positive", "acousticness"
    );

    /**
     * Builds a vector from values in {@link #DIMENSION_NAMES} order.
     * @param values exactly 16 values
     * @return FeatureVector
     */
    public static FeatureVector of(double... values) {
        if (values == null || values.length != DIMENSIONS) {
            throw new IllegalArgumentException("Expected " + DIMENSIONS + " feature values, got "
                + (values == null ? 0 : values.length));
        }
        return new FeatureVector(values[0], values[1], values[2], values[3], values[4], values[5],
            values[6], values[7], values[8], values[9], values[10], values[11], values[12],
            values[13], values[14], values[15]);
    }

    /**
     * Builds a vector from a name-to-value map keyed by {@link #DIMENSION_NAMES}.
     * @param byName feature values by dimension name
     * @return FeatureVector
     * @throws IllegalArgumentException if a dimension is missing
     */
    public static FeatureVector fromMap(Map<String, ? extends Number> byName) {
        double[] values = new double[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) {
            Number n = byName.get(DIMENSION_NAMES.get(i));
            if (n == null) {
                throw new IllegalArgumentException("Missing feature dimension: " + DIMENSION_NAMES.get(i));
            }
            values[i] = n.doubleValue();
        }
        return of(values);
    }

    public double[] toArray() {
        return new double[]{
            tempoBpm, musicalKey, beatRegularity,
            brightnessHz, trebleHz, fullnessHz, dynamicRange,
            percussiveness, loudness,
            warmth, punch,
            texture,
            energy, danceability, moodPositive, acousticness
        };
    }

    public Map<String, Double> toMap() {
        double[] values = toArray();
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < DIMENSIONS; i++) map.put(DIMENSION_NAMES.get(i), values[i]);
        return map;
    }

    /**
     * Euclidean distance over all 16 dimensions in their native scale.
     */
    public double distanceTo(FeatureVector other) {
        double[] a = toArray();
        double[] b = other.toArray();
        double sum = 0.0;
        for (int i = 0; i < DIMENSIONS; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
