package com.cvjudge.engine.consensus;

import java.util.List;

/**
 * Ordered, non-overlapping score bands mapping a consensus score to a
 * recommendation label.
 *
 * Each band starts at its lower bound (inclusive) and ends at the next
 * band's lower bound (exclusive); the last band runs to 100 inclusive.
 */
public final class RecommendationBands {

    public record Band(String label, double lowerBound) {
        public Band {
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("band label must not be blank");
            }
        }
    }

    private static final RecommendationBands DEFAULTS = new RecommendationBands(List.of(
            new Band("Not Recommended",  0),
            new Band("Consider",         50),
            new Band("Recommend",        70),
            new Band("Strong Recommend", 85)
    ));

    private final List<Band> bands;

    public RecommendationBands(List<Band> bands) {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("at least one recommendation band is required");
        }
        if (bands.get(0).lowerBound() != 0) {
            throw new IllegalArgumentException("the first band must start at 0");
        }
        for (int i = 1; i < bands.size(); i++) {
            double previous = bands.get(i - 1).lowerBound();
            double current  = bands.get(i).lowerBound();
            if (current <= previous || current > 100) {
                throw new IllegalArgumentException(
                        "band lower bounds must increase strictly within 0..100, got "
                        + previous + " then " + current);
            }
        }
        this.bands = List.copyOf(bands);
    }

    /** Not Recommended / Consider / Recommend / Strong Recommend at 0 / 50 / 70 / 85. */
    public static RecommendationBands defaults() {
        return DEFAULTS;
    }

    public String labelFor(double score) {
        if (Double.isNaN(score) || score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within 0..100, got " + score);
        }
        for (int i = bands.size() - 1; i > 0; i--) {
            if (score >= bands.get(i).lowerBound()) {
                return bands.get(i).label();
            }
        }
        return bands.get(0).label();
    }

    public List<Band> bands() {
        return bands;
    }
}
