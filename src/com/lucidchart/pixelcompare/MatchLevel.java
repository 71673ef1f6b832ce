package com.lucidchart.pixelcompare;

/**
 * Preset levels of pixel comparison.
 *
 * EXACT is a pixel to pixel equality check.
 * STRICT ignores color changes that are not visible to the human (anti-aliasing, small rendering changes between
 *      machines with different graphic cards, etc.), but no pixel may differ visibly.
 * TOLERANT accepts changes which are still visible, but barely so, on up to a tenth of a percent of the pixels.
 */
public class MatchLevel {
    public static final MatchLevel EXACT = MatchLevel.apply(0.0, 0.0);
    public static final MatchLevel STRICT = MatchLevel.apply(14.0, 0.0);
    public static final MatchLevel TOLERANT = MatchLevel.apply(20.0, 0.001);

    /** The max RGB distance between two pixels considered equal */
    public final double maxColorDistance;

    /** The fraction of compared pixels allowed to exceed the max color distance */
    public final double maxMismatchRatio;

    private MatchLevel(double maxColorDistance, double maxMismatchRatio) {
        this.maxColorDistance = maxColorDistance;
        this.maxMismatchRatio = maxMismatchRatio;
    }

    public static MatchLevel apply(double maxColorDistance, double maxMismatchRatio) {
        if (maxColorDistance < 0) throw new IllegalArgumentException("Max color distance must not be negative");
        if (maxMismatchRatio < 0 || maxMismatchRatio > 1) throw new IllegalArgumentException("Max mismatch ratio must be between 0 and 1");
        return new MatchLevel(maxColorDistance, maxMismatchRatio);
    }

    @Override
    public String toString() {
        return "MatchLevel(maxColorDistance=" + maxColorDistance + ", maxMismatchRatio=" + maxMismatchRatio + ")";
    }
}
