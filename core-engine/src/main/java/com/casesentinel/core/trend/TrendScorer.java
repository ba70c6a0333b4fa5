package com.casesentinel.core.trend;

import com.casesentinel.core.model.TrendDirection;

/**
 * Trend scoring for term and category counts.
 *
 * <h3>Score</h3>
 *
 * <pre>
 *   ratio = (current + 1) / (baseline + 1)
 *   score = 100 * ln(1 + current) * ratio        (* 1.5 when ratio &gt; 2)
 * </pre>
 *
 * <p>
 * Add-one smoothing keeps the score finite when the baseline is zero. Both
 * factors grow with {@code current}, so for a fixed baseline the score is
 * strictly increasing in the current count. For a fixed current count the
 * ratio shrinks as the baseline grows, so faster growth never scores lower.
 * The score is not capped and not clamped at zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendScorer {

    /** Multiplier applied when the smoothed ratio exceeds {@link #VELOCITY_RATIO}. */
    public static final double VELOCITY_BONUS = 1.5;
    public static final double VELOCITY_RATIO = 2.0;

    /** Percentage band around zero classified as stable. */
    public static final double STABLE_BAND = 10.0;

    private TrendScorer() {
        // utility class — not instantiable
    }

    /**
     * @param current  count in the current period; must be &gt;= 0
     * @param baseline count in the baseline period; must be &gt;= 0
     * @return a finite, non-negative score
     * @throws IllegalArgumentException if either count is negative
     */
    public static double score(int current, int baseline) {
        requireNonNegative(current, baseline);
        double ratio = (current + 1.0) / (baseline + 1.0);
        double score = 100.0 * Math.log1p(current) * ratio;
        if (ratio > VELOCITY_RATIO) {
            score *= VELOCITY_BONUS;
        }
        return score;
    }

    /**
     * Percentage change from {@code baseline} to {@code current}. A zero
     * baseline counts as a 100% increase when anything appeared, else 0.
     */
    public static double percentChange(int current, int baseline) {
        requireNonNegative(current, baseline);
        if (baseline == 0) {
            return current > 0 ? 100.0 : 0.0;
        }
        return (current - baseline) * 100.0 / baseline;
    }

    public static TrendDirection direction(double percentChange) {
        if (percentChange > STABLE_BAND) {
            return TrendDirection.RISING;
        }
        if (percentChange < -STABLE_BAND) {
            return TrendDirection.DECLINING;
        }
        return TrendDirection.STABLE;
    }

    private static void requireNonNegative(int current, int baseline) {
        if (current < 0 || baseline < 0) {
            throw new IllegalArgumentException(
                    "Counts must be >= 0, got current=" + current + ", baseline=" + baseline);
        }
    }
}
