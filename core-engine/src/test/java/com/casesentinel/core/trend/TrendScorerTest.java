package com.casesentinel.core.trend;

import com.casesentinel.core.model.TrendDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TrendScorer}.
 */
class TrendScorerTest {

    @Test
    @DisplayName("Score strictly increases with the current count for a fixed baseline")
    void strictlyIncreasingInCurrent() {
        for (int baseline : new int[] {0, 1, 5, 50, 500}) {
            double previous = TrendScorer.score(0, baseline);
            for (int current = 1; current <= 2_000; current++) {
                double score = TrendScorer.score(current, baseline);
                assertThat(score).as("current=%d baseline=%d", current, baseline).isGreaterThan(previous);
                previous = score;
            }
        }
    }

    @Test
    @DisplayName("Faster growth never scores lower for the same current count")
    void nonDecreasingInGrowth() {
        for (int current : new int[] {1, 10, 100}) {
            double previous = TrendScorer.score(current, 1_000);
            for (int baseline = 999; baseline >= 0; baseline--) {
                double score = TrendScorer.score(current, baseline);
                assertThat(score).as("current=%d baseline=%d", current, baseline).isGreaterThan(previous);
                previous = score;
            }
        }
    }

    @Test
    @DisplayName("Score is finite when the baseline is zero")
    void finiteAtZeroBaseline() {
        assertThat(Double.isFinite(TrendScorer.score(0, 0))).isTrue();
        assertThat(Double.isFinite(TrendScorer.score(1_000_000, 0))).isTrue();
        assertThat(TrendScorer.score(0, 0)).isZero();
    }

    @Test
    @DisplayName("Percent change treats a new term as a 100% increase")
    void percentChange() {
        assertThat(TrendScorer.percentChange(5, 0)).isEqualTo(100.0);
        assertThat(TrendScorer.percentChange(0, 0)).isEqualTo(0.0);
        assertThat(TrendScorer.percentChange(15, 10)).isEqualTo(50.0);
        assertThat(TrendScorer.percentChange(5, 10)).isEqualTo(-50.0);
    }

    @Test
    @DisplayName("Direction uses a ten percent stable band")
    void direction() {
        assertThat(TrendScorer.direction(10.0)).isEqualTo(TrendDirection.STABLE);
        assertThat(TrendScorer.direction(10.1)).isEqualTo(TrendDirection.RISING);
        assertThat(TrendScorer.direction(-10.0)).isEqualTo(TrendDirection.STABLE);
        assertThat(TrendScorer.direction(-10.1)).isEqualTo(TrendDirection.DECLINING);
    }

    @Test
    @DisplayName("Rejects negative counts")
    void rejectsNegative() {
        assertThatThrownBy(() -> TrendScorer.score(-1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
