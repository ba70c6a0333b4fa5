package com.casesentinel.core.window;

import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.model.WindowBounds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WindowCalculator}.
 */
class WindowCalculatorTest {

    private static final Instant NOW = Instant.parse("2025-06-02T12:00:00Z");

    @Test
    @DisplayName("Daily window compares the last 24 hours with the 24 hours before")
    void dailyBounds() {
        WindowBounds bounds = WindowCalculator.bounds(TimeWindow.DAILY, NOW);

        assertThat(bounds.getCurrentEnd()).isEqualTo(NOW);
        assertThat(bounds.getCurrentStart()).isEqualTo(Instant.parse("2025-06-01T12:00:00Z"));
        assertThat(bounds.getBaselineEnd()).isEqualTo(bounds.getCurrentStart());
        assertThat(bounds.getBaselineStart()).isEqualTo(Instant.parse("2025-05-31T12:00:00Z"));
    }

    @Test
    @DisplayName("Hourly window spans four hours each side")
    void hourlyBounds() {
        WindowBounds bounds = WindowCalculator.bounds(TimeWindow.HOURLY, NOW);

        assertThat(bounds.getCurrentStart()).isEqualTo(Instant.parse("2025-06-02T08:00:00Z"));
        assertThat(bounds.getBaselineStart()).isEqualTo(Instant.parse("2025-06-02T04:00:00Z"));
    }

    @Test
    @DisplayName("Weekly window spans seven days each side")
    void weeklyBounds() {
        WindowBounds bounds = WindowCalculator.bounds(TimeWindow.WEEKLY, NOW);

        assertThat(bounds.getCurrentStart()).isEqualTo(Instant.parse("2025-05-26T12:00:00Z"));
        assertThat(bounds.getBaselineStart()).isEqualTo(Instant.parse("2025-05-19T12:00:00Z"));
    }

    @Test
    @DisplayName("Boundary instant belongs to the current range only")
    void boundaryBelongsToCurrent() {
        WindowBounds bounds = WindowCalculator.bounds(TimeWindow.DAILY, NOW);
        Instant boundary = bounds.getCurrentStart();

        assertThat(bounds.getCurrent().contains(boundary)).isTrue();
        assertThat(bounds.getBaseline().contains(boundary)).isFalse();
        assertThat(bounds.getCurrent().contains(NOW)).isFalse();
    }

    @Test
    @DisplayName("Same inputs give equal bounds")
    void deterministic() {
        assertThat(WindowCalculator.bounds(TimeWindow.WEEKLY, NOW))
                .isEqualTo(WindowCalculator.bounds(TimeWindow.WEEKLY, NOW));
    }

    @Test
    @DisplayName("Should reject null window")
    void rejectsNullWindow() {
        assertThatThrownBy(() -> WindowCalculator.bounds(null, NOW))
                .isInstanceOf(NullPointerException.class);
    }
}
