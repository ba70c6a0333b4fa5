package com.casesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Concrete boundaries of a {@link TimeWindow} evaluated at a reference
 * instant. The baseline range ends exactly where the current range starts.
 *
 * @since 1.0.0
 */
public final class WindowBounds {

    private final TimeWindow window;
    private final TimeRange current;
    private final TimeRange baseline;

    public WindowBounds(TimeWindow window, TimeRange current, TimeRange baseline) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.current = Objects.requireNonNull(current, "current must not be null");
        this.baseline = Objects.requireNonNull(baseline, "baseline must not be null");
        if (!baseline.getEnd().equals(current.getStart())) {
            throw new IllegalArgumentException(
                    "Baseline must end where current starts: " + baseline + " / " + current);
        }
    }

    public TimeWindow getWindow() {
        return window;
    }

    public TimeRange getCurrent() {
        return current;
    }

    public TimeRange getBaseline() {
        return baseline;
    }

    public Instant getCurrentStart() {
        return current.getStart();
    }

    public Instant getCurrentEnd() {
        return current.getEnd();
    }

    public Instant getBaselineStart() {
        return baseline.getStart();
    }

    public Instant getBaselineEnd() {
        return baseline.getEnd();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowBounds that))
            return false;
        return window == that.window && current.equals(that.current) && baseline.equals(that.baseline);
    }

    @Override
    public int hashCode() {
        return Objects.hash(window, current, baseline);
    }

    @Override
    public String toString() {
        return "WindowBounds{" +
                "window=" + window.wireName() +
                ", current=" + current +
                ", baseline=" + baseline +
                '}';
    }
}
