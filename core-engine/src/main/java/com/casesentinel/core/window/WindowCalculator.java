package com.casesentinel.core.window;

import com.casesentinel.core.model.TimeRange;
import com.casesentinel.core.model.TimeWindow;
import com.casesentinel.core.model.WindowBounds;

import java.time.Instant;
import java.util.Objects;

/**
 * Turns a logical {@link TimeWindow} into concrete current and baseline
 * ranges.
 *
 * <pre>
 *   baselineStart        baselineEnd = currentStart        currentEnd = now
 *        |------- baseline -------|------- current -------|
 * </pre>
 *
 * @since 1.0.0
 */
public final class WindowCalculator {

    private WindowCalculator() {
        // utility class — not instantiable
    }

    /**
     * @param window logical window; must not be {@code null}
     * @param now    reference instant, used as the exclusive end of the current
     *               range
     * @return the four boundaries of {@code window} at {@code now}
     */
    public static WindowBounds bounds(TimeWindow window, Instant now) {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Instant currentStart = now.minus(window.currentDuration());
        Instant baselineStart = currentStart.minus(window.baselineDuration());

        return new WindowBounds(window,
                new TimeRange(currentStart, now),
                new TimeRange(baselineStart, currentStart));
    }
}
