package com.casesentinel.job;

import com.casesentinel.core.model.TimeWindow;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Summary of one job run, returned by the trigger endpoint as JSON.
 *
 * @since 1.0.0
 */
public final class RunReport {

    private final TimeWindow window;
    private final boolean dryRun;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final List<DetectorOutcome> outcomes;

    public RunReport(TimeWindow window, boolean dryRun, Instant startedAt, Instant finishedAt,
            List<DetectorOutcome> outcomes) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.dryRun = dryRun;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        this.outcomes = List.copyOf(outcomes);
    }

    public TimeWindow getWindow() {
        return window;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public List<DetectorOutcome> getOutcomes() {
        return outcomes;
    }

    public List<String> getFailedDetectors() {
        return outcomes.stream()
                .filter(o -> !o.isSuccess())
                .map(DetectorOutcome::getDetector)
                .toList();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(o -> !o.isSuccess());
    }

    public int getTotalWritten() {
        return outcomes.stream().mapToInt(DetectorOutcome::getWritten).sum();
    }

    @Override
    public String toString() {
        return "RunReport{window=" + window.wireName() + ", dryRun=" + dryRun
                + ", outcomes=" + outcomes + '}';
    }
}
