package com.casesentinel.job;

import java.util.Objects;

/**
 * Result of one detector (or the trending pass) within a run.
 *
 * @since 1.0.0
 */
public final class DetectorOutcome {

    private final String detector;
    private final boolean success;
    private final int resultCount;
    private final int written;
    private final long durationMs;
    private final String error;

    private DetectorOutcome(String detector, boolean success, int resultCount, int written,
            long durationMs, String error) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.success = success;
        this.resultCount = resultCount;
        this.written = written;
        this.durationMs = durationMs;
        this.error = error;
    }

    public static DetectorOutcome success(String detector, int resultCount, int written, long durationMs) {
        return new DetectorOutcome(detector, true, resultCount, written, durationMs, null);
    }

    public static DetectorOutcome failure(String detector, long durationMs, String error) {
        return new DetectorOutcome(detector, false, 0, 0, durationMs, error);
    }

    public String getDetector() {
        return detector;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return number of detection results (or topics)
     */
    public int getResultCount() {
        return resultCount;
    }

    /**
     * @return rows appended to the store; always 0 for dry runs
     */
    public int getWritten() {
        return written;
    }

    public long getDurationMs() {
        return durationMs;
    }

    /**
     * @return failure description, or {@code null} on success
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return success
                ? "DetectorOutcome{" + detector + ": " + resultCount + " result(s), " + written + " written, "
                        + durationMs + "ms}"
                : "DetectorOutcome{" + detector + ": FAILED after " + durationMs + "ms: " + error + '}';
    }
}
