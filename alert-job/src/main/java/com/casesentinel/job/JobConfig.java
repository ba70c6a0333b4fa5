package com.casesentinel.job;

import com.casesentinel.core.model.AlertType;
import com.casesentinel.core.model.TimeWindow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed, immutable configuration object for the alert computation job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from cron, a container {@code -e} flag or a shell.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    // ---------------------------------------------------------------
    // Storage
    // ---------------------------------------------------------------
    private final String caseDbPath;

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private final TimeWindow timeWindow;
    private final Set<AlertType> alertTypes;
    private final boolean dryRun;
    private final String alertConfigPath;
    private final long detectorTimeoutMs;

    // ---------------------------------------------------------------
    // Scheduling / trigger
    // ---------------------------------------------------------------
    private final long scheduleIntervalMinutes;
    private final int triggerPort;

    // ---------------------------------------------------------------
    // Trending
    // ---------------------------------------------------------------
    private final boolean computeTrending;
    private final int trendingLimit;

    private JobConfig(Builder b) {
        this.caseDbPath = b.caseDbPath;
        this.timeWindow = b.timeWindow;
        this.alertTypes = Collections.unmodifiableSet(EnumSet.copyOf(b.alertTypes));
        this.dryRun = b.dryRun;
        this.alertConfigPath = b.alertConfigPath;
        this.detectorTimeoutMs = b.detectorTimeoutMs;
        this.scheduleIntervalMinutes = b.scheduleIntervalMinutes;
        this.triggerPort = b.triggerPort;
        this.computeTrending = b.computeTrending;
        this.trendingLimit = b.trendingLimit;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from an explicit variable map.
     *
     * @param env variable name to value; missing or blank entries take the
     *            default
     */
    public static JobConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .caseDbPath(value(env, "CASE_DB_PATH", "cases.db"))
                    .timeWindow(TimeWindow.fromWireName(value(env, "TIME_WINDOW", "daily")))
                    .alertTypes(parseAlertTypes(value(env, "ALERT_TYPES", "")))
                    .dryRun(parseBoolean("DRY_RUN", value(env, "DRY_RUN", "false")))
                    .alertConfigPath(value(env, "ALERT_CONFIG_PATH", ""))
                    .detectorTimeoutMs(Long.parseLong(value(env, "DETECTOR_TIMEOUT_MS", "30000")))
                    .scheduleIntervalMinutes(Long.parseLong(value(env, "SCHEDULE_INTERVAL_MINUTES", "0")))
                    .triggerPort(Integer.parseInt(value(env, "TRIGGER_PORT", "8080")))
                    .computeTrending(parseBoolean("COMPUTE_TRENDING", value(env, "COMPUTE_TRENDING", "true")))
                    .trendingLimit(Integer.parseInt(value(env, "TRENDING_LIMIT", "10")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @param raw comma-separated wire names; blank selects every type
     * @throws IllegalArgumentException if a name is not an alert type
     */
    static Set<AlertType> parseAlertTypes(String raw) {
        if (raw == null || raw.isBlank()) {
            return EnumSet.allOf(AlertType.class);
        }
        Set<AlertType> types = new LinkedHashSet<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                types.add(AlertType.fromWireName(part.trim()));
            }
        }
        return types;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getCaseDbPath() {
        return caseDbPath;
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    /**
     * @return selected alert types in declaration order
     */
    public Set<AlertType> getAlertTypes() {
        return alertTypes;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * @return YAML override path, or empty to use the default lookup
     */
    public String getAlertConfigPath() {
        return alertConfigPath;
    }

    public long getDetectorTimeoutMs() {
        return detectorTimeoutMs;
    }

    /**
     * @return minutes between scheduled runs; 0 runs once and exits
     */
    public long getScheduleIntervalMinutes() {
        return scheduleIntervalMinutes;
    }

    public boolean isScheduled() {
        return scheduleIntervalMinutes > 0;
    }

    public int getTriggerPort() {
        return triggerPort;
    }

    public boolean isComputeTrending() {
        return computeTrending;
    }

    public int getTrendingLimit() {
        return trendingLimit;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (timeout &gt; 0, interval &gt;= 0, port in [1, 65535], trending
     * limit &gt; 0, at least one alert type).
     * </p>
     */
    public static class Builder {
        private String caseDbPath = "cases.db";
        private TimeWindow timeWindow = TimeWindow.DAILY;
        private Set<AlertType> alertTypes = EnumSet.allOf(AlertType.class);
        private boolean dryRun = false;
        private String alertConfigPath = "";
        private long detectorTimeoutMs = 30_000;
        private long scheduleIntervalMinutes = 0;
        private int triggerPort = 8080;
        private boolean computeTrending = true;
        private int trendingLimit = 10;

        public Builder caseDbPath(String v) {
            this.caseDbPath = v;
            return this;
        }

        public Builder timeWindow(TimeWindow v) {
            this.timeWindow = v;
            return this;
        }

        public Builder alertTypes(Set<AlertType> v) {
            this.alertTypes = v;
            return this;
        }

        public Builder dryRun(boolean v) {
            this.dryRun = v;
            return this;
        }

        public Builder alertConfigPath(String v) {
            this.alertConfigPath = v;
            return this;
        }

        public Builder detectorTimeoutMs(long v) {
            this.detectorTimeoutMs = v;
            return this;
        }

        public Builder scheduleIntervalMinutes(long v) {
            this.scheduleIntervalMinutes = v;
            return this;
        }

        public Builder triggerPort(int v) {
            this.triggerPort = v;
            return this;
        }

        public Builder computeTrending(boolean v) {
            this.computeTrending = v;
            return this;
        }

        public Builder trendingLimit(int v) {
            this.trendingLimit = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(caseDbPath, "caseDbPath");
            Objects.requireNonNull(timeWindow, "timeWindow required");
            Objects.requireNonNull(alertTypes, "alertTypes required");
            Objects.requireNonNull(alertConfigPath, "alertConfigPath required");

            if (alertTypes.isEmpty()) {
                throw new IllegalArgumentException("At least one alert type must be selected");
            }
            if (detectorTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "detectorTimeoutMs must be >= 1, got: " + detectorTimeoutMs);
            }
            if (scheduleIntervalMinutes < 0) {
                throw new IllegalArgumentException(
                        "scheduleIntervalMinutes must be >= 0, got: " + scheduleIntervalMinutes);
            }
            if (triggerPort < 1 || triggerPort > 65_535) {
                throw new IllegalArgumentException(
                        "triggerPort must be in [1, 65535], got: " + triggerPort);
            }
            if (trendingLimit < 1) {
                throw new IllegalArgumentException("trendingLimit must be >= 1, got: " + trendingLimit);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static boolean parseBoolean(String name, String raw) {
        String v = raw.toLowerCase(Locale.ROOT);
        if (v.equals("true") || v.equals("1") || v.equals("yes")) {
            return true;
        }
        if (v.equals("false") || v.equals("0") || v.equals("no")) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be a boolean, got: '" + raw + "'");
    }

    @Override
    public String toString() {
        List<String> types = new ArrayList<>();
        alertTypes.forEach(t -> types.add(t.wireName()));
        return "JobConfig{" +
                "caseDbPath='" + caseDbPath + '\'' +
                ", timeWindow=" + timeWindow.wireName() +
                ", alertTypes=" + types +
                ", dryRun=" + dryRun +
                ", alertConfigPath='" + alertConfigPath + '\'' +
                ", detectorTimeoutMs=" + detectorTimeoutMs +
                ", scheduleIntervalMinutes=" + scheduleIntervalMinutes +
                ", triggerPort=" + triggerPort +
                ", computeTrending=" + computeTrending +
                ", trendingLimit=" + trendingLimit +
                '}';
    }
}
