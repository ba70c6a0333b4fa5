package com.casesentinel.job;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the alert job.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code case_sentinel.detector.runs}: counter, tags {@code detector},
 *   {@code outcome=success|failure}</li>
 *   <li>{@code case_sentinel.detector.duration}: timer, tag
 *   {@code detector}</li>
 *   <li>{@code case_sentinel.alerts.written}: counter, tag
 *   {@code detector}</li>
 *   <li>{@code case_sentinel.trending.topics.written}: counter</li>
 * </ul>
 *
 * <p>
 * {@link #snapshot()} renders every registered meter for the
 * {@code GET /metrics} endpoint of {@link TriggerServer}.
 * </p>
 */
public class JobMetrics {

    static final String RUNS = "case_sentinel.detector.runs";
    static final String DURATION = "case_sentinel.detector.duration";
    static final String ALERTS_WRITTEN = "case_sentinel.alerts.written";
    static final String TOPICS_WRITTEN = "case_sentinel.trending.topics.written";

    private final MeterRegistry registry;
    private final Counter topicsWritten;

    public JobMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.topicsWritten = Counter.builder(TOPICS_WRITTEN)
                .description("Trending topics appended to the store")
                .register(registry);
    }

    public void recordSuccess(String detector, long durationMs) {
        runs(detector, "success").increment();
        duration(detector).record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordFailure(String detector, long durationMs) {
        runs(detector, "failure").increment();
        duration(detector).record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordAlertsWritten(String detector, int count) {
        Counter.builder(ALERTS_WRITTEN)
                .description("Alerts appended to the store")
                .tag("detector", detector)
                .register(registry)
                .increment(count);
    }

    public void recordTopicsWritten(int count) {
        topicsWritten.increment(count);
    }

    /**
     * Current value of every meter, sorted by name and tags.
     *
     * @return one entry per meter with {@code name}, {@code type},
     *         {@code tags} and {@code measurements} (statistic to value)
     */
    public List<Map<String, Object>> snapshot() {
        List<Meter> meters = new ArrayList<>(registry.getMeters());
        meters.sort(Comparator.comparing((Meter m) -> m.getId().getName())
                .thenComparing(m -> m.getId().getTags().toString()));

        List<Map<String, Object>> result = new ArrayList<>();
        for (Meter meter : meters) {
            Map<String, String> tags = new LinkedHashMap<>();
            for (Tag tag : meter.getId().getTags()) {
                tags.put(tag.getKey(), tag.getValue());
            }
            Map<String, Double> measurements = new LinkedHashMap<>();
            for (Measurement measurement : meter.measure()) {
                measurements.put(measurement.getStatistic().getTagValueRepresentation(), measurement.getValue());
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", meter.getId().getName());
            entry.put("type", meter.getId().getType().name().toLowerCase(Locale.ROOT));
            entry.put("tags", tags);
            entry.put("measurements", measurements);
            result.add(entry);
        }
        return result;
    }

    private Counter runs(String detector, String outcome) {
        return Counter.builder(RUNS)
                .description("Detector invocations")
                .tag("detector", detector)
                .tag("outcome", outcome)
                .register(registry);
    }

    private Timer duration(String detector) {
        return Timer.builder(DURATION)
                .description("Detector wall-clock time")
                .tag("detector", detector)
                .register(registry);
    }
}
