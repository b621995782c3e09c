package com.bridgesentinel.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Custom Micrometer metric definitions for Bridge Sentinel.
 * <p>
 * The registry decides where the meters go; by default an in-process
 * {@link SimpleMeterRegistry}. {@link #snapshot()} renders every meter for the
 * health server's {@code /metrics} endpoint and the jobs' final summary.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code sentinel_records_scored_total}: records that received an outcome</li>
 *   <li>{@code sentinel_anomalies_flagged_total}: outcomes labelled anomalous</li>
 *   <li>{@code sentinel_reconnect_attempts_total}: store reconnect attempts</li>
 *   <li>{@code sentinel_cycle_failures_total}: abandoned scoring cycles</li>
 *   <li>{@code sentinel_cycle_duration}: time per scoring cycle that found work</li>
 *   <li>{@code sentinel_replay_inserted_total} / {@code sentinel_replay_failed_total}:
 *   feed producer insertions</li>
 * </ul>
 */
public class PipelineMetrics {

    private final MeterRegistry registry;
    private final Counter recordsScored;
    private final Counter anomaliesFlagged;
    private final Counter reconnectAttempts;
    private final Counter cycleFailures;
    private final Timer cycleDuration;
    private final Counter replayInserted;
    private final Counter replayFailed;

    public PipelineMetrics() {
        this(new SimpleMeterRegistry());
    }

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.recordsScored = registry.counter("sentinel_records_scored_total");
        this.anomaliesFlagged = registry.counter("sentinel_anomalies_flagged_total");
        this.reconnectAttempts = registry.counter("sentinel_reconnect_attempts_total");
        this.cycleFailures = registry.counter("sentinel_cycle_failures_total");
        this.cycleDuration = Timer.builder("sentinel_cycle_duration")
                .description("Time to score and persist one batch")
                .register(registry);
        this.replayInserted = registry.counter("sentinel_replay_inserted_total");
        this.replayFailed = registry.counter("sentinel_replay_failed_total");
    }

    public void recordBatch(int scored, int anomalies, Duration elapsed) {
        recordsScored.increment(scored);
        anomaliesFlagged.increment(anomalies);
        cycleDuration.record(elapsed);
    }

    public void incrementReconnectAttempts() {
        reconnectAttempts.increment();
    }

    public void incrementCycleFailures() {
        cycleFailures.increment();
    }

    public void incrementReplayInserted() {
        replayInserted.increment();
    }

    public void incrementReplayFailed() {
        replayFailed.increment();
    }

    /**
     * @return meter name to statistic ({@code count}, {@code total_time},
     *         {@code max}) to current value, sorted by name
     */
    public Map<String, Map<String, Double>> snapshot() {
        Map<String, Map<String, Double>> meters = new TreeMap<>();
        for (Meter meter : registry.getMeters()) {
            Map<String, Double> values = new TreeMap<>();
            for (Measurement measurement : meter.measure()) {
                values.put(measurement.getStatistic().name().toLowerCase(Locale.ROOT), measurement.getValue());
            }
            meters.put(meter.getId().getName(), values);
        }
        return meters;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
