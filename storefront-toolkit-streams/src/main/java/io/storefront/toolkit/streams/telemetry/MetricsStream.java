package io.storefront.toolkit.streams.telemetry;

import io.storefront.toolkit.core.id.EventIds;
import io.storefront.toolkit.streams.channel.StreamChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Publishes metric samples and keeps the latest {@code maxPerType} samples of each type.
 */
public class MetricsStream {
    private static final Logger logger = LoggerFactory.getLogger(MetricsStream.class);

    public static final int DEFAULT_MAX_PER_TYPE = 100;

    private final int maxPerType;
    private final Clock clock;
    private final StreamChannel<Metric> metrics = new StreamChannel<>("metrics");

    // Guarded by history
    private final Map<String, Deque<Metric>> history = new LinkedHashMap<>();

    public MetricsStream(Clock clock) {
        this(DEFAULT_MAX_PER_TYPE, clock);
    }

    public MetricsStream(int maxPerType, Clock clock) {
        if (maxPerType < 1) {
            throw new IllegalArgumentException("maxPerType must be >= 1, got: " + maxPerType);
        }
        this.maxPerType = maxPerType;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public StreamChannel<Metric> metrics() {
        return metrics;
    }

    public Metric recordMetric(String type, double value) {
        return recordMetric(type, value, Map.of());
    }

    public Metric recordMetric(String type, double value, Map<String, String> tags) {
        Objects.requireNonNull(type, "type cannot be null");
        Metric metric = new Metric(type, value, tags, clock.instant(), EventIds.next());
        metrics.emit(metric);

        synchronized (history) {
            Deque<Metric> samples = history.computeIfAbsent(type, t -> new ArrayDeque<>());
            samples.addLast(metric);
            if (samples.size() > maxPerType) {
                samples.removeFirst();
            }
        }
        logger.trace("Recorded metric {}={} {}", type, value, metric.tags());
        return metric;
    }

    /**
     * @return retained samples of {@code type}, oldest first; empty if none
     */
    public List<Metric> getMetricsByType(String type) {
        synchronized (history) {
            Deque<Metric> samples = history.get(type);
            return samples == null ? List.of() : new ArrayList<>(samples);
        }
    }

    public Map<String, List<Metric>> getAllMetrics() {
        synchronized (history) {
            Map<String, List<Metric>> copy = new LinkedHashMap<>();
            history.forEach((type, samples) -> copy.put(type, new ArrayList<>(samples)));
            return copy;
        }
    }
}
