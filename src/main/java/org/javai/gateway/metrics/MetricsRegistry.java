package org.javai.gateway.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every gateway metric. Callers record observations against a {@link GatewayMetric} and a
 * label set; they never create meters themselves.
 *
 * <p>Two views are exposed: the cumulative Micrometer registry, scraped in Prometheus text
 * format by {@link #scrape()}, and the trailing-window {@link #performanceSummary()} kept by a
 * {@link PerformanceTracker}. {@link #summaryJson()} combines both.
 *
 * <pre>{@code
 * metrics.increment(GatewayMetric.REQUESTS, Map.of("model_type", "churn", "operation", "predict", "status", "success"));
 * metrics.observeDuration(GatewayMetric.REQUEST_DURATION, labels, 0.42);
 * metrics.set(GatewayMetric.CIRCUIT_BREAKER_STATE, Map.of("breaker", "prediction-service"), 1);
 * }</pre>
 */
public final class MetricsRegistry {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final PerformanceTracker tracker;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ConcurrentMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MetricsRegistry() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), new PerformanceTracker());
    }

    public MetricsRegistry(PerformanceTracker tracker) {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), tracker);
    }

    public MetricsRegistry(PrometheusMeterRegistry registry, PerformanceTracker tracker) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
    }

    /**
     * Records a duration into a histogram metric.
     */
    public void observeDuration(GatewayMetric metric, Map<String, String> labels, double seconds) {
        Tags tags = tagsFor(metric, MetricKind.HISTOGRAM, labels);
        if (seconds < 0 || Double.isNaN(seconds)) {
            throw new IllegalArgumentException("seconds must be >= 0, was: " + seconds);
        }
        Timer.builder(metric.metricName())
                .description(metric.description())
                .tags(tags)
                .serviceLevelObjectives(GatewayMetric.DURATION_BUCKETS.toArray(new Duration[0]))
                .register(registry)
                .record(Duration.ofNanos((long) (seconds * 1_000_000_000L)));
    }

    public void increment(GatewayMetric metric, Map<String, String> labels) {
        increment(metric, labels, 1.0);
    }

    /**
     * Adds to a counter metric.
     */
    public void increment(GatewayMetric metric, Map<String, String> labels, double amount) {
        Tags tags = tagsFor(metric, MetricKind.COUNTER, labels);
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0, was: " + amount);
        }
        Counter.builder(metric.metricName())
                .description(metric.description())
                .tags(tags)
                .register(registry)
                .increment(amount);
    }

    /**
     * Sets a gauge metric. The first call for a label set registers the gauge.
     */
    public void set(GatewayMetric metric, Map<String, String> labels, double value) {
        Tags tags = tagsFor(metric, MetricKind.GAUGE, labels);
        AtomicLong holder = gauges.computeIfAbsent(gaugeKey(metric, tags), key -> {
            AtomicLong bits = new AtomicLong(Double.doubleToLongBits(0.0));
            Gauge.builder(metric.metricName(), bits, b -> Double.longBitsToDouble(b.get()))
                    .description(metric.description())
                    .tags(tags)
                    .register(registry);
            return bits;
        });
        holder.set(Double.doubleToLongBits(value));
    }

    /**
     * @return the current count of a counter, 0 if it has never been incremented
     */
    public double count(GatewayMetric metric, Map<String, String> labels) {
        Tags tags = tagsFor(metric, MetricKind.COUNTER, labels);
        Counter counter = registry.find(metric.metricName()).tags(tags).counter();
        return counter == null ? 0.0 : counter.count();
    }

    /**
     * @return the current value of a gauge, or empty if it has never been set
     */
    public Optional<Double> gaugeValue(GatewayMetric metric, Map<String, String> labels) {
        Tags tags = tagsFor(metric, MetricKind.GAUGE, labels);
        AtomicLong holder = gauges.get(gaugeKey(metric, tags));
        return holder == null ? Optional.empty() : Optional.of(Double.longBitsToDouble(holder.get()));
    }

    /**
     * @return how many durations a histogram has recorded
     */
    public long observations(GatewayMetric metric, Map<String, String> labels) {
        Tags tags = tagsFor(metric, MetricKind.HISTOGRAM, labels);
        Timer timer = registry.find(metric.metricName()).tags(tags).timer();
        return timer == null ? 0 : timer.count();
    }

    public void startRequest(String id, Map<String, String> metadata) {
        tracker.startRequest(id, metadata);
    }

    public Optional<Duration> endRequest(String id, RequestOutcome outcome) {
        return tracker.endRequest(id, outcome);
    }

    public PerformanceSummary performanceSummary() {
        return tracker.summary();
    }

    /**
     * Schedules {@link PerformanceTracker#cleanup()} at a fixed rate.
     *
     * @return the scheduled task, cancel it to stop cleaning up
     */
    public ScheduledFuture<?> startCleanup(ScheduledExecutorService scheduler, Duration interval) {
        Objects.requireNonNull(scheduler, "scheduler must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        return scheduler.scheduleAtFixedRate(tracker::cleanup, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * @return every meter in Prometheus text exposition format
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * @return {@code {"metrics": [...], "performance": {...}, "timestamp": "..."}}
     */
    public String summaryJson() {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode meters = root.putArray("metrics");
        registry.getMeters().stream()
                .sorted(Comparator.comparing((Meter m) -> m.getId().getName()))
                .forEach(meter -> meters.add(meterJson(meter)));
        root.set("performance", performanceJson(tracker.summary()));
        root.put("timestamp", Instant.now().toString());
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize metrics summary", e);
            throw new IllegalStateException("Could not serialize metrics summary", e);
        }
    }

    /**
     * @return the underlying registry, for binding additional meters
     */
    public MeterRegistry meterRegistry() {
        return registry;
    }

    private ObjectNode meterJson(Meter meter) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", meter.getId().getName());
        node.put("type", meter.getId().getType().name().toLowerCase());
        ObjectNode labels = node.putObject("labels");
        for (Tag tag : meter.getId().getTagsAsIterable()) {
            labels.put(tag.getKey(), tag.getValue());
        }
        ObjectNode values = node.putObject("values");
        for (Measurement measurement : meter.measure()) {
            values.put(measurement.getStatistic().name().toLowerCase(), measurement.getValue());
        }
        return node;
    }

    private ObjectNode performanceJson(PerformanceSummary summary) {
        ObjectNode node = mapper.createObjectNode();
        node.put("totalRequests", summary.totalRequests());
        node.put("avgDuration", summary.averageDurationMillis());
        node.put("errorCount", summary.errorCount());
        node.put("errorRate", summary.errorRatePercent());
        node.put("activeRequests", summary.activeRequests());
        node.put("p50", summary.p50Millis());
        node.put("p90", summary.p90Millis());
        node.put("p95", summary.p95Millis());
        node.put("p99", summary.p99Millis());
        node.put("timestamp", summary.timestamp().toString());
        return node;
    }

    private static Tags tagsFor(GatewayMetric metric, MetricKind expected, Map<String, String> labels) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        if (metric.kind() != expected) {
            throw new IllegalArgumentException(metric + " is a " + metric.kind() + ", not a " + expected);
        }
        if (!metric.labelNames().equals(labels.keySet())) {
            throw new IllegalArgumentException(metric + " expects labels " + metric.labelNames() + ", got " + labels.keySet());
        }
        Tags tags = Tags.empty();
        for (Map.Entry<String, String> label : new TreeMap<>(labels).entrySet()) {
            tags = tags.and(label.getKey(), label.getValue() == null ? "none" : label.getValue());
        }
        return tags;
    }

    private static String gaugeKey(GatewayMetric metric, Tags tags) {
        StringBuilder key = new StringBuilder(metric.name());
        tags.forEach(tag -> key.append('|').append(tag.getKey()).append('=').append(tag.getValue()));
        return key.toString();
    }
}
