package org.javai.gateway.metrics;

/**
 * How observations of a metric are recorded.
 */
public enum MetricKind {
    COUNTER,
    HISTOGRAM,
    GAUGE
}
