package org.javai.gateway.mapping.anomaly;

import java.util.List;

/**
 * Time series to scan for anomalies. Detection needs fifty or more data points to be reliable.
 *
 * @param samplingFrequency {@code hourly} when null
 */
public record AnomalyInput(
        String organizationId,
        List<String> metrics,
        List<Double> dataPoints,
        String samplingFrequency,
        List<Double> errorRates,
        List<Double> responseTimes
) {

    public AnomalyInput {
        metrics = metrics == null ? null : List.copyOf(metrics);
        dataPoints = dataPoints == null ? null : List.copyOf(dataPoints);
        errorRates = errorRates == null ? null : List.copyOf(errorRates);
        responseTimes = responseTimes == null ? null : List.copyOf(responseTimes);
    }
}
