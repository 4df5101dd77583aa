package org.javai.gateway.mapping.anomaly;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.ModelType;
import org.javai.gateway.mapping.AbstractDataMapper;
import org.javai.gateway.mapping.MappingOptions;
import org.javai.gateway.mapping.MappingResult;
import org.javai.gateway.mapping.RiskLevel;

import java.time.Clock;
import java.time.Duration;

/**
 * Maps anomaly detection. Options: {@value #DETECTION_METHOD} (default ensemble),
 * {@value #SENSITIVITY_LEVEL} (default medium), {@value #WINDOW_SIZE} (default 100),
 * {@value #THRESHOLD_PERCENTILE} (default 95).
 */
public final class AnomalyMapper extends AbstractDataMapper<AnomalyInput, AnomalyReport> {

    public static final String DETECTION_METHOD = "detectionMethod";
    public static final String SENSITIVITY_LEVEL = "sensitivityLevel";
    public static final String WINDOW_SIZE = "windowSize";
    public static final String THRESHOLD_PERCENTILE = "thresholdPercentile";
    public static final String DEFAULT_DETECTION_METHOD = "ensemble";
    static final int MIN_DATA_POINTS = 50;

    public AnomalyMapper() {
        this(Clock.systemUTC());
    }

    public AnomalyMapper(Clock clock) {
        super(ModelType.ANOMALY, AnomalyReport.class, clock);
    }

    @Override
    public MappingResult validateInternal(AnomalyInput input) {
        return MappingResult.collector()
                .errorIf(isBlank(input.organizationId()), "Organization ID is required")
                .warnIf(input.metrics() == null, "Metrics data is missing")
                .warnIf(input.dataPoints() == null || input.dataPoints().size() < MIN_DATA_POINTS,
                        "Insufficient data points for anomaly detection")
                .result();
    }

    @Override
    protected ObjectNode buildRequest(AnomalyInput input, MappingOptions options) {
        ObjectNode request = JSON.objectNode();
        request.put("organization_id", input.organizationId());

        ObjectNode series = request.putObject("time_series_data");
        series.set("metrics", textArray(input.metrics()));
        series.set("data_points", numberArray(input.dataPoints()));
        series.put("sampling_frequency", or(input.samplingFrequency(), "hourly"));

        ObjectNode system = request.putObject("system_data");
        system.set("error_rates", numberArray(input.errorRates()));
        system.set("response_times", numberArray(input.responseTimes()));

        ObjectNode detection = request.putObject("detection_options");
        detection.put("sensitivity_level", options.text(SENSITIVITY_LEVEL, "medium"));
        detection.put("detection_method", options.text(DETECTION_METHOD, DEFAULT_DETECTION_METHOD));
        detection.put("window_size", options.integer(WINDOW_SIZE, 100));
        detection.put("threshold_percentile", options.integer(THRESHOLD_PERCENTILE, 95));
        detection.put("include_forecasting", true);
        return request;
    }

    @Override
    protected AnomalyReport readResult(JsonNode data, MappingOptions options) {
        String requestedMethod = text(data.path("detection_options"), "detection_method",
                options.text(DETECTION_METHOD, DEFAULT_DETECTION_METHOD));
        return new AnomalyReport(
                text(data, "organization_id", null),
                integer(data, "anomalies_detected", 0),
                number(data, "overall_score", 0),
                number(data, "confidence", 0.7),
                text(data, "detection_method", requestedMethod),
                objects(data, "anomalies", node -> new Anomaly(
                        text(node, "timestamp", null),
                        text(node, "metric", "unknown"),
                        number(node, "value", 0),
                        RiskLevel.fromLabel(text(node, "severity", null), RiskLevel.MEDIUM),
                        number(node, "confidence", 0.7),
                        text(node, "description", ""),
                        texts(node, "possible_causes"))),
                texts(data.path("insights"), "root_causes"),
                texts(data, "recommendations"),
                metadata(data, "detection_date"));
    }

    @Override
    protected void checkResponse(JsonNode data, MappingResult.Collector findings) {
        findings.errorIf(!data.path("anomalies_detected").isNumber(), "Anomalies detected count is missing or invalid");
    }

    @Override
    public String cacheKey(AnomalyInput input, MappingOptions options) {
        String method = options.text(DETECTION_METHOD, DEFAULT_DETECTION_METHOD);
        return "anomaly_" + input.organizationId() + "_" + method + "_" + bucket(Duration.ofHours(6));
    }
}
