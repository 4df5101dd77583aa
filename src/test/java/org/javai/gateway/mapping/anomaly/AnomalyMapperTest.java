package org.javai.gateway.mapping.anomaly;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.MutableClock;
import org.javai.gateway.mapping.MappingException;
import org.javai.gateway.mapping.MappingOptions;
import org.javai.gateway.mapping.RiskLevel;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AnomalyMapperTest {

    private final ObjectMapper json = new ObjectMapper();
    private final MutableClock clock = MutableClock.at("2024-07-01T00:00:00Z");
    private final AnomalyMapper mapper = new AnomalyMapper(clock);

    @Test
    void toExternal_defaultsDetectionSettings() {
        AnomalyInput input = new AnomalyInput("org-5", List.of("cpu"), List.of(0.4, 0.9), null, null, List.of(120.0));

        ObjectNode request = mapper.toExternal(input, MappingOptions.none());

        assertThat(request.at("/time_series_data/sampling_frequency").asText()).isEqualTo("hourly");
        assertThat(request.at("/time_series_data/data_points").size()).isEqualTo(2);
        assertThat(request.at("/system_data/error_rates").size()).isZero();
        assertThat(request.at("/system_data/response_times/0").asDouble()).isEqualTo(120.0);
        assertThat(request.at("/detection_options/detection_method").asText()).isEqualTo("ensemble");
        assertThat(request.at("/detection_options/window_size").asInt()).isEqualTo(100);
        assertThat(request.at("/detection_options/threshold_percentile").asInt()).isEqualTo(95);
    }

    @Test
    void validateInternal_warnsOnTooFewPoints() {
        assertThat(mapper.validateInternal(new AnomalyInput("org-5", null, null, null, null, null)).warnings())
                .containsExactly("Metrics data is missing", "Insufficient data points for anomaly detection");
        assertThatThrownBy(() -> mapper.toExternal(new AnomalyInput(null, null, null, null, null, null),
                MappingOptions.none()))
                .isInstanceOf(MappingException.class);
    }

    @Test
    void fromExternal_parsesSeverityLeniently() throws Exception {
        AnomalyReport report = mapper.fromExternal(json.readTree("""
                {"anomalies_detected": 2,
                 "overall_score": 0.64,
                 "anomalies": [
                   {"metric": "cpu", "value": 0.98, "severity": "HIGH", "possible_causes": ["runaway job"]},
                   {"metric": "latency", "value": 900, "severity": "extreme"}
                 ],
                 "insights": {"root_causes": ["batch window overlap"]}}
                """), MappingOptions.of(AnomalyMapper.DETECTION_METHOD, "isolation_forest"));

        assertThat(report.anomaliesDetected()).isEqualTo(2);
        assertThat(report.detectionMethod()).isEqualTo("isolation_forest");
        assertThat(report.anomalies()).extracting(Anomaly::severity).containsExactly(RiskLevel.HIGH, RiskLevel.MEDIUM);
        assertThat(report.anomalies().get(0).possibleCauses()).containsExactly("runaway job");
        assertThat(report.rootCauses()).containsExactly("batch window overlap");
        assertThat(report.confidence()).isEqualTo(0.7);
    }

    @Test
    void validateExternal_requiresAnomalyCount() throws Exception {
        assertThat(mapper.validateExternal(json.readTree("{\"anomalies\": []}")).errors())
                .containsExactly("Anomalies detected count is missing or invalid");
    }

    @Test
    void cacheKey_bucketsBySixHours() {
        AnomalyInput input = new AnomalyInput("org-5", null, null, null, null, null);
        String key = mapper.cacheKey(input, MappingOptions.none());

        assertThat(key).startsWith("anomaly_org-5_ensemble_");
        clock.advance(Duration.ofHours(5));
        assertThat(mapper.cacheKey(input, MappingOptions.none())).isEqualTo(key);
        clock.advance(Duration.ofHours(1));
        assertThat(mapper.cacheKey(input, MappingOptions.none())).isNotEqualTo(key);
    }

    @Test
    void roundTrip_preservesOrganizationAndDetectionMethod() {
        AnomalyInput input = new AnomalyInput("org-5", List.of("cpu"), List.of(0.4, 0.9), null, null, null);
        MappingOptions options = MappingOptions.of(AnomalyMapper.DETECTION_METHOD, "isolation_forest");

        AnomalyReport echoed = mapper.fromExternal(mapper.toExternal(input, options), MappingOptions.none());

        assertThat(echoed.organizationId()).isEqualTo("org-5");
        assertThat(echoed.detectionMethod()).isEqualTo("isolation_forest");
    }
}
