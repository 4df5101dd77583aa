package org.javai.gateway.mapping.churn;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.MutableClock;
import org.javai.gateway.mapping.DataQuality;
import org.javai.gateway.mapping.MappingException;
import org.javai.gateway.mapping.MappingOptions;
import org.javai.gateway.mapping.MappingResult;
import org.javai.gateway.mapping.RiskLevel;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ChurnMapperTest {

    private final ObjectMapper json = new ObjectMapper();
    private final MutableClock clock = MutableClock.at("2024-03-01T10:00:00Z");
    private final ChurnMapper mapper = new ChurnMapper(clock);

    @Test
    void toExternal_fillsDefaultsForMissingFields() {
        ObjectNode request = mapper.toExternal(ChurnInput.builder("client-42").build(), MappingOptions.none());

        assertThat(request.path("client_id").asText()).isEqualTo("client-42");
        assertThat(request.at("/behavior_metrics/engagement_score").asDouble()).isEqualTo(0.7);
        assertThat(request.at("/behavior_metrics/support_ticket_volume").asInt()).isZero();
        assertThat(request.at("/financial_metrics/payment_history").asText()).isEqualTo("good");
        assertThat(request.at("/financial_metrics/revenue_trend").asText()).isEqualTo("stable");
        assertThat(request.at("/service_metrics/sla_compliance").asDouble()).isEqualTo(0.95);
        assertThat(request.at("/relationship_metrics/relationship_duration").asInt()).isEqualTo(12);
        assertThat(request.at("/prediction_options/prediction_horizon").asInt()).isEqualTo(90);
        assertThat(request.at("/prediction_options/include_risk_factors").asBoolean()).isTrue();
    }

    @Test
    void toExternal_keepsSuppliedValuesAndOptions() {
        ChurnInput input = ChurnInput.builder("client-42")
                .engagementScore(0.2)
                .paymentHistory("late")
                .ticketCount(14)
                .build();

        ObjectNode request = mapper.toExternal(input, MappingOptions.of(ChurnMapper.PREDICTION_HORIZON, 30)
                .with(ChurnMapper.INCLUDE_RETENTION_STRATEGIES, false));

        assertThat(request.at("/behavior_metrics/engagement_score").asDouble()).isEqualTo(0.2);
        assertThat(request.at("/financial_metrics/payment_history").asText()).isEqualTo("late");
        assertThat(request.at("/behavior_metrics/support_ticket_volume").asInt()).isEqualTo(14);
        assertThat(request.at("/prediction_options/prediction_horizon").asInt()).isEqualTo(30);
        assertThat(request.at("/prediction_options/include_retention_strategies").asBoolean()).isFalse();
    }

    @Test
    void toExternal_missingClientIdFailsLoud() {
        assertThatThrownBy(() -> mapper.toExternal(ChurnInput.builder(" ").build(), MappingOptions.none()))
                .isInstanceOf(MappingException.class)
                .hasMessageContaining("Client ID is required");
    }

    @Test
    void validateInternal_gradesDataQualityByWarnings() {
        MappingResult sparse = mapper.validateInternal(ChurnInput.builder("c").build());
        MappingResult degraded = mapper.validateInternal(ChurnInput.builder("c")
                .slaCompliance(1.4)
                .ticketCount(-1)
                .build());
        MappingResult complete = mapper.validateInternal(ChurnInput.builder("c")
                .engagementScore(0.5)
                .paymentHistory("good")
                .build());

        assertThat(sparse.isValid()).isTrue();
        assertThat(sparse.dataQuality()).isEqualTo(DataQuality.GOOD);
        assertThat(degraded.warnings()).hasSize(4);
        assertThat(degraded.dataQuality()).isEqualTo(DataQuality.POOR);
        assertThat(complete.dataQuality()).isEqualTo(DataQuality.EXCELLENT);
    }

    @Test
    void fromExternal_readsEnvelopedResponse() throws Exception {
        JsonNode response = json.readTree("""
                {"data": {
                  "client_id": "client-42",
                  "churn_probability": 0.72,
                  "confidence": 0.81,
                  "time_to_churn": 45,
                  "risk_factors": [
                    {"factor": "payment_delays", "impact": "high", "severity": "high", "actionable": false},
                    "low_engagement"
                  ],
                  "retention_recommendations": ["Schedule an executive review"],
                  "interventions": {"immediate": ["Call the account owner"]},
                  "insights": {"primary_drivers": ["billing disputes"], "protective_factors": []},
                  "model_version": "v2.3",
                  "prediction_date": "2024-02-29T08:00:00Z"
                }}
                """);

        ChurnPrediction prediction = mapper.fromExternal(response, MappingOptions.none());

        assertThat(prediction.clientId()).isEqualTo("client-42");
        assertThat(prediction.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(prediction.timeToChurnDays()).isEqualTo(45);
        assertThat(prediction.predictionHorizon()).isEqualTo(90);
        assertThat(prediction.riskFactors()).extracting(ChurnRiskFactor::factor)
                .containsExactly("payment_delays", "low_engagement");
        assertThat(prediction.riskFactors().get(0).actionable()).isFalse();
        assertThat(prediction.retentionStrategies().get(0).description()).isEqualTo("Schedule an executive review");
        assertThat(prediction.retentionStrategies().get(0).priority()).isEqualTo("medium");
        assertThat(prediction.immediateInterventions()).containsExactly("Call the account owner");
        assertThat(prediction.primaryRiskDrivers()).containsExactly("billing disputes");
        assertThat(prediction.metadata().modelVersion()).isEqualTo("v2.3");
        assertThat(prediction.metadata().generatedAt()).isEqualTo("2024-02-29T08:00:00Z");
    }

    @Test
    void fromExternal_defaultsEverythingMissing() throws Exception {
        ChurnPrediction prediction = mapper.fromExternal(json.readTree("{\"churn_probability\": 0.1}"),
                MappingOptions.of(ChurnMapper.PREDICTION_HORIZON, 60));

        assertThat(prediction.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(prediction.timeToChurnDays()).isNull();
        assertThat(prediction.predictionHorizon()).isEqualTo(60);
        assertThat(prediction.riskFactors()).isEmpty();
        assertThat(prediction.metadata().modelVersion()).isEqualTo("v1.0");
        assertThat(prediction.metadata().generatedAt()).isEqualTo("2024-03-01T10:00:00Z");
        assertThat(prediction.metadata().fallback()).isFalse();
    }

    @Test
    void riskLevelFor_usesThresholds() {
        assertThat(ChurnMapper.riskLevelFor(0.29)).isEqualTo(RiskLevel.LOW);
        assertThat(ChurnMapper.riskLevelFor(0.3)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(ChurnMapper.riskLevelFor(0.5)).isEqualTo(RiskLevel.HIGH);
        assertThat(ChurnMapper.riskLevelFor(0.7)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void validateExternal_rejectsMissingOrOutOfRangeProbability() throws Exception {
        assertThat(mapper.validateExternal(json.readTree("{\"data\": {\"churn_probability\": 0.4}}")).isValid())
                .isTrue();
        assertThat(mapper.validateExternal(json.readTree("{\"churn_probability\": 1.3}")).errors())
                .containsExactly("Churn probability is out of valid range (0-1)");
        assertThat(mapper.validateExternal(json.readTree("{\"confidence\": 0.9}")).errors())
                .containsExactly("Churn probability is missing or invalid");
        assertThat(mapper.validateExternal(null).errors()).containsExactly("Response is null");
    }

    @Test
    void cacheKey_isStableWithinADay() {
        ChurnInput input = ChurnInput.builder("client-42").build();
        String first = mapper.cacheKey(input, MappingOptions.none());

        clock.advance(Duration.ofHours(1));
        String sameDay = mapper.cacheKey(input, MappingOptions.none());
        clock.advance(Duration.ofDays(1));
        String nextDay = mapper.cacheKey(input, MappingOptions.none());

        assertThat(first).startsWith("churn_client-42_90_").isEqualTo(sameDay);
        assertThat(nextDay).isNotEqualTo(first);
        assertThat(mapper.cacheKey(input, MappingOptions.of(ChurnMapper.PREDICTION_HORIZON, 30)))
                .isNotEqualTo(first);
    }

    @Test
    void roundTrip_preservesClientAndHorizon() {
        ChurnInput input = ChurnInput.builder("client-42").engagementScore(0.4).build();
        MappingOptions options = MappingOptions.of(ChurnMapper.PREDICTION_HORIZON, 30);

        ChurnPrediction echoed = mapper.fromExternal(mapper.toExternal(input, options), MappingOptions.none());

        assertThat(echoed.clientId()).isEqualTo("client-42");
        assertThat(echoed.predictionHorizon()).isEqualTo(30);
    }
}
