package org.javai.gateway.mapping.churn;

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
 * Maps churn predictions.
 *
 * <p>Options: {@value #PREDICTION_HORIZON} (days, default 90), {@value #INCLUDE_RISK_FACTORS}
 * and {@value #INCLUDE_RETENTION_STRATEGIES} (default true).
 */
public final class ChurnMapper extends AbstractDataMapper<ChurnInput, ChurnPrediction> {

    public static final String PREDICTION_HORIZON = "predictionHorizon";
    public static final String INCLUDE_RISK_FACTORS = "includeRiskFactors";
    public static final String INCLUDE_RETENTION_STRATEGIES = "includeRetentionStrategies";
    public static final int DEFAULT_PREDICTION_HORIZON = 90;

    public ChurnMapper() {
        this(Clock.systemUTC());
    }

    public ChurnMapper(Clock clock) {
        super(ModelType.CHURN, ChurnPrediction.class, clock);
    }

    public static RiskLevel riskLevelFor(double probability) {
        if (probability >= 0.7) {
            return RiskLevel.CRITICAL;
        }
        if (probability >= 0.5) {
            return RiskLevel.HIGH;
        }
        if (probability >= 0.3) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    @Override
    public MappingResult validateInternal(ChurnInput input) {
        return MappingResult.collector()
                .errorIf(isBlank(input.clientId()), "Client ID is required")
                .warnIf(input.engagementScore() == null, "Engagement score is missing, default 0.7 applied")
                .warnIf(input.paymentHistory() == null, "Payment history is missing, default 'good' applied")
                .warnIf(input.ticketCount() != null && input.ticketCount() < 0, "Ticket count cannot be negative")
                .warnIf(input.slaCompliance() != null && (input.slaCompliance() < 0 || input.slaCompliance() > 1),
                        "SLA compliance should be between 0 and 1")
                .warnIf(input.relationshipDuration() != null && input.relationshipDuration() < 0,
                        "Relationship duration cannot be negative")
                .result();
    }

    @Override
    protected ObjectNode buildRequest(ChurnInput input, MappingOptions options) {
        ObjectNode request = JSON.objectNode();
        request.put("client_id", input.clientId());

        ObjectNode behavior = request.putObject("behavior_metrics");
        behavior.put("engagement_score", or(input.engagementScore(), 0.7));
        behavior.put("communication_frequency", or(input.communicationFrequency(), 0.5));
        behavior.put("support_ticket_volume", or(input.ticketCount(), 0));
        behavior.put("feature_adoption_rate", or(input.featureAdoptionRate(), 0.6));

        ObjectNode financial = request.putObject("financial_metrics");
        financial.put("payment_history", or(input.paymentHistory(), "good"));
        financial.put("payment_delays", or(input.paymentDelays(), 0));
        financial.put("contract_value", or(input.contractValue(), 0));
        financial.put("revenue_trend", or(input.revenueTrend(), "stable"));

        ObjectNode service = request.putObject("service_metrics");
        service.put("service_utilization", or(input.serviceUtilization(), 0.7));
        service.put("sla_compliance", or(input.slaCompliance(), 0.95));
        service.put("escalation_rate", or(input.escalationRate(), 0.1));

        ObjectNode relationship = request.putObject("relationship_metrics");
        relationship.put("relationship_duration", or(input.relationshipDuration(), 12));
        relationship.put("stakeholder_satisfaction", or(input.stakeholderSatisfaction(), 0.8));
        relationship.put("competitive_pressure", or(input.competitivePressure(), 0.3));

        ObjectNode prediction = request.putObject("prediction_options");
        prediction.put("prediction_horizon", options.integer(PREDICTION_HORIZON, DEFAULT_PREDICTION_HORIZON));
        prediction.put("include_confidence", true);
        prediction.put("include_risk_factors", options.flag(INCLUDE_RISK_FACTORS, true));
        prediction.put("include_retention_strategies", options.flag(INCLUDE_RETENTION_STRATEGIES, true));
        return request;
    }

    @Override
    protected ChurnPrediction readResult(JsonNode data, MappingOptions options) {
        double probability = number(data, "churn_probability", 0);
        int horizon = integer(data, "prediction_horizon",
                integer(path(data, "prediction_options"), "prediction_horizon",
                        options.integer(PREDICTION_HORIZON, DEFAULT_PREDICTION_HORIZON)));
        JsonNode timeToChurn = data.path("time_to_churn");
        JsonNode insights = data.path("insights");
        return new ChurnPrediction(
                text(data, "client_id", null),
                probability,
                riskLevelFor(probability),
                number(data, "confidence", 0),
                timeToChurn.isNumber() ? timeToChurn.asInt() : null,
                horizon,
                objects(data, "risk_factors", ChurnMapper::riskFactor),
                objects(data, "retention_recommendations", AbstractDataMapper::recommendation),
                texts(data.path("interventions"), "immediate"),
                texts(insights, "primary_drivers"),
                texts(insights, "protective_factors"),
                metadata(data, "prediction_date"));
    }

    @Override
    protected void checkResponse(JsonNode data, MappingResult.Collector findings) {
        JsonNode probability = data.path("churn_probability");
        if (!probability.isNumber()) {
            findings.error("Churn probability is missing or invalid");
        } else {
            findings.errorIf(probability.asDouble() < 0 || probability.asDouble() > 1,
                    "Churn probability is out of valid range (0-1)");
        }
    }

    @Override
    public String cacheKey(ChurnInput input, MappingOptions options) {
        int horizon = options.integer(PREDICTION_HORIZON, DEFAULT_PREDICTION_HORIZON);
        return "churn_" + input.clientId() + "_" + horizon + "_" + bucket(Duration.ofDays(1));
    }

    private static ChurnRiskFactor riskFactor(JsonNode node) {
        if (node.isValueNode()) {
            return new ChurnRiskFactor(node.asText(), "medium", "medium", "stable", true);
        }
        return new ChurnRiskFactor(
                text(node, "factor", "unknown"),
                text(node, "impact", "medium"),
                text(node, "severity", "medium"),
                text(node, "trend", "stable"),
                flag(node, "actionable", true));
    }
}
