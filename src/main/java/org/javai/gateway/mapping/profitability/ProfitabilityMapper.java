package org.javai.gateway.mapping.profitability;

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
 * Maps profitability predictions. Option {@value #FORECAST_HORIZON} is in months, default 6.
 */
public final class ProfitabilityMapper extends AbstractDataMapper<ProfitabilityInput, ProfitabilityPrediction> {

    public static final String FORECAST_HORIZON = "forecastHorizon";
    public static final String INCLUDE_RECOMMENDATIONS = "includeRecommendations";
    public static final int DEFAULT_FORECAST_HORIZON = 6;

    public ProfitabilityMapper() {
        this(Clock.systemUTC());
    }

    public ProfitabilityMapper(Clock clock) {
        super(ModelType.PROFITABILITY, ProfitabilityPrediction.class, clock);
    }

    /**
     * A high score means a low risk.
     */
    public static RiskLevel riskLevelFor(double score) {
        if (score >= 0.8) {
            return RiskLevel.LOW;
        }
        if (score >= 0.6) {
            return RiskLevel.MEDIUM;
        }
        if (score >= 0.4) {
            return RiskLevel.HIGH;
        }
        return RiskLevel.CRITICAL;
    }

    @Override
    public MappingResult validateInternal(ProfitabilityInput input) {
        return MappingResult.collector()
                .errorIf(isBlank(input.clientId()), "Client ID is required")
                .warnIf(input.monthlyRevenue() == null || input.monthlyRevenue() <= 0, "Monthly revenue is missing or invalid")
                .warnIf(input.totalCosts() == null || input.totalCosts() < 0, "Total costs data is missing or invalid")
                .warnIf(input.ticketCount() == null || input.ticketCount() < 0, "Ticket count data is missing or invalid")
                .result();
    }

    @Override
    protected ObjectNode buildRequest(ProfitabilityInput input, MappingOptions options) {
        ObjectNode request = JSON.objectNode();
        request.put("client_id", input.clientId());

        ObjectNode financial = request.putObject("financial_metrics");
        financial.put("monthly_revenue", or(input.monthlyRevenue(), 0));
        financial.put("total_costs", or(input.totalCosts(), 0));
        financial.put("profit_margin", or(input.profitMargin(), 0));
        financial.put("revenue_growth", or(input.revenueGrowth(), 0));

        ObjectNode operational = request.putObject("operational_metrics");
        operational.put("ticket_volume", or(input.ticketCount(), 0));
        operational.put("avg_resolution_time", or(input.avgResolutionTime(), 0));
        operational.put("sla_compliance", or(input.slaCompliance(), 0.95));
        operational.put("client_satisfaction", or(input.clientSatisfaction(), 4.0));
        operational.put("service_utilization", or(input.serviceUtilization(), 0.7));

        ObjectNode characteristics = request.putObject("client_characteristics");
        characteristics.put("client_size", or(input.clientSize(), "medium"));
        characteristics.put("industry", or(input.industry(), "technology"));
        characteristics.put("contract_length", or(input.contractLength(), 12));
        characteristics.put("service_tier", or(input.serviceTier(), "standard"));

        ObjectNode history = request.putObject("historical_data");
        history.put("months_active", or(input.monthsActive(), 12));
        history.set("revenue_history", numberArray(input.revenueHistory()));

        ObjectNode prediction = request.putObject("prediction_options");
        prediction.put("forecast_horizon", options.integer(FORECAST_HORIZON, DEFAULT_FORECAST_HORIZON));
        prediction.put("include_confidence", true);
        prediction.put("include_factors", true);
        prediction.put("include_recommendations", options.flag(INCLUDE_RECOMMENDATIONS, true));
        return request;
    }

    @Override
    protected ProfitabilityPrediction readResult(JsonNode data, MappingOptions options) {
        double score = number(data, "profitability_score", 0);
        double confidence = number(data, "confidence", 0);
        JsonNode forecast = data.path("forecast");
        JsonNode insights = data.path("insights");
        int horizon = integer(data, "forecast_horizon",
                integer(data.path("prediction_options"), "forecast_horizon",
                        options.integer(FORECAST_HORIZON, DEFAULT_FORECAST_HORIZON)));
        return new ProfitabilityPrediction(
                text(data, "client_id", null),
                score,
                confidence,
                riskLevelFor(score),
                text(data, "trend", "stable"),
                number(data, "forecast_accuracy", 0.85),
                horizon,
                numbers(data, "factors"),
                objects(data, "recommendations", AbstractDataMapper::recommendation),
                new ProfitabilityForecast(
                        number(forecast, "next_month", score),
                        number(forecast, "next_quarter", score),
                        number(forecast, "next_year", score),
                        number(forecast, "confidence", confidence)),
                texts(insights, "strengths"),
                texts(insights, "weaknesses"),
                metadata(data, "prediction_date"));
    }

    @Override
    protected void checkResponse(JsonNode data, MappingResult.Collector findings) {
        JsonNode score = data.path("profitability_score");
        if (!score.isNumber()) {
            findings.error("Profitability score is missing or invalid");
        } else {
            findings.errorIf(score.asDouble() < 0 || score.asDouble() > 1,
                    "Profitability score is out of valid range (0-1)");
        }
    }

    @Override
    public String cacheKey(ProfitabilityInput input, MappingOptions options) {
        int horizon = options.integer(FORECAST_HORIZON, DEFAULT_FORECAST_HORIZON);
        return "profitability_" + input.clientId() + "_" + horizon + "_" + bucket(Duration.ofHours(1));
    }
}
