package org.javai.gateway.mapping.demand;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.ModelType;
import org.javai.gateway.mapping.AbstractDataMapper;
import org.javai.gateway.mapping.MappingOptions;
import org.javai.gateway.mapping.MappingResult;

import java.time.Clock;
import java.time.Duration;

/**
 * Maps demand forecasts. Options: {@value #FORECAST_HORIZON} (days, default 90) and
 * {@value #GRANULARITY} (default daily).
 */
public final class DemandMapper extends AbstractDataMapper<DemandInput, DemandForecast> {

    public static final String FORECAST_HORIZON = "forecastHorizon";
    public static final String GRANULARITY = "granularity";
    public static final int DEFAULT_FORECAST_HORIZON = 90;
    static final int MIN_HISTORY = 30;

    public DemandMapper() {
        this(Clock.systemUTC());
    }

    public DemandMapper(Clock clock) {
        super(ModelType.DEMAND, DemandForecast.class, clock);
    }

    @Override
    public MappingResult validateInternal(DemandInput input) {
        return MappingResult.collector()
                .errorIf(isBlank(input.organizationId()), "Organization ID is required")
                .warnIf(input.demandHistory() == null, "Historical demand data is missing")
                .warnIf(input.demandHistory() != null && input.demandHistory().size() < MIN_HISTORY,
                        "Insufficient historical data for accurate forecasting")
                .result();
    }

    @Override
    protected ObjectNode buildRequest(DemandInput input, MappingOptions options) {
        ObjectNode request = JSON.objectNode();
        request.put("organization_id", input.organizationId());

        ObjectNode history = request.putObject("historical_data");
        history.set("demand_history", numberArray(input.demandHistory()));
        history.set("capacity_utilization", numberArray(input.capacityUtilization()));

        ObjectNode service = request.putObject("service_data");
        service.set("service_types", textArray(input.serviceTypes()));

        ObjectNode forecasting = request.putObject("forecasting_options");
        forecasting.put("forecast_horizon", options.integer(FORECAST_HORIZON, DEFAULT_FORECAST_HORIZON));
        forecasting.put("granularity", options.text(GRANULARITY, "daily"));
        forecasting.put("confidence_intervals", true);
        forecasting.put("seasonality", true);
        forecasting.put("include_scenarios", true);
        return request;
    }

    @Override
    protected DemandForecast readResult(JsonNode data, MappingOptions options) {
        JsonNode requested = data.path("forecasting_options");
        return new DemandForecast(
                text(data, "organization_id", null),
                integer(data, "forecast_horizon",
                        integer(requested, "forecast_horizon", options.integer(FORECAST_HORIZON, DEFAULT_FORECAST_HORIZON))),
                text(data, "granularity", text(requested, "granularity", options.text(GRANULARITY, "daily"))),
                objects(data, "predictions", DemandMapper::point),
                number(data, "confidence", 0.7),
                text(data, "trend_direction", "stable"),
                flag(data, "seasonality_detected", false),
                texts(data.path("insights"), "key_drivers"),
                texts(data, "recommendations"),
                metadata(data, "forecast_date"));
    }

    @Override
    protected void checkResponse(JsonNode data, MappingResult.Collector findings) {
        findings.errorIf(!data.path("predictions").isArray(), "Demand predictions are missing or invalid");
    }

    @Override
    public String cacheKey(DemandInput input, MappingOptions options) {
        int horizon = options.integer(FORECAST_HORIZON, DEFAULT_FORECAST_HORIZON);
        return "demand_" + input.organizationId() + "_" + horizon + "_" + bucket(Duration.ofHours(12));
    }

    private static DemandPoint point(JsonNode node) {
        if (node.isNumber()) {
            return new DemandPoint(null, node.asDouble(), node.asDouble(), node.asDouble());
        }
        double value = number(node, "value", number(node, "predicted_demand", 0));
        return new DemandPoint(
                text(node, "date", null),
                value,
                number(node, "lower_bound", value),
                number(node, "upper_bound", value));
    }
}
