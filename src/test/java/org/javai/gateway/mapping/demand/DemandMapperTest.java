package org.javai.gateway.mapping.demand;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.MutableClock;
import org.javai.gateway.mapping.MappingOptions;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DemandMapperTest {

    private final ObjectMapper json = new ObjectMapper();
    private final DemandMapper mapper = new DemandMapper(MutableClock.at("2024-05-05T05:00:00Z"));

    @Test
    void toExternal_writesHistoryAndForecastOptions() {
        DemandInput input = new DemandInput("org-4", List.of(100.0, 120.0), null, List.of("helpdesk"));

        ObjectNode request = mapper.toExternal(input, MappingOptions.of(DemandMapper.GRANULARITY, "weekly"));

        assertThat(request.at("/historical_data/demand_history").size()).isEqualTo(2);
        assertThat(request.at("/historical_data/capacity_utilization").size()).isZero();
        assertThat(request.at("/service_data/service_types/0").asText()).isEqualTo("helpdesk");
        assertThat(request.at("/forecasting_options/forecast_horizon").asInt()).isEqualTo(90);
        assertThat(request.at("/forecasting_options/granularity").asText()).isEqualTo("weekly");
    }

    @Test
    void validateInternal_warnsOnShortHistory() {
        List<Double> month = Collections.nCopies(30, 1.0);

        assertThat(mapper.validateInternal(new DemandInput("org-4", List.of(1.0), null, null)).warnings())
                .containsExactly("Insufficient historical data for accurate forecasting");
        assertThat(mapper.validateInternal(new DemandInput("org-4", null, null, null)).warnings())
                .containsExactly("Historical demand data is missing");
        assertThat(mapper.validateInternal(new DemandInput("org-4", month, null, null)).warnings()).isEmpty();
    }

    @Test
    void fromExternal_acceptsObjectAndNumericPoints() throws Exception {
        DemandForecast forecast = mapper.fromExternal(json.readTree("""
                {"predictions": [
                   {"date": "2024-05-06", "predicted_demand": 130, "lower_bound": 110, "upper_bound": 150},
                   125.5
                 ],
                 "trend_direction": "increasing",
                 "seasonality_detected": true,
                 "insights": {"key_drivers": ["quarter end"]}}
                """), MappingOptions.of(DemandMapper.FORECAST_HORIZON, 14));

        assertThat(forecast.forecastHorizon()).isEqualTo(14);
        assertThat(forecast.granularity()).isEqualTo("daily");
        assertThat(forecast.predictions()).containsExactly(
                new DemandPoint("2024-05-06", 130, 110, 150),
                new DemandPoint(null, 125.5, 125.5, 125.5));
        assertThat(forecast.trendDirection()).isEqualTo("increasing");
        assertThat(forecast.seasonalityDetected()).isTrue();
        assertThat(forecast.keyDrivers()).containsExactly("quarter end");
    }

    @Test
    void validateExternal_requiresPredictionArray() throws Exception {
        assertThat(mapper.validateExternal(json.readTree("{\"forecasted_demand\": 125}")).errors())
                .containsExactly("Demand predictions are missing or invalid");
        assertThat(mapper.validateExternal(json.readTree("{\"data\": {\"predictions\": []}}")).isValid()).isTrue();
    }

    @Test
    void cacheKey_includesHorizon() {
        assertThat(mapper.cacheKey(new DemandInput("org-4", null, null, null), MappingOptions.none()))
                .startsWith("demand_org-4_90_");
    }

    @Test
    void roundTrip_preservesOrganizationHorizonAndGranularity() {
        DemandInput input = new DemandInput("org-4", List.of(100.0, 120.0), null, List.of("helpdesk"));
        MappingOptions options = MappingOptions.of(DemandMapper.FORECAST_HORIZON, 30)
                .with(DemandMapper.GRANULARITY, "weekly");

        DemandForecast echoed = mapper.fromExternal(mapper.toExternal(input, options), MappingOptions.none());

        assertThat(echoed.organizationId()).isEqualTo("org-4");
        assertThat(echoed.forecastHorizon()).isEqualTo(30);
        assertThat(echoed.granularity()).isEqualTo("weekly");
    }
}
