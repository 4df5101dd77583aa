package org.javai.gateway.mapping.demand;

import org.javai.gateway.mapping.PredictionMetadata;

import java.util.List;

public record DemandForecast(
        String organizationId,
        int forecastHorizon,
        String granularity,
        List<DemandPoint> predictions,
        double confidence,
        String trendDirection,
        boolean seasonalityDetected,
        List<String> keyDrivers,
        List<String> recommendations,
        PredictionMetadata metadata
) {
}
