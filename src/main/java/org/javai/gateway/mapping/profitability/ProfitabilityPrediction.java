package org.javai.gateway.mapping.profitability;

import org.javai.gateway.mapping.PredictionMetadata;
import org.javai.gateway.mapping.Recommendation;
import org.javai.gateway.mapping.RiskLevel;

import java.util.List;
import java.util.Map;

/**
 * @param factors contribution of each named driver, such as {@code cost_efficiency}
 */
public record ProfitabilityPrediction(
        String clientId,
        double profitabilityScore,
        double confidence,
        RiskLevel riskLevel,
        String trend,
        double forecastAccuracy,
        int forecastHorizon,
        Map<String, Double> factors,
        List<Recommendation> recommendations,
        ProfitabilityForecast forecast,
        List<String> strengths,
        List<String> weaknesses,
        PredictionMetadata metadata
) {
}
