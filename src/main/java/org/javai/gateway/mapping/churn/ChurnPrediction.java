package org.javai.gateway.mapping.churn;

import org.javai.gateway.mapping.PredictionMetadata;
import org.javai.gateway.mapping.Recommendation;
import org.javai.gateway.mapping.RiskLevel;

import java.util.List;

/**
 * @param timeToChurnDays null when the model gave no estimate
 */
public record ChurnPrediction(
        String clientId,
        double churnProbability,
        RiskLevel riskLevel,
        double confidence,
        Integer timeToChurnDays,
        int predictionHorizon,
        List<ChurnRiskFactor> riskFactors,
        List<Recommendation> retentionStrategies,
        List<String> immediateInterventions,
        List<String> primaryRiskDrivers,
        List<String> protectiveFactors,
        PredictionMetadata metadata
) {
}
