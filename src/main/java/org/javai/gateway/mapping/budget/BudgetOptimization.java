package org.javai.gateway.mapping.budget;

import org.javai.gateway.mapping.PredictionMetadata;

import java.util.List;
import java.util.Map;

public record BudgetOptimization(
        String organizationId,
        String budgetPeriod,
        double optimizationScore,
        double potentialSavings,
        Map<String, Double> recommendedAllocation,
        double confidence,
        List<BudgetAdjustment> adjustments,
        List<String> recommendations,
        List<String> budgetRisks,
        List<String> mitigationStrategies,
        PredictionMetadata metadata
) {
}
