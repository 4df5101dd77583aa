package org.javai.gateway.mapping.revenueleak;

import org.javai.gateway.mapping.PredictionMetadata;

import java.util.List;
import java.util.Map;

/**
 * @param categoryAmounts leaked amount per category, such as {@code unbilled_hours}
 * @param highSeverityLeaks leaks rated high or critical
 */
public record RevenueLeakReport(
        String organizationId,
        List<DetectedLeak> leaks,
        Map<String, Double> categoryAmounts,
        FinancialImpact financialImpact,
        List<LeakRecommendation> recommendations,
        List<String> primaryCauses,
        int highSeverityLeaks,
        double confidenceScore,
        PredictionMetadata metadata
) {

    public int totalLeaks() {
        return leaks.size();
    }
}
