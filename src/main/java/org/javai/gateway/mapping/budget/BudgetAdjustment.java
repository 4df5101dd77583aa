package org.javai.gateway.mapping.budget;

public record BudgetAdjustment(
        String category,
        double currentSpend,
        double recommendedSpend,
        double savings,
        String rationale,
        double confidence
) {
}
