package org.javai.gateway.mapping.revenueleak;

public record LeakRecommendation(
        String category,
        String priority,
        String description,
        double estimatedSavings,
        String implementationEffort,
        String timeframe
) {
}
