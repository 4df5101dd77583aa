package org.javai.gateway.mapping.pricing;

import org.javai.gateway.mapping.PredictionMetadata;

import java.util.List;

public record PricingRecommendation(
        String clientId,
        String serviceType,
        double recommendedPrice,
        double minimumPrice,
        double maximumPrice,
        double confidence,
        String pricingModel,
        String marketPosition,
        List<PriceAlternative> alternatives,
        double complexityScore,
        String competitionLevel,
        List<String> recommendations,
        PredictionMetadata metadata
) {
}
