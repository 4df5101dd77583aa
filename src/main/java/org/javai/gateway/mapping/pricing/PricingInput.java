package org.javai.gateway.mapping.pricing;

import java.util.List;

/**
 * A service being priced for a client. Only {@code clientId} is required.
 */
public record PricingInput(
        String clientId,
        String serviceType,
        Double currentPrice,
        String serviceComplexity,
        String deliveryModel,
        List<Double> competitorPricing,
        String demandLevel,
        String marketSegment,
        String clientSize,
        String industry,
        Integer relationshipDuration,
        Double priceSensitivity
) {

    public PricingInput {
        competitorPricing = competitorPricing == null ? null : List.copyOf(competitorPricing);
    }

    public static PricingInput of(String clientId, String serviceType, Double currentPrice) {
        return new PricingInput(clientId, serviceType, currentPrice, null, null, null, null, null, null, null, null, null);
    }
}
