package org.javai.gateway.mapping.pricing;

public record PriceAlternative(double price, String model, String rationale, String expectedOutcome) {
}
