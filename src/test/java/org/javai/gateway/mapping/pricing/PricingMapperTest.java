package org.javai.gateway.mapping.pricing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.MutableClock;
import org.javai.gateway.mapping.MappingOptions;
import org.javai.gateway.mapping.MappingResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PricingMapperTest {

    private final ObjectMapper json = new ObjectMapper();
    private final PricingMapper mapper = new PricingMapper(MutableClock.at("2024-04-10T09:00:00Z"));

    @Test
    void toExternal_defaultsServiceTypeAndPricingOptions() {
        ObjectNode request = mapper.toExternal(PricingInput.of("client-3", null, null), MappingOptions.none());

        assertThat(request.at("/service_data/service_type").asText()).isEqualTo("managed_services");
        assertThat(request.at("/service_data/delivery_model").asText()).isEqualTo("on-site");
        assertThat(request.at("/market_data/competitor_pricing").isArray()).isTrue();
        assertThat(request.at("/market_data/market_segment").asText()).isEqualTo("mid-market");
        assertThat(request.at("/client_context/price_sensitivity").asDouble()).isEqualTo(0.5);
        assertThat(request.at("/pricing_options/pricing_model").asText()).isEqualTo("value_based");
        assertThat(request.at("/pricing_options/optimization_goal").asText()).isEqualTo("profit_margin");
    }

    @Test
    void toExternal_carriesCompetitorPricesAndOptions() {
        PricingInput input = new PricingInput("client-3", "security", 140.0, "high", "remote",
                List.of(130.0, 155.0), "high", "enterprise", "large", "finance", 36, 0.2);

        ObjectNode request = mapper.toExternal(input, MappingOptions.of(PricingMapper.PRICING_MODEL, "tiered"));

        assertThat(request.at("/market_data/competitor_pricing/1").asDouble()).isEqualTo(155.0);
        assertThat(request.at("/client_context/relationship_duration").asInt()).isEqualTo(36);
        assertThat(request.at("/pricing_options/pricing_model").asText()).isEqualTo("tiered");
    }

    @Test
    void validateInternal_warnsWithoutServiceTypeOrPrice() {
        MappingResult result = mapper.validateInternal(PricingInput.of("client-3", "", -5.0));

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).containsExactly("Service type not specified", "Current price is missing or invalid");
        assertThat(mapper.validateInternal(PricingInput.of(null, "x", 1.0)).errors())
                .containsExactly("Client ID is required");
    }

    @Test
    void fromExternal_readsRangeAlternativesAndFactors() throws Exception {
        PricingRecommendation recommendation = mapper.fromExternal(json.readTree("""
                {"data": {
                  "recommended_price": 162.5,
                  "price_range": {"min": 140, "max": 185},
                  "alternatives": [{"price": 150, "model": "tiered", "rationale": "volume discount"}],
                  "factors": {"complexity_score": 0.8},
                  "recommendations": ["Bundle backup with monitoring"],
                  "service_data": {"service_type": "security"}
                }}
                """), MappingOptions.none());

        assertThat(recommendation.recommendedPrice()).isEqualTo(162.5);
        assertThat(recommendation.minimumPrice()).isEqualTo(140);
        assertThat(recommendation.maximumPrice()).isEqualTo(185);
        assertThat(recommendation.serviceType()).isEqualTo("security");
        assertThat(recommendation.confidence()).isEqualTo(0.7);
        assertThat(recommendation.marketPosition()).isEqualTo("competitive");
        assertThat(recommendation.alternatives()).containsExactly(
                new PriceAlternative(150, "tiered", "volume discount", ""));
        assertThat(recommendation.complexityScore()).isEqualTo(0.8);
        assertThat(recommendation.competitionLevel()).isEqualTo("medium");
        assertThat(recommendation.recommendations()).containsExactly("Bundle backup with monitoring");
    }

    @Test
    void validateExternal_requiresNumericPrice() throws Exception {
        assertThat(mapper.validateExternal(json.readTree("{\"recommended_price\": \"150\"}")).errors())
                .containsExactly("Recommended price is missing or invalid");
        assertThat(mapper.validateExternal(json.readTree("{\"recommended_price\": 150}")).isValid()).isTrue();
    }

    @Test
    void cacheKey_usesDefaultLabelWithoutServiceType() {
        assertThat(mapper.cacheKey(PricingInput.of("client-3", null, null), MappingOptions.none()))
                .startsWith("pricing_client-3_default_");
        assertThat(mapper.cacheKey(PricingInput.of("client-3", "security", null), MappingOptions.none()))
                .startsWith("pricing_client-3_security_");
    }

    @Test
    void roundTrip_preservesClientServiceTypeAndPricingModel() {
        PricingInput input = PricingInput.of("client-3", "security", 140.0);
        MappingOptions options = MappingOptions.of(PricingMapper.PRICING_MODEL, "tiered");

        PricingRecommendation echoed = mapper.fromExternal(mapper.toExternal(input, options), MappingOptions.none());

        assertThat(echoed.clientId()).isEqualTo("client-3");
        assertThat(echoed.serviceType()).isEqualTo("security");
        assertThat(echoed.pricingModel()).isEqualTo("tiered");
    }
}
