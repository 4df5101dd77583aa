package org.javai.gateway.mapping.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.ModelType;
import org.javai.gateway.mapping.AbstractDataMapper;
import org.javai.gateway.mapping.MappingOptions;
import org.javai.gateway.mapping.MappingResult;

import java.time.Clock;
import java.time.Duration;

/**
 * Maps price recommendations. Options: {@value #PRICING_MODEL} (default value_based) and
 * {@value #OPTIMIZATION_GOAL} (default profit_margin).
 */
public final class PricingMapper extends AbstractDataMapper<PricingInput, PricingRecommendation> {

    public static final String PRICING_MODEL = "pricingModel";
    public static final String OPTIMIZATION_GOAL = "optimizationGoal";
    public static final String INCLUDE_ALTERNATIVES = "includeAlternatives";
    static final String DEFAULT_SERVICE_TYPE = "managed_services";

    public PricingMapper() {
        this(Clock.systemUTC());
    }

    public PricingMapper(Clock clock) {
        super(ModelType.PRICING, PricingRecommendation.class, clock);
    }

    @Override
    public MappingResult validateInternal(PricingInput input) {
        return MappingResult.collector()
                .errorIf(isBlank(input.clientId()), "Client ID is required")
                .warnIf(isBlank(input.serviceType()), "Service type not specified")
                .warnIf(input.currentPrice() == null || input.currentPrice() <= 0, "Current price is missing or invalid")
                .result();
    }

    @Override
    protected ObjectNode buildRequest(PricingInput input, MappingOptions options) {
        ObjectNode request = JSON.objectNode();
        request.put("client_id", input.clientId());

        ObjectNode service = request.putObject("service_data");
        service.put("service_type", or(input.serviceType(), DEFAULT_SERVICE_TYPE));
        service.put("current_price", or(input.currentPrice(), 0));
        service.put("service_complexity", or(input.serviceComplexity(), "medium"));
        service.put("delivery_model", or(input.deliveryModel(), "on-site"));

        ObjectNode market = request.putObject("market_data");
        market.set("competitor_pricing", numberArray(input.competitorPricing()));
        market.put("demand_level", or(input.demandLevel(), "medium"));
        market.put("market_segment", or(input.marketSegment(), "mid-market"));

        ObjectNode client = request.putObject("client_context");
        client.put("client_size", or(input.clientSize(), "medium"));
        client.put("industry", or(input.industry(), "technology"));
        client.put("relationship_duration", or(input.relationshipDuration(), 12));
        client.put("price_sensitivity", or(input.priceSensitivity(), 0.5));

        ObjectNode pricing = request.putObject("pricing_options");
        pricing.put("pricing_model", options.text(PRICING_MODEL, "value_based"));
        pricing.put("include_alternatives", options.flag(INCLUDE_ALTERNATIVES, true));
        pricing.put("optimization_goal", options.text(OPTIMIZATION_GOAL, "profit_margin"));
        return request;
    }

    @Override
    protected PricingRecommendation readResult(JsonNode data, MappingOptions options) {
        JsonNode range = data.path("price_range");
        JsonNode factors = data.path("factors");
        return new PricingRecommendation(
                text(data, "client_id", null),
                text(data, "service_type", text(data.path("service_data"), "service_type", DEFAULT_SERVICE_TYPE)),
                number(data, "recommended_price", 0),
                number(range, "min", 0),
                number(range, "max", 0),
                number(data, "confidence", 0.7),
                text(data, "pricing_model",
                        text(data.path("pricing_options"), "pricing_model", options.text(PRICING_MODEL, "value_based"))),
                text(data, "market_position", "competitive"),
                objects(data, "alternatives", node -> new PriceAlternative(
                        number(node, "price", 0),
                        text(node, "model", "value_based"),
                        text(node, "rationale", ""),
                        text(node, "expected_outcome", ""))),
                number(factors, "complexity_score", 0.5),
                text(factors, "competition_level", "medium"),
                texts(data, "recommendations"),
                metadata(data, "recommendation_date"));
    }

    @Override
    protected void checkResponse(JsonNode data, MappingResult.Collector findings) {
        findings.errorIf(!data.path("recommended_price").isNumber(), "Recommended price is missing or invalid");
    }

    @Override
    public String cacheKey(PricingInput input, MappingOptions options) {
        String serviceType = isBlank(input.serviceType()) ? "default" : input.serviceType();
        return "pricing_" + input.clientId() + "_" + serviceType + "_" + bucket(Duration.ofDays(1));
    }
}
