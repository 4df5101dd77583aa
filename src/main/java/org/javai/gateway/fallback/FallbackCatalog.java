package org.javai.gateway.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.ModelType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Conservative default payloads for every {@link ModelType}, in the downstream service's
 * response schema so callers can decode them with the same mapper as a live response.
 */
public final class FallbackCatalog {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private FallbackCatalog() {
    }

    /**
     * @return one payload per model type; a fresh map on each call
     */
    public static Map<ModelType, JsonNode> defaults() {
        Map<ModelType, JsonNode> payloads = new EnumMap<>(ModelType.class);

        ObjectNode profitability = base();
        profitability.put("profitability_score", 0.75);
        profitability.put("confidence", 0.60);
        profitability.put("risk_level", "medium");
        ArrayNode profitabilityFactors = profitability.putArray("factors");
        profitabilityFactors.add(factor("historical_performance", 0.3, "Based on historical data"));
        profitabilityFactors.add(factor("service_utilization", 0.25, "Service usage patterns"));
        strings(profitability.putArray("recommendations"), "Monitor service usage", "Review pricing strategy");
        payloads.put(ModelType.PROFITABILITY, profitability);

        ObjectNode churn = base();
        churn.put("churn_probability", 0.35);
        churn.put("risk_level", "medium");
        churn.put("confidence", 0.55);
        ArrayNode churnFactors = churn.putArray("risk_factors");
        churnFactors.add(factor("payment_history", 0.4, "Payment patterns analysis"));
        churnFactors.add(factor("support_tickets", 0.3, "Support interaction frequency"));
        strings(churn.putArray("recommendations"), "Increase customer engagement", "Review service quality");
        payloads.put(ModelType.CHURN, churn);

        ObjectNode revenueLeak = base();
        revenueLeak.put("total_leak_amount", 5000);
        revenueLeak.put("confidence", 0.50);
        ArrayNode leakCategories = revenueLeak.putArray("leak_categories");
        leakCategories.add(leakCategory("underutilized_services", 2000, 40));
        leakCategories.add(leakCategory("pricing_gaps", 1500, 30));
        leakCategories.add(leakCategory("billing_errors", 1500, 30));
        strings(revenueLeak.putArray("recommendations"), "Review service utilization", "Audit pricing structure");
        payloads.put(ModelType.REVENUE_LEAK, revenueLeak);

        ObjectNode pricing = base();
        pricing.put("recommended_price", 150);
        ObjectNode range = pricing.putObject("price_range");
        range.put("min", 120);
        range.put("max", 180);
        pricing.put("confidence", 0.55);
        strings(pricing.putArray("factors"), "market_analysis", "cost_structure");
        payloads.put(ModelType.PRICING, pricing);

        ObjectNode budget = base();
        ObjectNode allocation = budget.putObject("optimized_allocation");
        allocation.put("infrastructure", 40);
        allocation.put("personnel", 35);
        allocation.put("marketing", 15);
        allocation.put("operations", 10);
        budget.put("projected_savings", 8500);
        budget.put("confidence", 0.50);
        payloads.put(ModelType.BUDGET, budget);

        ObjectNode demand = base();
        demand.put("forecasted_demand", 125);
        demand.put("trend", "stable");
        demand.put("confidence", 0.55);
        strings(demand.putArray("seasonal_factors"), "end_of_quarter", "business_growth");
        payloads.put(ModelType.DEMAND, demand);

        ObjectNode anomaly = base();
        anomaly.put("anomalies_detected", 2);
        ObjectNode severity = anomaly.putObject("severity_distribution");
        severity.put("low", 1);
        severity.put("medium", 1);
        severity.put("high", 0);
        anomaly.put("confidence", 0.50);
        strings(anomaly.putArray("recommendations"), "Monitor system performance", "Review recent changes");
        payloads.put(ModelType.ANOMALY, anomaly);

        return payloads;
    }

    private static ObjectNode base() {
        ObjectNode node = JSON.objectNode();
        node.put("is_fallback", true);
        node.put("fallback_reason", FallbackProvider.DEFAULT_REASON);
        return node;
    }

    private static ObjectNode factor(String name, double impact, String description) {
        ObjectNode node = JSON.objectNode();
        node.put("factor", name);
        node.put("impact", impact);
        node.put("description", description);
        return node;
    }

    private static ObjectNode leakCategory(String category, double amount, double percentage) {
        ObjectNode node = JSON.objectNode();
        node.put("category", category);
        node.put("amount", amount);
        node.put("percentage", percentage);
        return node;
    }

    private static void strings(ArrayNode array, String... values) {
        for (String value : values) {
            array.add(value);
        }
    }
}
