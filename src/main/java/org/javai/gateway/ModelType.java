package org.javai.gateway;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of prediction categories the gateway routes. Each category has one fallback
 * entry, one downstream endpoint and one data mapper.
 */
public enum ModelType {

    PROFITABILITY("profitability", "predict", "/api/profitability"),
    CHURN("churn", "predict", "/api/churn/predict"),
    REVENUE_LEAK("revenue_leak", "detect", "/api/revenue-leak/detect"),
    PRICING("pricing", "recommend", "/api/pricing/recommend"),
    BUDGET("budget", "optimize", "/api/budget/optimize"),
    DEMAND("demand", "forecast", "/api/demand/forecast"),
    ANOMALY("anomaly", "detect", "/api/anomaly/detect");

    private final String category;
    private final String operation;
    private final String endpoint;

    ModelType(String category, String operation, String endpoint) {
        this.category = category;
        this.operation = operation;
        this.endpoint = endpoint;
    }

    /**
     * @return the wire name of the category, used as metric label and fallback key
     */
    public String category() {
        return category;
    }

    public String operation() {
        return operation;
    }

    public String endpoint() {
        return endpoint;
    }

    /**
     * @return the operation name used in logs and failure reports, e.g. {@code churn.predict}
     */
    public String qualifiedOperation() {
        return category + "." + operation;
    }

    public static Optional<ModelType> fromCategory(String category) {
        return Arrays.stream(values()).filter(t -> t.category.equals(category)).findFirst();
    }
}
