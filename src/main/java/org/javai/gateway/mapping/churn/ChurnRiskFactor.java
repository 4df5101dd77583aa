package org.javai.gateway.mapping.churn;

public record ChurnRiskFactor(String factor, String impact, String severity, String trend, boolean actionable) {
}
