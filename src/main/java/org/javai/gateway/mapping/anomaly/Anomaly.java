package org.javai.gateway.mapping.anomaly;

import org.javai.gateway.mapping.RiskLevel;

import java.util.List;

public record Anomaly(
        String timestamp,
        String metric,
        double value,
        RiskLevel severity,
        double confidence,
        String description,
        List<String> possibleCauses
) {
}
