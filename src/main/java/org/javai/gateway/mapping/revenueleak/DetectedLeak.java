package org.javai.gateway.mapping.revenueleak;

import org.javai.gateway.mapping.RiskLevel;

import java.util.List;

/**
 * @param severity derived from {@code estimatedAmount}, never taken from the service
 */
public record DetectedLeak(
        String leakId,
        String category,
        String description,
        double estimatedAmount,
        double confidence,
        RiskLevel severity,
        String source,
        List<String> affectedClients
) {
}
