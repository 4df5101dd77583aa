package org.javai.gateway.mapping.anomaly;

import org.javai.gateway.mapping.PredictionMetadata;

import java.util.List;

public record AnomalyReport(
        String organizationId,
        int anomaliesDetected,
        double overallScore,
        double confidence,
        String detectionMethod,
        List<Anomaly> anomalies,
        List<String> rootCauses,
        List<String> recommendations,
        PredictionMetadata metadata
) {
}
