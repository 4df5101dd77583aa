package org.javai.gateway.mapping;

/**
 * Provenance of a model answer.
 *
 * @param generatedAt ISO-8601 time the model produced the answer, or the mapping time if the
 *                    service did not say
 * @param fallback    whether the service itself answered from a degraded path
 */
public record PredictionMetadata(
        String modelVersion,
        String generatedAt,
        double processingTime,
        String dataQuality,
        boolean fallback
) {
}
