package org.javai.gateway.mapping;

/**
 * An action suggested by a model. The service sends either a bare string or an object; a
 * bare string becomes the description with every other field defaulted.
 */
public record Recommendation(
        String category,
        String priority,
        String description,
        String impact,
        String effort,
        String timeframe
) {
}
