package org.javai.gateway;

import org.javai.gateway.mapping.MappingOptions;
import org.javai.gateway.retry.CancellationSignal;
import org.javai.gateway.retry.RetryPolicy;

import java.util.Objects;

/**
 * Per-call options of {@link PredictionGateway#invoke}.
 *
 * @param correlation the caller's correlation context, or null to generate one
 * @param cancellation aborts the call when fired, or null for none
 * @param policy overrides the gateway's retry policy, or null
 * @param useCache whether a cached answer may be served and the answer cached
 * @param mapping options handed to the mapper
 */
public record InvokeOptions(
        CorrelationContext correlation,
        CancellationSignal cancellation,
        RetryPolicy policy,
        boolean useCache,
        MappingOptions mapping
) {

    private static final InvokeOptions DEFAULTS = new InvokeOptions(null, null, null, true, MappingOptions.none());

    public InvokeOptions {
        Objects.requireNonNull(mapping, "mapping must not be null");
    }

    public static InvokeOptions defaults() {
        return DEFAULTS;
    }

    public InvokeOptions correlation(CorrelationContext correlation) {
        return new InvokeOptions(correlation, cancellation, policy, useCache, mapping);
    }

    public InvokeOptions correlationId(String correlationId) {
        return correlation(CorrelationContext.ofNullable(correlationId));
    }

    public InvokeOptions cancellation(CancellationSignal cancellation) {
        return new InvokeOptions(correlation, cancellation, policy, useCache, mapping);
    }

    public InvokeOptions policy(RetryPolicy policy) {
        return new InvokeOptions(correlation, cancellation, policy, useCache, mapping);
    }

    public InvokeOptions useCache(boolean useCache) {
        return new InvokeOptions(correlation, cancellation, policy, useCache, mapping);
    }

    public InvokeOptions mapping(MappingOptions mapping) {
        return new InvokeOptions(correlation, cancellation, policy, useCache, mapping);
    }
}
