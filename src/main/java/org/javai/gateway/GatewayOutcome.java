package org.javai.gateway;

import org.javai.gateway.failure.Failure;
import org.javai.gateway.fallback.FallbackEntry;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * What a gateway call produced: either a {@link Live} result decoded from the downstream
 * service, or a {@link Degraded} fallback served because the service could not be reached.
 *
 * @param <R> the typed result of the model
 */
public sealed interface GatewayOutcome<R> permits GatewayOutcome.Live, GatewayOutcome.Degraded {

    /**
     * A real answer.
     *
     * @param result the decoded result
     * @param correlationId the id of the request
     * @param fromCache whether the answer came from the response cache
     */
    record Live<R>(R result, String correlationId, boolean fromCache) implements GatewayOutcome<R> {

        public Live {
            Objects.requireNonNull(result, "result must not be null");
            Objects.requireNonNull(correlationId, "correlationId must not be null");
        }

        @Override
        public boolean isFallback() {
            return false;
        }

        @Override
        public Optional<R> value() {
            return Optional.of(result);
        }

        @Override
        public <U> U fold(Function<? super R, ? extends U> onLive, Function<? super FallbackEntry, ? extends U> onFallback) {
            Objects.requireNonNull(onLive);
            return onLive.apply(result);
        }

        @Override
        public <U> GatewayOutcome<U> map(Function<? super R, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Live<>(mapper.apply(result), correlationId, fromCache);
        }
    }

    /**
     * A fallback entry served in place of a live answer.
     *
     * @param fallback the entry served; always marked as a fallback
     * @param cause the failure that made the live call impossible
     */
    record Degraded<R>(FallbackEntry fallback, Failure cause) implements GatewayOutcome<R> {

        public Degraded {
            Objects.requireNonNull(fallback, "fallback must not be null");
            Objects.requireNonNull(cause, "cause must not be null");
        }

        @Override
        public boolean isFallback() {
            return true;
        }

        @Override
        public String correlationId() {
            return fallback.correlationId();
        }

        @Override
        public Optional<R> value() {
            return Optional.empty();
        }

        @Override
        public <U> U fold(Function<? super R, ? extends U> onLive, Function<? super FallbackEntry, ? extends U> onFallback) {
            Objects.requireNonNull(onFallback);
            return onFallback.apply(fallback);
        }

        @Override
        public <U> GatewayOutcome<U> map(Function<? super R, ? extends U> mapper) {
            return new Degraded<>(fallback, cause);
        }
    }

    boolean isFallback();

    String correlationId();

    /**
     * @return the live value, or empty for a fallback
     */
    Optional<R> value();

    /**
     * Collapses the outcome to a single value.
     */
    <U> U fold(Function<? super R, ? extends U> onLive, Function<? super FallbackEntry, ? extends U> onFallback);

    /**
     * Transforms a live value; a fallback passes through unchanged.
     */
    <U> GatewayOutcome<U> map(Function<? super R, ? extends U> mapper);
}
