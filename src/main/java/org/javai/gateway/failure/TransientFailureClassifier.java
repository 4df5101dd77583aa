package org.javai.gateway.failure;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies downstream failures into the gateway's error taxonomy.
 *
 * <p>Gateway exceptions carry their own class. JDK network exceptions (connection refused or
 * reset, DNS failure, socket and HTTP timeouts) and any other {@link IOException} are
 * {@link FailureClass#TRANSIENT_NETWORK}. A {@link TimeoutException}, which is what
 * {@code CompletableFuture.orTimeout} raises for an attempt timeout, is transient as well.
 * Everything else is {@link FailureClass#UNKNOWN} and therefore not retried.
 *
 * <p>This is the single source of truth for "is this retryable": the retry presets and the
 * error aggregator both delegate to it.
 */
public class TransientFailureClassifier implements FailureClassifier {

    @Override
    public FailureKind classify(String operation, Throwable throwable) {
        Throwable t = FailureClassifier.unwrap(throwable);

        if (t instanceof DownstreamStatusException status) {
            Duration retryAfter = status.retryAfter().orElse(null);
            return new FailureKind(status.code(), t.getMessage(), status.failureClass(), retryAfter);
        }

        if (t instanceof GatewayException gateway) {
            return FailureKind.of(gateway.code(), messageOf(t), gateway.failureClass());
        }

        if (t instanceof CancellationException) {
            return FailureKind.of(FailureCode.of("call", "cancelled"),
                    messageFor("Cancelled", t), FailureClass.CANCELLED);
        }

        if (t instanceof SocketTimeoutException) {
            return network("timeout", "Socket timeout", t);
        }

        if (t instanceof HttpTimeoutException) {
            return network("http_timeout", "HTTP timeout", t);
        }

        if (t instanceof ConnectException) {
            return network("connection_refused", "Connection refused", t);
        }

        if (t instanceof UnknownHostException) {
            return network("dns_failure", "Unknown host", t);
        }

        if (t instanceof NoRouteToHostException) {
            return network("no_route", "No route to host", t);
        }

        if (t instanceof SocketException) {
            return network("connection_reset", "Socket error", t);
        }

        if (t instanceof TimeoutException) {
            return network("attempt_timeout", "Attempt timeout", t);
        }

        if (t instanceof IOException) {
            return network("io_error", "IO error", t);
        }

        return FailureKind.of(FailureCode.of("unknown", t.getClass().getSimpleName()),
                messageOf(t), FailureClass.UNKNOWN);
    }

    private static FailureKind network(String name, String prefix, Throwable t) {
        return FailureKind.of(FailureCode.of("network", name), messageFor(prefix, t), FailureClass.TRANSIENT_NETWORK);
    }

    private static String messageFor(String prefix, Throwable t) {
        return t.getMessage() != null ? prefix + ": " + t.getMessage() : prefix;
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
