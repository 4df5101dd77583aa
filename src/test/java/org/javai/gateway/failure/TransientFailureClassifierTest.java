package org.javai.gateway.failure;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class TransientFailureClassifierTest {

    private final TransientFailureClassifier classifier = new TransientFailureClassifier();

    @Test
    void networkErrors_areTransientAndRetryable() {
        assertThat(classifier.classify("op", new ConnectException("refused")).code())
                .isEqualTo(FailureCode.of("network", "connection_refused"));
        assertThat(classifier.classify("op", new UnknownHostException("ml.internal")).code())
                .isEqualTo(FailureCode.of("network", "dns_failure"));
        assertThat(classifier.classify("op", new SocketTimeoutException()).failureClass())
                .isEqualTo(FailureClass.TRANSIENT_NETWORK);
        assertThat(classifier.classify("op", new TimeoutException()).code().name())
                .isEqualTo("attempt_timeout");
        assertThat(classifier.isRetryable(new IOException("stream closed"))).isTrue();
    }

    @Test
    void statusCodes_mapToTheirClasses() {
        assertThat(classifier.classify("op", new DownstreamStatusException(408, "timeout")).failureClass())
                .isEqualTo(FailureClass.TRANSIENT_NETWORK);
        assertThat(classifier.classify("op", new DownstreamStatusException(429, "slow down")).failureClass())
                .isEqualTo(FailureClass.RATE_LIMITED);
        assertThat(classifier.classify("op", new DownstreamStatusException(504, "gateway timeout")).failureClass())
                .isEqualTo(FailureClass.DOWNSTREAM_SERVER);
        FailureKind client = classifier.classify("op", new DownstreamStatusException(422, "unprocessable"));
        assertThat(client.failureClass()).isEqualTo(FailureClass.DOWNSTREAM_CLIENT);
        assertThat(client.code().toString()).isEqualTo("http:422");
        assertThat(client.retryable()).isFalse();
    }

    @Test
    void retryAfter_isCarriedFromRateLimitResponse() {
        FailureKind kind = classifier.classify("op",
                new DownstreamStatusException(429, "slow down", Duration.ofSeconds(7)));

        assertThat(kind.retryAfter()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void wrappers_areUnwrapped() {
        Throwable wrapped = new CompletionException(new ExecutionException(new ConnectException("refused")));

        assertThat(classifier.classify("op", wrapped).failureClass()).isEqualTo(FailureClass.TRANSIENT_NETWORK);
    }

    @Test
    void cancellation_isNeitherRetriedNorRecovered() {
        FailureKind kind = classifier.classify("op", new CancellationException("caller aborted"));

        assertThat(kind.failureClass()).isEqualTo(FailureClass.CANCELLED);
        assertThat(kind.failureClass().fallbackEligible()).isFalse();
    }

    @Test
    void unrecognisedErrors_areUnknown() {
        FailureKind kind = classifier.classify("op", new IllegalArgumentException("boom"));

        assertThat(kind.code()).isEqualTo(FailureCode.of("unknown", "IllegalArgumentException"));
        assertThat(kind.message()).isEqualTo("boom");
        assertThat(kind.retryable()).isFalse();
    }
}
