package org.javai.gateway.retry;

import org.javai.gateway.breaker.CircuitBreaker;
import org.javai.gateway.failure.DeadlineExceededException;
import org.javai.gateway.failure.Failure;
import org.javai.gateway.failure.FailureClassifier;
import org.javai.gateway.failure.FailureKind;
import org.javai.gateway.failure.TransientFailureClassifier;
import org.javai.gateway.ops.GatewayReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Executes asynchronous operations with retry according to a {@link RetryPolicy}.
 *
 * <p>Nothing blocks: attempts are chained on the completion of the previous one and backoff
 * delays are scheduled on a shared {@link ScheduledExecutorService}. Within one call attempts are
 * strictly sequential. When a {@link CircuitBreaker} is supplied in the {@link RunContext}, every
 * attempt goes through it.
 *
 * <p>The returned future fails with the error of the last attempt once retries are exhausted or
 * the policy rejects the error, with a {@link CancellationException} when the call's
 * {@link CancellationSignal} fires, and with a {@link DeadlineExceededException} when the
 * policy's overall timeout elapses.
 *
 * <pre>{@code
 * RetryExecutor executor = RetryExecutor.builder()
 *     .scheduler(scheduler)
 *     .reporter(reporter)
 *     .build();
 *
 * CompletableFuture<JsonNode> response = executor.run(
 *     () -> transport.send(call),
 *     RetryPolicy.externalServiceDefault(),
 *     RunContext.of("churn.predict").withBreaker(breaker));
 * }</pre>
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ScheduledExecutorService scheduler;
    private final DelayScheduler delayScheduler;
    private final GatewayReporter reporter;
    private final FailureClassifier classifier;
    private final DoubleSupplier random;
    private final Clock clock;

    private final AtomicLong totalRuns = new AtomicLong();
    private final AtomicLong firstAttemptSuccesses = new AtomicLong();
    private final AtomicLong successesAfterRetry = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();

    private RetryExecutor(Builder builder) {
        this.scheduler = builder.scheduler;
        this.delayScheduler = builder.delayScheduler != null ? builder.delayScheduler : DelayScheduler.of(builder.scheduler);
        this.reporter = builder.reporter;
        this.classifier = builder.classifier;
        this.random = builder.random;
        this.clock = builder.clock;
    }

    /**
     * Creates a builder for configuring a RetryExecutor.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a RetryExecutor.
     */
    public static final class Builder {
        private ScheduledExecutorService scheduler;
        private DelayScheduler delayScheduler;
        private GatewayReporter reporter = GatewayReporter.noOp();
        private FailureClassifier classifier = new TransientFailureClassifier();
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Sets the scheduler used for backoff delays and deadlines (required).
         *
         * @param scheduler the shared scheduler
         * @return this builder
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         *
         * @param reporter the reporter for retry events
         * @return this builder
         */
        public Builder reporter(GatewayReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the classifier used to label failures in reports (optional).
         *
         * @param classifier the failure classifier
         * @return this builder
         */
        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the clock (optional, defaults to UTC system clock).
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets the backoff scheduler for testing (package-private).
         */
        Builder delayScheduler(DelayScheduler delayScheduler) {
            this.delayScheduler = Objects.requireNonNull(delayScheduler, "delayScheduler must not be null");
            return this;
        }

        /**
         * Sets the jitter source for testing (package-private).
         */
        Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random must not be null");
            return this;
        }

        /**
         * Builds the RetryExecutor.
         *
         * @return a configured RetryExecutor
         * @throws NullPointerException if no scheduler has been set
         */
        public RetryExecutor build() {
            Objects.requireNonNull(scheduler, "scheduler must be set");
            return new RetryExecutor(this);
        }
    }

    /**
     * Runs an operation under the given policy with no breaker and no external cancellation.
     */
    public <T> CompletableFuture<T> run(Supplier<? extends CompletionStage<T>> operation, RetryPolicy policy) {
        return run(operation, policy, RunContext.of(policy.label()));
    }

    /**
     * Runs an operation under the given policy.
     *
     * @param operation supplies one attempt; called once per attempt
     * @param policy the retry policy
     * @param context breaker, cancellation signal and naming for this call
     * @return a future completed with the first successful value or the final error
     */
    public <T> CompletableFuture<T> run(
            Supplier<? extends CompletionStage<T>> operation,
            RetryPolicy policy,
            RunContext context
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(context, "context must not be null");

        totalRuns.incrementAndGet();
        Run<T> run = new Run<>(operation, policy, context);
        run.start();
        return run.result;
    }

    /**
     * Runs operations in chunks of {@code options.concurrency()}. Each chunk's operations run
     * concurrently through {@link #run}; the next chunk starts when the whole chunk has settled.
     *
     * <p>The future completes with a {@link BatchResult} indexed by original position. With
     * {@code failFast}, it instead fails with a {@link BatchAbortedException} after the first
     * chunk containing a failure, and later chunks never start.
     */
    public <T> CompletableFuture<BatchResult<T>> runBatch(
            List<? extends Supplier<? extends CompletionStage<T>>> operations,
            RetryPolicy policy,
            BatchOptions options
    ) {
        return runBatch(operations, policy, options, RunContext.of(policy.label()));
    }

    /**
     * As {@link #runBatch(List, RetryPolicy, BatchOptions)}, sharing the breaker and cancellation
     * signal of the given context across all operations.
     */
    public <T> CompletableFuture<BatchResult<T>> runBatch(
            List<? extends Supplier<? extends CompletionStage<T>>> operations,
            RetryPolicy policy,
            BatchOptions options,
            RunContext context
    ) {
        Objects.requireNonNull(operations, "operations must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Batch<T> batch = new Batch<>(List.copyOf(operations), policy, options, context);
        batch.runChunks(0);
        return batch.result;
    }

    /**
     * @return counters over every call run by this executor
     */
    public RetryStats stats() {
        return new RetryStats(
                totalRuns.get(),
                firstAttemptSuccesses.get(),
                successesAfterRetry.get(),
                failures.get(),
                retries.get());
    }

    /**
     * Counters over the calls run by one executor.
     *
     * @param totalRuns calls started
     * @param firstAttemptSuccesses calls that succeeded without a retry
     * @param successesAfterRetry calls that succeeded after at least one retry
     * @param failures calls that ended in an error, cancellation included
     * @param retries retries scheduled across all calls
     */
    public record RetryStats(long totalRuns, long firstAttemptSuccesses, long successesAfterRetry, long failures, long retries) {

        /**
         * @return share of completed calls that succeeded, 1.0 when nothing has completed
         */
        public double successRate() {
            long completed = firstAttemptSuccesses + successesAfterRetry + failures;
            return completed == 0 ? 1.0 : (double) (firstAttemptSuccesses + successesAfterRetry) / completed;
        }
    }

    /**
     * State of one retried call.
     */
    private final class Run<T> {
        private final Supplier<? extends CompletionStage<T>> operation;
        private final RetryPolicy policy;
        private final RunContext context;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private final AtomicBoolean settled = new AtomicBoolean(false);
        private final Instant deadline;

        private volatile CompletionStage<T> downstream;
        private volatile Future<?> pendingDelay;
        private volatile Future<?> deadlineTimer;
        private volatile Throwable lastError;

        Run(Supplier<? extends CompletionStage<T>> operation, RetryPolicy policy, RunContext context) {
            this.operation = operation;
            this.policy = policy;
            this.context = context;
            this.deadline = policy.overallTimeout() == null ? null : clock.instant().plus(policy.overallTimeout());
        }

        void start() {
            CancellationSignal.Registration registration = context.cancellation().onCancel(
                    () -> abort(new CancellationException("Call [" + context.operation() + "] cancelled")));
            if (policy.overallTimeout() != null) {
                deadlineTimer = scheduler.schedule(
                        () -> abort(new DeadlineExceededException(context.operation(), policy.overallTimeout(), lastError)),
                        policy.overallTimeout().toMillis(), TimeUnit.MILLISECONDS);
            }
            result.whenComplete((value, error) -> {
                registration.remove();
                Future<?> timer = deadlineTimer;
                if (timer != null) {
                    timer.cancel(false);
                }
            });
            attempt(0, Duration.ZERO);
        }

        private boolean finished() {
            return settled.get() || result.isDone();
        }

        void attempt(int index, Duration previousDelay) {
            if (finished()) {
                return;
            }
            Instant startedAt = clock.instant();
            CompletableFuture<T> call = context.breaker() != null
                    ? context.breaker().execute(this::callDownstream)
                    : callDownstream();

            call.whenComplete((value, error) -> {
                if (error == null) {
                    succeed(value, index);
                    return;
                }
                Throwable cause = FailureClassifier.unwrap(error);
                try {
                    onFailure(new Attempt(index, startedAt, cause), previousDelay);
                } catch (RuntimeException e) {
                    log.warn("Retry decision for [{}] failed on attempt {}: {}",
                            context.operation(), index + 1, e.getMessage(), e);
                    e.addSuppressed(cause);
                    fail(e);
                }
            });
        }

        private CompletableFuture<T> callDownstream() {
            CompletableFuture<T> call = new CompletableFuture<>();
            CompletionStage<T> stage = null;
            try {
                stage = Objects.requireNonNull(operation.get(), "operation returned null");
                downstream = stage;
                stage.whenComplete((value, error) -> {
                    if (error == null) {
                        call.complete(value);
                    } else {
                        call.completeExceptionally(FailureClassifier.unwrap(error));
                    }
                });
            } catch (RuntimeException e) {
                call.completeExceptionally(e);
            }
            if (policy.attemptTimeout() != null && stage != null) {
                CompletionStage<T> timed = stage;
                call.orTimeout(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .whenComplete((value, error) -> {
                            if (error instanceof TimeoutException) {
                                cancelDownstream(timed);
                            }
                        });
            }
            return call;
        }

        private void onFailure(Attempt attempt, Duration previousDelay) {
            Throwable error = attempt.error();
            lastError = error;
            if (finished()) {
                return;
            }

            FailureKind kind = classifier.classify(context.operation(), error);
            Failure failure = Failure.of(kind, error, context.operation(), context.correlationId(), attempt.number());
            try {
                context.attemptListener().onAttemptFailed(failure);
            } catch (RuntimeException e) {
                log.warn("Attempt listener of [{}] failed on attempt {}: {}",
                        context.operation(), attempt.number(), e.getMessage(), e);
            }
            RetryDecision decision = policy.decide(attempt, previousDelay, random.getAsDouble(), kind.retryAfter());

            if (decision instanceof RetryDecision.GiveUp giveUp) {
                log.debug("Giving up on [{}] after attempt {}: {} (correlationId={})",
                        context.operation(), attempt.number(), giveUp.reason(), context.correlationId());
                reporter.reportRetryExhausted(failure, attempt.number(), policy.label());
                fail(error);
                return;
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            if (deadline != null && clock.instant().plus(delay).isAfter(deadline)) {
                log.debug("Backoff of {}ms for [{}] would pass the deadline (correlationId={})",
                        delay.toMillis(), context.operation(), context.correlationId());
                reporter.reportRetryExhausted(failure, attempt.number(), policy.label());
                fail(new DeadlineExceededException(context.operation(), policy.overallTimeout(), error));
                return;
            }

            int retryNumber = attempt.number();
            retries.incrementAndGet();
            reporter.reportRetryAttempt(failure, retryNumber, delay, policy.label());
            try {
                policy.notifyRetry(error, retryNumber);
            } catch (RuntimeException e) {
                log.warn("onRetry hook of policy [{}] failed on retry {} of [{}]: {}",
                        policy.label(), retryNumber, context.operation(), e.getMessage(), e);
            }
            pendingDelay = delayScheduler.schedule(() -> attempt(retryNumber, delay), delay);
        }

        // Counters move before the future completes so that dependents observe them

        private void succeed(T value, int index) {
            if (settled.compareAndSet(false, true)) {
                (index == 0 ? firstAttemptSuccesses : successesAfterRetry).incrementAndGet();
                result.complete(value);
            }
        }

        private void fail(Throwable error) {
            if (settled.compareAndSet(false, true)) {
                failures.incrementAndGet();
                result.completeExceptionally(error);
            }
        }

        private void abort(Throwable reason) {
            if (!settled.compareAndSet(false, true)) {
                return;
            }
            failures.incrementAndGet();
            result.completeExceptionally(reason);
            Future<?> delay = pendingDelay;
            if (delay != null) {
                delay.cancel(false);
            }
            CompletionStage<T> inFlight = downstream;
            if (inFlight != null) {
                cancelDownstream(inFlight);
            }
        }

        private void cancelDownstream(CompletionStage<T> stage) {
            try {
                stage.toCompletableFuture().cancel(true);
            } catch (UnsupportedOperationException e) {
                log.debug("Downstream stage of [{}] cannot be cancelled", context.operation());
            }
        }
    }

    /**
     * State of one batch.
     */
    private final class Batch<T> {
        private final List<? extends Supplier<? extends CompletionStage<T>>> operations;
        private final RetryPolicy policy;
        private final BatchOptions options;
        private final RunContext context;
        private final List<T> results;
        private final List<Throwable> errors;
        private final CompletableFuture<BatchResult<T>> result = new CompletableFuture<>();

        Batch(List<? extends Supplier<? extends CompletionStage<T>>> operations, RetryPolicy policy,
              BatchOptions options, RunContext context) {
            this.operations = operations;
            this.policy = policy;
            this.options = options;
            this.context = context;
            this.results = new ArrayList<>(Arrays.asList(newArray(operations.size())));
            this.errors = new ArrayList<>(Arrays.asList(new Throwable[operations.size()]));
        }

        @SuppressWarnings("unchecked")
        private T[] newArray(int size) {
            return (T[]) new Object[size];
        }

        /**
         * Starts chunks from {@code start} onwards. Chunks that settle synchronously are handled in
         * this loop, so the stack does not grow with the number of chunks.
         */
        void runChunks(int start) {
            int next = start;
            while (next < operations.size()) {
                int end = Math.min(operations.size(), next + options.concurrency());
                CompletableFuture<Void> chunk = startChunk(next, end);
                if (!chunk.isDone()) {
                    int from = next;
                    chunk.whenComplete((ignored, error) -> {
                        if (proceedAfter(from, end)) {
                            runChunks(end);
                        }
                    });
                    return;
                }
                if (!proceedAfter(next, end)) {
                    return;
                }
                next = end;
            }
            result.complete(snapshot());
        }

        private CompletableFuture<Void> startChunk(int start, int end) {
            List<CompletableFuture<Void>> chunk = new ArrayList<>(end - start);
            for (int i = start; i < end; i++) {
                int index = i;
                RunContext itemContext = context.withOperation(context.operation() + "[" + index + "]");
                chunk.add(run(operations.get(index), policy, itemContext).handle((value, error) -> {
                    synchronized (this) {
                        if (error == null) {
                            results.set(index, value);
                        } else {
                            errors.set(index, FailureClassifier.unwrap(error));
                        }
                    }
                    return null;
                }));
            }
            return CompletableFuture.allOf(chunk.toArray(new CompletableFuture<?>[0]));
        }

        private boolean proceedAfter(int start, int end) {
            if (!options.failFast()) {
                return true;
            }
            BatchResult<T> soFar = snapshot();
            if (soFar.firstError().isEmpty()) {
                return true;
            }
            log.debug("Batch [{}] aborted after chunk {}-{}", context.operation(), start, end - 1);
            result.completeExceptionally(new BatchAbortedException(soFar.firstError().get(), soFar));
            return false;
        }

        private synchronized BatchResult<T> snapshot() {
            return new BatchResult<>(results, errors);
        }
    }
}
