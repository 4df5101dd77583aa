package org.javai.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.gateway.breaker.BreakerState;
import org.javai.gateway.breaker.CircuitBreaker;
import org.javai.gateway.breaker.CircuitBreakerRegistry;
import org.javai.gateway.cache.ResponseCache;
import org.javai.gateway.config.GatewayConfig;
import org.javai.gateway.failure.DeadlineExceededException;
import org.javai.gateway.failure.Failure;
import org.javai.gateway.failure.FailureClass;
import org.javai.gateway.failure.FailureClassifier;
import org.javai.gateway.failure.FailureKind;
import org.javai.gateway.failure.InvalidResponseException;
import org.javai.gateway.failure.TransientFailureClassifier;
import org.javai.gateway.fallback.FallbackEntry;
import org.javai.gateway.fallback.FallbackProvider;
import org.javai.gateway.health.ErrorAggregator;
import org.javai.gateway.health.ErrorContext;
import org.javai.gateway.health.ErrorStats;
import org.javai.gateway.health.HealthMonitor;
import org.javai.gateway.health.HealthStatus;
import org.javai.gateway.health.ServiceHealth;
import org.javai.gateway.health.ServiceState;
import org.javai.gateway.mapping.DataMapper;
import org.javai.gateway.mapping.MappingException;
import org.javai.gateway.mapping.MappingResult;
import org.javai.gateway.mapping.anomaly.AnomalyInput;
import org.javai.gateway.mapping.anomaly.AnomalyMapper;
import org.javai.gateway.mapping.anomaly.AnomalyReport;
import org.javai.gateway.mapping.budget.BudgetInput;
import org.javai.gateway.mapping.budget.BudgetMapper;
import org.javai.gateway.mapping.budget.BudgetOptimization;
import org.javai.gateway.mapping.churn.ChurnInput;
import org.javai.gateway.mapping.churn.ChurnMapper;
import org.javai.gateway.mapping.churn.ChurnPrediction;
import org.javai.gateway.mapping.demand.DemandForecast;
import org.javai.gateway.mapping.demand.DemandInput;
import org.javai.gateway.mapping.demand.DemandMapper;
import org.javai.gateway.mapping.pricing.PricingInput;
import org.javai.gateway.mapping.pricing.PricingMapper;
import org.javai.gateway.mapping.pricing.PricingRecommendation;
import org.javai.gateway.mapping.profitability.ProfitabilityInput;
import org.javai.gateway.mapping.profitability.ProfitabilityMapper;
import org.javai.gateway.mapping.profitability.ProfitabilityPrediction;
import org.javai.gateway.mapping.revenueleak.RevenueLeakInput;
import org.javai.gateway.mapping.revenueleak.RevenueLeakMapper;
import org.javai.gateway.mapping.revenueleak.RevenueLeakReport;
import org.javai.gateway.metrics.GatewayMetric;
import org.javai.gateway.metrics.MetricsGatewayReporter;
import org.javai.gateway.metrics.MetricsRegistry;
import org.javai.gateway.metrics.PerformanceTracker;
import org.javai.gateway.metrics.RequestOutcome;
import org.javai.gateway.ops.GatewayReporter;
import org.javai.gateway.ops.Log4jGatewayReporter;
import org.javai.gateway.ops.UncaughtFailureHandler;
import org.javai.gateway.retry.BatchResult;
import org.javai.gateway.retry.CancellationSignal;
import org.javai.gateway.retry.RetryExecutor;
import org.javai.gateway.retry.RetryPolicy;
import org.javai.gateway.retry.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Calls the prediction service on behalf of the rest of the backend.
 *
 * <p>Every call is validated and translated by the model's {@link DataMapper}, may be answered
 * from the response cache, runs through the {@link RetryExecutor} guarded by the target's circuit
 * breaker, and degrades to the category's fallback entry when the service cannot answer. Errors
 * feed the {@link ErrorAggregator} and every step is counted in the {@link MetricsRegistry}.
 *
 * <pre>{@code
 * try (PredictionGateway gateway = PredictionGateway.builder(transport).build()) {
 *     GatewayOutcome<ChurnPrediction> outcome = gateway.predictChurn(input, InvokeOptions.defaults()).join();
 * }
 * }</pre>
 *
 * <p>A mapping error on the way out always fails the call: a malformed request is a bug of the
 * caller, not a reason to serve a fallback.
 */
public final class PredictionGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PredictionGateway.class);

    static final String CACHE_NAME = "responses";

    private final PredictionTransport transport;
    private final GatewayConfig config;
    private final FailureClassifier classifier;
    private final GatewayReporter reporter;
    private final FallbackProvider fallbacks;
    private final ErrorAggregator errors;
    private final MetricsRegistry metrics;
    private final CircuitBreakerRegistry breakers;
    private final RetryExecutor executor;
    private final RetryPolicy defaultPolicy;
    private final ResponseCache cache;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final List<ScheduledFuture<?>> housekeeping;
    private final HealthMonitor monitor;

    private final ProfitabilityMapper profitabilityMapper;
    private final ChurnMapper churnMapper;
    private final RevenueLeakMapper revenueLeakMapper;
    private final PricingMapper pricingMapper;
    private final BudgetMapper budgetMapper;
    private final DemandMapper demandMapper;
    private final AnomalyMapper anomalyMapper;

    private PredictionGateway(Builder builder) {
        this.transport = builder.transport;
        this.config = builder.config != null ? builder.config : GatewayConfig.load();
        Clock clock = builder.clock;
        this.classifier = builder.classifier;
        this.fallbacks = builder.fallbacks != null ? builder.fallbacks : FallbackProvider.withDefaults(clock);
        fallbacks.requireRegistered(builder.routedCategories);

        this.metrics = builder.metrics != null ? builder.metrics : new MetricsRegistry(
                new PerformanceTracker(config.performanceWindow(), config.staleRequestAge(), clock));
        this.errors = builder.errors != null ? builder.errors
                : new ErrorAggregator(classifier, config.errorRetention(), clock);
        this.reporter = GatewayReporter.composite(builder.reporter, new MetricsGatewayReporter(metrics));

        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownsScheduler = false;
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(
                    new UncaughtFailureHandler(classifier, reporter).threadFactory("gateway-scheduler"));
            this.ownsScheduler = true;
        }

        this.breakers = new CircuitBreakerRegistry(config.breakerConfig(classifier), clock);
        breakers.addListener(reporter::reportBreakerTransition);
        CircuitBreaker target = breakers.breaker(config.targetName());
        metrics.set(GatewayMetric.CIRCUIT_BREAKER_STATE, Map.of("breaker", target.name()),
                BreakerState.CLOSED.gaugeValue());

        this.executor = RetryExecutor.builder()
                .scheduler(scheduler)
                .reporter(reporter)
                .classifier(classifier)
                .clock(clock)
                .build();
        this.defaultPolicy = config.retryPolicy(classifier);
        this.cache = config.cacheEnabled() ? new ResponseCache(config.cacheMaxSize(), config.cacheTtl()) : null;

        this.housekeeping = List.of(
                errors.startSweeping(scheduler, config.errorSweepInterval()),
                metrics.startCleanup(scheduler, config.metricsCleanupInterval()));
        this.monitor = new HealthMonitor(config.targetName(), transport::checkHealth, config.healthMonitor(),
                scheduler, clock);
        if (config.healthMonitor().enabled()) {
            monitor.start();
        }

        this.profitabilityMapper = new ProfitabilityMapper(clock);
        this.churnMapper = new ChurnMapper(clock);
        this.revenueLeakMapper = new RevenueLeakMapper(clock);
        this.pricingMapper = new PricingMapper(clock);
        this.budgetMapper = new BudgetMapper(clock);
        this.demandMapper = new DemandMapper(clock);
        this.anomalyMapper = new AnomalyMapper(clock);

        log.info("Prediction gateway for [{}] started: {} fallback categories, cache {}",
                config.targetName(), fallbacks.registeredCategories().size(),
                cache == null ? "disabled" : "enabled");
    }

    public static Builder builder(PredictionTransport transport) {
        return new Builder(transport);
    }

    // ---------------------------------------------------------------------------------------------
    // Typed entry points
    // ---------------------------------------------------------------------------------------------

    public CompletableFuture<GatewayOutcome<ProfitabilityPrediction>> predictProfitability(
            ProfitabilityInput input, InvokeOptions options) {
        return invoke(profitabilityMapper, input, options);
    }

    public CompletableFuture<GatewayOutcome<ChurnPrediction>> predictChurn(ChurnInput input, InvokeOptions options) {
        return invoke(churnMapper, input, options);
    }

    public CompletableFuture<GatewayOutcome<RevenueLeakReport>> detectRevenueLeaks(
            RevenueLeakInput input, InvokeOptions options) {
        return invoke(revenueLeakMapper, input, options);
    }

    public CompletableFuture<GatewayOutcome<PricingRecommendation>> recommendPricing(
            PricingInput input, InvokeOptions options) {
        return invoke(pricingMapper, input, options);
    }

    public CompletableFuture<GatewayOutcome<BudgetOptimization>> optimizeBudget(
            BudgetInput input, InvokeOptions options) {
        return invoke(budgetMapper, input, options);
    }

    public CompletableFuture<GatewayOutcome<DemandForecast>> forecastDemand(DemandInput input, InvokeOptions options) {
        return invoke(demandMapper, input, options);
    }

    public CompletableFuture<GatewayOutcome<AnomalyReport>> detectAnomalies(AnomalyInput input, InvokeOptions options) {
        return invoke(anomalyMapper, input, options);
    }

    // ---------------------------------------------------------------------------------------------
    // Generic invocation
    // ---------------------------------------------------------------------------------------------

    public <I, R> CompletableFuture<GatewayOutcome<R>> invoke(DataMapper<I, R> mapper, I input) {
        return invoke(mapper, input, InvokeOptions.defaults());
    }

    /**
     * Calls the model behind {@code mapper} with {@code input}.
     *
     * @return a future that completes with a live or degraded outcome, or exceptionally with a
     *         {@link MappingException}, a cancellation, or a failure that no fallback covers
     */
    public <I, R> CompletableFuture<GatewayOutcome<R>> invoke(DataMapper<I, R> mapper, I input, InvokeOptions options) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(options, "options must not be null");
        CorrelationContext correlation = options.correlation() != null ? options.correlation() : CorrelationContext.generate();
        try (CorrelationContext.Scope ignored = correlation.bind()) {
            return start(mapper, input, options, correlation);
        }
    }

    private <I, R> CompletableFuture<GatewayOutcome<R>> start(
            DataMapper<I, R> mapper, I input, InvokeOptions options, CorrelationContext correlation) {
        ModelType type = mapper.modelType();
        String operation = type.qualifiedOperation();
        String correlationId = correlation.correlationId();

        MappingResult validation = mapper.validateInternal(input);
        if (!validation.isValid()) {
            return failFast(new MappingException(operation, validation), operation, correlationId);
        }
        if (!validation.warnings().isEmpty()) {
            log.debug("[{}] {} request has warnings: {}", correlationId, operation, validation.warnings());
        }

        ObjectNode body;
        try {
            body = mapper.toExternal(input, options.mapping());
        } catch (MappingException e) {
            return failFast(e, operation, correlationId);
        }

        String cacheKey = null;
        if (cache != null && options.useCache()) {
            cacheKey = mapper.cacheKey(input, options.mapping());
            Optional<R> cached = cache.get(cacheKey, mapper.resultType());
            recordCacheLookup(cached.isPresent());
            if (cached.isPresent()) {
                log.debug("[{}] {} served from cache under [{}]", correlationId, operation, cacheKey);
                served(type, "cache");
                return CompletableFuture.completedFuture(new GatewayOutcome.Live<>(cached.get(), correlationId, true));
            }
        }

        RetryPolicy policy = options.policy() != null ? options.policy() : defaultPolicy;
        CancellationSignal cancellation = options.cancellation() != null ? options.cancellation() : CancellationSignal.create();
        String requestId = UUID.randomUUID().toString();
        metrics.startRequest(requestId, Map.of(
                "model_type", type.category(),
                "operation", type.operation(),
                "correlationId", correlationId));
        long startedNanos = System.nanoTime();

        PredictionCall call = PredictionCall.of(type, body, correlationId);
        AtomicInteger attempts = new AtomicInteger();
        RunContext context = RunContext.of(operation)
                .withCorrelationId(correlationId)
                .withBreaker(breakers.breaker(config.targetName()))
                .withCancellation(cancellation)
                .withAttemptListener(failure -> recordError(failure.exception(), type, correlationId,
                        failure.attempt(), policy.maxRetries()));

        String key = cacheKey;
        return executor.run(() -> send(call, attempts), policy, context)
                .handle((response, error) -> {
                    try (CorrelationContext.Scope ignored = correlation.bind()) {
                        CompletableFuture<GatewayOutcome<R>> outcome = error == null
                                ? onResponse(mapper, response, options, key, correlationId, attempts.get(), policy)
                                : onFailure(type, FailureClassifier.unwrap(error), correlationId, attempts.get(), policy);
                        outcome.whenComplete((result, failure) -> finish(
                                type, requestId, startedNanos, outcomeOf(result, failure)));
                        return outcome;
                    }
                })
                .thenCompose(outcome -> outcome);
    }

    private CompletionStage<JsonNode> send(PredictionCall call, AtomicInteger attempts) {
        int attempt = attempts.incrementAndGet();
        log.debug("[{}] Sending {} attempt {} to {}", call.correlationId(),
                call.modelType().qualifiedOperation(), attempt, call.endpoint());
        return transport.send(call);
    }

    private <I, R> CompletableFuture<GatewayOutcome<R>> onResponse(
            DataMapper<I, R> mapper, JsonNode response, InvokeOptions options, String cacheKey,
            String correlationId, int attempts, RetryPolicy policy) {
        ModelType type = mapper.modelType();
        MappingResult check = mapper.validateExternal(response);
        if (!check.isValid()) {
            InvalidResponseException invalid = new InvalidResponseException(type.qualifiedOperation(), check.errors());
            recordError(invalid, type, correlationId, attempts, policy.maxRetries());
            return onFailure(type, invalid, correlationId, attempts, policy);
        }
        R value;
        try {
            value = mapper.fromExternal(response, options.mapping());
        } catch (RuntimeException e) {
            InvalidResponseException invalid = new InvalidResponseException(
                    type.qualifiedOperation(), List.of(String.valueOf(e.getMessage())));
            invalid.initCause(e);
            recordError(invalid, type, correlationId, attempts, policy.maxRetries());
            return onFailure(type, invalid, correlationId, attempts, policy);
        }
        if (cacheKey != null) {
            cache.put(cacheKey, value);
        }
        if (config.refreshFallbackOnSuccess()) {
            JsonNode data = response.has("data") ? response.get("data") : response;
            fallbacks.set(type, data, "Last successful response");
        }
        served(type, "live");
        return CompletableFuture.completedFuture(new GatewayOutcome.Live<>(value, correlationId, false));
    }

    private <R> CompletableFuture<GatewayOutcome<R>> onFailure(
            ModelType type, Throwable error, String correlationId, int attempts, RetryPolicy policy) {
        String operation = type.qualifiedOperation();
        FailureKind kind = classifier.classify(operation, error);
        Failure failure = Failure.of(kind, error, operation, correlationId, Math.max(attempts, 1));
        FailureClass failureClass = kind.failureClass();

        if (error instanceof DeadlineExceededException) {
            recordError(error, type, correlationId, attempts, policy.maxRetries());
        }
        if (!failureClass.fallbackEligible()) {
            log.debug("[{}] {} failed with {}, not eligible for fallback", correlationId, operation, kind.code());
            return CompletableFuture.failedFuture(error);
        }
        boolean registered = fallbacks.isRegistered(type);
        if (!registered && !failureClass.recoverable()) {
            log.warn("[{}] {} failed with {} and no fallback is registered", correlationId, operation, kind.code());
            return CompletableFuture.failedFuture(error);
        }

        FallbackEntry entry = fallbacks.get(type, correlationId);
        reporter.reportFallback(failure, type.category(), entry.reason());
        served(type, "fallback");
        return CompletableFuture.completedFuture(new GatewayOutcome.Degraded<>(entry, failure));
    }

    private <R> CompletableFuture<GatewayOutcome<R>> failFast(RuntimeException error, String operation, String correlationId) {
        reporter.report(Failure.of(classifier.classify(operation, error), error, operation, correlationId, 0));
        return CompletableFuture.failedFuture(error);
    }

    // ---------------------------------------------------------------------------------------------
    // Batch invocation
    // ---------------------------------------------------------------------------------------------

    /**
     * Calls the model once per input, at most {@link GatewayConfig#batchConcurrency()} calls in
     * flight. Each call retries and degrades on its own, so the batch only fails for inputs whose
     * call fails outright; those errors are collected, not thrown.
     */
    public <I, R> CompletableFuture<BatchResult<GatewayOutcome<R>>> invokeAll(
            DataMapper<I, R> mapper, List<I> inputs, InvokeOptions options) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(options, "options must not be null");
        ModelType type = mapper.modelType();
        CorrelationContext batchCorrelation = options.correlation() != null
                ? options.correlation() : CorrelationContext.generate();

        List<Supplier<CompletionStage<GatewayOutcome<R>>>> calls = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            I input = inputs.get(i);
            InvokeOptions itemOptions = options.correlation(
                    CorrelationContext.of(batchCorrelation.correlationId() + "-" + i));
            calls.add(() -> invoke(mapper, input, itemOptions));
        }

        RunContext context = RunContext.of(type.qualifiedOperation() + ".batch")
                .withCorrelationId(batchCorrelation.correlationId());
        if (options.cancellation() != null) {
            context = context.withCancellation(options.cancellation());
        }
        return executor.runBatch(calls, RetryPolicy.noRetry(), config.batchOptions(), context)
                .whenComplete((result, error) -> {
                    String status;
                    if (error != null || (result.successCount() == 0 && result.size() > 0)) {
                        status = "failed";
                    } else if (result.failureCount() > 0) {
                        status = "partial";
                    } else {
                        status = "completed";
                    }
                    metrics.increment(GatewayMetric.BATCH_JOBS, Map.of("job_type", type.category(), "status", status));
                    log.info("[{}] Batch {} of {} items {}", batchCorrelation.correlationId(),
                            type.qualifiedOperation(), inputs.size(), status);
                });
    }

    // ---------------------------------------------------------------------------------------------
    // Health and administration
    // ---------------------------------------------------------------------------------------------

    public GatewayHealth health() {
        ErrorStats stats = errors.getStats();
        HealthStatus status = stats.healthStatus();
        if (!breakers.allClosed()) {
            status = status.atLeast(HealthStatus.WARNING);
        }
        ServiceHealth service = monitor.status();
        if (service.state() == ServiceState.DOWN) {
            status = status.atLeast(HealthStatus.CRITICAL);
        }
        return new GatewayHealth(status, stats, breakers.states(), service);
    }

    public void registerFallback(ModelType category, JsonNode payload) {
        fallbacks.set(category, payload);
    }

    public void registerFallback(ModelType category, JsonNode payload, String reason) {
        fallbacks.set(category, payload, reason);
    }

    public GatewayConfig config() {
        return config;
    }

    public MetricsRegistry metrics() {
        return metrics;
    }

    public ErrorAggregator errors() {
        return errors;
    }

    public FallbackProvider fallbacks() {
        return fallbacks;
    }

    public CircuitBreakerRegistry breakers() {
        return breakers;
    }

    /**
     * The active checker of the downstream health endpoint. Started on construction when
     * {@code gateway.health.monitor.enabled} is set, otherwise only run on demand.
     */
    public HealthMonitor healthMonitor() {
        return monitor;
    }

    public RetryExecutor.RetryStats retryStats() {
        return executor.stats();
    }

    /**
     * @return the response cache, or empty when caching is disabled
     */
    public Optional<ResponseCache> cache() {
        return Optional.ofNullable(cache);
    }

    /**
     * Stops health monitoring and the housekeeping tasks and, if the gateway created its scheduler, shuts it down.
     * Calls still in flight may fail once the scheduler is gone.
     */
    @Override
    public void close() {
        monitor.stop();
        housekeeping.forEach(task -> task.cancel(false));
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        log.info("Prediction gateway for [{}] closed", config.targetName());
    }

    // ---------------------------------------------------------------------------------------------
    // Bookkeeping
    // ---------------------------------------------------------------------------------------------

    private void recordError(Throwable error, ModelType type, String correlationId, int attempt, int maxRetries) {
        if (classifier.classify(type.qualifiedOperation(), error).failureClass() == FailureClass.CANCELLED) {
            return;
        }
        errors.record(error, ErrorContext.builder()
                .service(config.targetName())
                .endpoint(type.endpoint())
                .operation(type.qualifiedOperation())
                .correlationId(correlationId)
                .attempt(attempt, maxRetries)
                .details(Map.of("modelType", type.category()))
                .build());
        metrics.set(GatewayMetric.ERROR_RATE, Map.of("service", config.targetName()),
                errors.getStats().errorRatePerMinute());
    }

    private void recordCacheLookup(boolean hit) {
        metrics.increment(GatewayMetric.CACHE_OPERATIONS, Map.of("operation", "get", "result", hit ? "hit" : "miss"));
        metrics.set(GatewayMetric.CACHE_HIT_RATE, Map.of("cache", CACHE_NAME), cache.hitRate());
    }

    private void served(ModelType type, String source) {
        metrics.increment(GatewayMetric.PREDICTIONS_SERVED, Map.of("model_type", type.category(), "source", source));
    }

    private void finish(ModelType type, String requestId, long startedNanos, RequestOutcome outcome) {
        metrics.endRequest(requestId, outcome);
        Map<String, String> labels = Map.of(
                "model_type", type.category(),
                "operation", type.operation(),
                "status", outcome.label());
        metrics.increment(GatewayMetric.REQUESTS, labels);
        metrics.observeDuration(GatewayMetric.REQUEST_DURATION, labels,
                Duration.ofNanos(System.nanoTime() - startedNanos).toNanos() / 1e9);
    }

    private static RequestOutcome outcomeOf(GatewayOutcome<?> result, Throwable failure) {
        if (failure != null) {
            return RequestOutcome.FAILURE;
        }
        return result.isFallback() ? RequestOutcome.FALLBACK : RequestOutcome.SUCCESS;
    }

    /**
     * Assembles a gateway. Only the transport is required; every other collaborator defaults to
     * the configured one.
     */
    public static final class Builder {

        private final PredictionTransport transport;
        private GatewayConfig config;
        private ScheduledExecutorService scheduler;
        private GatewayReporter reporter = new Log4jGatewayReporter();
        private FallbackProvider fallbacks;
        private MetricsRegistry metrics;
        private ErrorAggregator errors;
        private FailureClassifier classifier = new TransientFailureClassifier();
        private Clock clock = Clock.systemUTC();
        private Set<ModelType> routedCategories = EnumSet.allOf(ModelType.class);

        private Builder(PredictionTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport must not be null");
        }

        public Builder config(GatewayConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Uses the given scheduler for backoff waits and housekeeping. The gateway does not shut
         * it down on close.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
            return this;
        }

        public Builder reporter(GatewayReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder fallbacks(FallbackProvider fallbacks) {
            this.fallbacks = Objects.requireNonNull(fallbacks, "fallbacks must not be null");
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
            return this;
        }

        public Builder errors(ErrorAggregator errors) {
            this.errors = Objects.requireNonNull(errors, "errors must not be null");
            return this;
        }

        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * The categories this gateway serves. Each must have a fallback entry registered, or
         * {@link #build()} fails.
         */
        public Builder routedCategories(Set<ModelType> categories) {
            Objects.requireNonNull(categories, "categories must not be null");
            this.routedCategories = categories.isEmpty() ? EnumSet.noneOf(ModelType.class) : EnumSet.copyOf(categories);
            return this;
        }

        /**
         * @throws IllegalStateException if a routed category has no fallback entry
         */
        public PredictionGateway build() {
            return new PredictionGateway(this);
        }
    }
}
