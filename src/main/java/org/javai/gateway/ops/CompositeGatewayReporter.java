package org.javai.gateway.ops;

import org.javai.gateway.breaker.BreakerState;
import org.javai.gateway.failure.Failure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link GatewayReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws, the exception is logged
 * and the remaining reporters still run.
 *
 * <pre>{@code
 * GatewayReporter reporter = CompositeGatewayReporter.builder()
 *     .add(new Log4jGatewayReporter())
 *     .addIf(forensics, new JsonLinesGatewayReporter("msp"))
 *     .build();
 * }</pre>
 */
public final class CompositeGatewayReporter implements GatewayReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeGatewayReporter.class);

	private final List<GatewayReporter> reporters;

	private CompositeGatewayReporter(List<GatewayReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeGatewayReporter of(GatewayReporter... reporters) {
		return new CompositeGatewayReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeGatewayReporter of(Collection<? extends GatewayReporter> reporters) {
		return new CompositeGatewayReporter(new ArrayList<>(reporters));
	}

	/**
	 * Creates a builder for constructing a composite reporter.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(Failure failure) {
		fanOut("report", r -> r.report(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyLabel) {
		fanOut("reportRetryAttempt", r -> r.reportRetryAttempt(failure, attemptNumber, delay, policyLabel));
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts, String policyLabel) {
		fanOut("reportRetryExhausted", r -> r.reportRetryExhausted(failure, totalAttempts, policyLabel));
	}

	@Override
	public void reportFallback(Failure failure, String category, String reason) {
		fanOut("reportFallback", r -> r.reportFallback(failure, category, reason));
	}

	@Override
	public void reportBreakerTransition(String breakerName, BreakerState from, BreakerState to) {
		fanOut("reportBreakerTransition", r -> r.reportBreakerTransition(breakerName, from, to));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<GatewayReporter> call) {
		for (GatewayReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				log.warn("GatewayReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage());
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeGatewayReporter}.
	 */
	public static final class Builder {
		private final List<GatewayReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(GatewayReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, GatewayReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Builds the composite reporter.
		 *
		 * @return the composite reporter
		 */
		public CompositeGatewayReporter build() {
			return new CompositeGatewayReporter(reporters);
		}
	}
}
