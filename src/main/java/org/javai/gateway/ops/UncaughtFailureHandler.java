package org.javai.gateway.ops;

import org.javai.gateway.failure.Failure;
import org.javai.gateway.failure.FailureClassifier;
import org.javai.gateway.failure.FailureKind;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reports exceptions that escape a gateway worker thread. Callbacks scheduled by the retry
 * executor complete futures rather than throw, so anything arriving here is a defect.
 *
 * <pre>{@code
 * ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2,
 *     new UncaughtFailureHandler(classifier, reporter).threadFactory("gateway-scheduler"));
 * }</pre>
 */
public final class UncaughtFailureHandler implements UncaughtExceptionHandler {

	private final FailureClassifier classifier;
	private final GatewayReporter reporter;

	public UncaughtFailureHandler(FailureClassifier classifier, GatewayReporter reporter) {
		this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
		this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
	}

	@Override
	public void uncaughtException(Thread thread, Throwable throwable) {
		String operation = "UncaughtException:" + thread.getName();
		FailureKind kind = classifier.classify(operation, throwable);
		Failure failure = Failure.of(kind, throwable, operation, null, 0)
				.withTags(Map.of("thread.name", thread.getName(), "thread.id", String.valueOf(thread.getId())));
		reporter.report(failure);
	}

	/**
	 * Creates a factory for named daemon threads that report through this handler.
	 */
	public ThreadFactory threadFactory(String namePrefix) {
		return new ThreadFactory() {
			private final AtomicInteger counter = new AtomicInteger(0);

			@Override
			public Thread newThread(Runnable runnable) {
				Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
				thread.setDaemon(true);
				thread.setUncaughtExceptionHandler(UncaughtFailureHandler.this);
				return thread;
			}
		};
	}
}
