package org.javai.restretry.ops;

import org.javai.restretry.Failure;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Records failures for observability. Implementations might write structured logs or emit metrics.
 *
 * <p>The retry engine calls {@link #report(Failure)} at most once per logical operation,
 * so a reporter sees one record per failed call, never one per attempt.
 *
 * <p>Implementations must be safe for concurrent use and should not throw; the engine
 * catches anything a reporter throws so the call still completes.
 */
@FunctionalInterface
public interface FailureReporter {

	/**
	 * Records a failure occurrence.
	 */
	void report(Failure failure);

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static FailureReporter noOp() {
		return failure -> {};
	}

	/**
	 * Fans each failure out to every reporter in order.
	 *
	 * <p>A reporter that throws does not stop the ones after it. Once all have run, the first
	 * exception is rethrown with any later ones attached as suppressed, so the caller (normally
	 * the retry engine, which never lets a reporter fail a call) sees every fault.
	 *
	 * <pre>{@code
	 * FailureReporter reporter = FailureReporter.composite(
	 *     new Log4jFailureReporter(),
	 *     new MetricsFailureReporter("orders"));
	 * }</pre>
	 *
	 * @throws NullPointerException if any reporter is null
	 */
	static FailureReporter composite(FailureReporter... reporters) {
		return composite(Arrays.asList(reporters));
	}

	/**
	 * As {@link #composite(FailureReporter...)}; the collection is copied.
	 */
	static FailureReporter composite(Collection<? extends FailureReporter> reporters) {
		List<FailureReporter> targets = List.copyOf(reporters);
		return failure -> {
			RuntimeException first = null;
			for (FailureReporter target : targets) {
				try {
					target.report(failure);
				} catch (RuntimeException e) {
					if (first == null) {
						first = e;
					} else {
						first.addSuppressed(e);
					}
				}
			}
			if (first != null) {
				throw first;
			}
		};
	}
}
