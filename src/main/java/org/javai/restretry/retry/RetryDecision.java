package org.javai.restretry.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision made by a retry policy after evaluating a failed attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.Suppress, RetryDecision.Rethrow {

    /**
     * Retry the operation after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Stop retrying, report the failure and hand the caller an empty result.
     */
    record Suppress(String reason) implements RetryDecision {
        public static Suppress because(String reason) {
            return new Suppress(reason);
        }
    }

    /**
     * Stop retrying, report the failure and propagate the original exception.
     */
    record Rethrow(String reason) implements RetryDecision {
        public static Rethrow because(String reason) {
            return new Rethrow(reason);
        }
    }
}
