package org.javai.restretry.retry;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import org.javai.restretry.Config;
import org.javai.restretry.Failure;

/**
 * Fixed-delay retry policy: at most {@code maxAttempts} attempts with {@code retryDelay}
 * between consecutive attempts. Only transient failures are retried.
 *
 * <p>A {@code maxAttempts} of zero or less is accepted; {@link Retrier} treats it as a
 * misconfiguration and reports it instead of running the operation.
 *
 * @param maxAttempts total attempts allowed, including the first
 * @param retryDelay pause between attempts; zero retries immediately
 */
public record RetryPolicy(int maxAttempts, Duration retryDelay) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);

    static final String MAX_ATTEMPTS_PROPERTY = "restretry.maxAttempts";
    static final String MAX_ATTEMPTS_ENV = "RESTRETRY_MAX_ATTEMPTS";
    static final String RETRY_DELAY_PROPERTY = "restretry.retryDelay";
    static final String RETRY_DELAY_ENV = "RESTRETRY_RETRY_DELAY";

    public RetryPolicy {
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative, was: " + retryDelay);
        }
    }

    /**
     * 3 attempts, 5 seconds apart.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_DELAY);
    }

    public static RetryPolicy of(int maxAttempts, Duration retryDelay) {
        return new RetryPolicy(maxAttempts, retryDelay);
    }

    /**
     * Retries without pausing. Handy in tests.
     */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO);
    }

    /**
     * Reads the policy from system properties, falling back to environment variables and then
     * to the defaults:
     * <ul>
     *   <li>{@code restretry.maxAttempts} / {@code RESTRETRY_MAX_ATTEMPTS} - an integer</li>
     *   <li>{@code restretry.retryDelay} / {@code RESTRETRY_RETRY_DELAY} - an ISO-8601 duration, e.g. {@code PT2S}</li>
     * </ul>
     *
     * @throws IllegalStateException if a value is set but malformed
     */
    public static RetryPolicy fromConfiguration() {
        int maxAttempts = Config.resolve(MAX_ATTEMPTS_PROPERTY, MAX_ATTEMPTS_ENV)
                .map(RetryPolicy::parseMaxAttempts)
                .orElse(DEFAULT_MAX_ATTEMPTS);
        Duration retryDelay = Config.resolve(RETRY_DELAY_PROPERTY, RETRY_DELAY_ENV)
                .map(RetryPolicy::parseRetryDelay)
                .orElse(DEFAULT_RETRY_DELAY);
        return new RetryPolicy(maxAttempts, retryDelay);
    }

    /**
     * Decides what to do after attempt {@code attempt} (0-based) failed.
     * Fatal failures are rethrown regardless of how many attempts remain.
     */
    public RetryDecision decide(int attempt, Failure failure) {
        if (!failure.isTransient()) {
            return RetryDecision.Rethrow.because("failure is not retryable");
        }
        if (attempt < maxAttempts - 1) {
            return RetryDecision.Retry.after(retryDelay);
        }
        return RetryDecision.Suppress.because("max attempts reached");
    }

    private static int parseMaxAttempts(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Invalid " + MAX_ATTEMPTS_PROPERTY + ": '" + value + "' is not an integer", e);
        }
    }

    private static Duration parseRetryDelay(String value) {
        try {
            Duration delay = Duration.parse(value);
            if (delay.isNegative()) {
                throw new IllegalStateException(
                        "Invalid " + RETRY_DELAY_PROPERTY + ": '" + value + "' is negative");
            }
            return delay;
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                    "Invalid " + RETRY_DELAY_PROPERTY + ": '" + value + "' is not an ISO-8601 duration", e);
        }
    }
}
