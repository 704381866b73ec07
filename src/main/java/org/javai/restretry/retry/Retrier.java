package org.javai.restretry.retry;

import org.javai.restretry.Failure;
import org.javai.restretry.FailureId;
import org.javai.restretry.classify.FailureClassifier;
import org.javai.restretry.classify.TransportFailureClassifier;
import org.javai.restretry.ops.FailureReporter;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Executes asynchronous operations under a fixed-delay {@link RetryPolicy}.
 *
 * <p>Every failed attempt is classified. Transient failures are retried until the policy runs
 * out of attempts, after which the returned future completes with {@code null}. Fatal failures
 * are never retried: the returned future fails with the original exception. Either way the
 * reporter is called exactly once for a call that does not succeed, and never for one that does.
 *
 * <p>A Retrier holds no per-call state and may be shared by concurrent callers. The pause
 * between attempts is a delayed continuation, not a blocking sleep; cancelling the returned
 * future abandons the pending pause or in-flight attempt and stops retrying.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .policy(RetryPolicy.of(3, Duration.ofSeconds(2)))
 *     .reporter(new Log4jFailureReporter())
 *     .build();
 *
 * CompletableFuture<Order> order = retrier.execute("OrdersApi.fetch", () -> api.fetch(orderId));
 * }</pre>
 */
public final class Retrier {

    static final FailureId EXHAUSTED_WITHOUT_OUTCOME = FailureId.of("retry", "exhausted_without_outcome");

    private static final int SUSPENDED = -1;
    private static final int UNCLAIMED = Integer.MIN_VALUE;

    private final RetryPolicy policy;
    private final FailureReporter reporter;
    private final FailureClassifier classifier;
    private final Supplier<String> correlationIdSupplier;
    private final Delayer delayer;

    private Retrier(RetryPolicy policy, FailureReporter reporter, FailureClassifier classifier,
                    Supplier<String> correlationIdSupplier, Delayer delayer) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.correlationIdSupplier = Objects.requireNonNull(correlationIdSupplier, "correlationIdSupplier must not be null");
        this.delayer = Objects.requireNonNull(delayer, "delayer must not be null");
    }

    /**
     * Creates a Retrier with the default classifier and delayer.
     */
    public static Retrier of(RetryPolicy policy, FailureReporter reporter) {
        return builder().policy(policy).reporter(reporter).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryPolicy policy;
        private FailureReporter reporter = FailureReporter.noOp();
        private FailureClassifier classifier = new TransportFailureClassifier();
        private Supplier<String> correlationIdSupplier = () -> null;
        private Delayer delayer = Delayer.scheduled();

        private Builder() {}

        /**
         * Sets the retry policy (required).
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the reporter for failed calls (optional, defaults to no-op).
         */
        public Builder reporter(FailureReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the classifier (optional, defaults to {@link TransportFailureClassifier}).
         */
        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the source of correlation ids stamped on reported failures (optional).
         */
        public Builder correlationIdSupplier(Supplier<String> correlationIdSupplier) {
            this.correlationIdSupplier = Objects.requireNonNull(correlationIdSupplier, "correlationIdSupplier must not be null");
            return this;
        }

        /**
         * Sets how the pause between attempts is produced (optional, defaults to {@link Delayer#scheduled()}).
         */
        public Builder delayer(Delayer delayer) {
            this.delayer = Objects.requireNonNull(delayer, "delayer must not be null");
            return this;
        }

        /**
         * @throws NullPointerException if policy has not been set
         */
        public Retrier build() {
            Objects.requireNonNull(policy, "policy must be set");
            return new Retrier(policy, reporter, classifier, correlationIdSupplier, delayer);
        }
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Executes an operation with retry according to the configured policy.
     *
     * @param operation The operation name for reporting
     * @param attempt Starts one attempt; called once per attempt
     * @return a future with the value, {@code null} if transient failures exhausted the policy,
     *         or the original exception of a fatal failure
     */
    public <T> CompletableFuture<T> execute(String operation, Supplier<? extends CompletionStage<T>> attempt) {
        return execute(operation, Map.of(), attempt);
    }

    /**
     * Executes an operation with retry, adding {@code tags} to the reported failure.
     */
    public <T> CompletableFuture<T> execute(String operation, Map<String, String> tags,
                                            Supplier<? extends CompletionStage<T>> attempt) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(tags, "tags must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        Execution<T> execution = new Execution<>(operation, tags, attempt);
        execution.run(0);
        return execution.result;
    }

    /**
     * State of one logical call. Never shared between calls.
     */
    private final class Execution<T> {
        private final String operation;
        private final Map<String, String> tags;
        private final Supplier<? extends CompletionStage<T>> work;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private final AtomicReference<Future<?>> pending = new AtomicReference<>();

        Execution(String operation, Map<String, String> tags, Supplier<? extends CompletionStage<T>> work) {
            this.operation = operation;
            this.tags = tags;
            this.work = work;
            result.whenComplete((value, error) -> {
                if (error instanceof CancellationException) {
                    cancelPending();
                }
            });
        }

        /**
         * Runs attempts from {@code attempt} on. Attempts whose outcome is already known when
         * their continuation is registered run in this loop rather than in a nested callback.
         */
        void run(int attempt) {
            try {
                int next = attempt;
                while (next != SUSPENDED) {
                    next = runAttempt(next);
                }
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        }

        /**
         * @return the next attempt to run on this stack, or {@link #SUSPENDED}
         */
        private int runAttempt(int attempt) {
            if (result.isDone()) {
                return SUSPENDED;
            }
            if (attempt >= policy.maxAttempts()) {
                exhaustedWithoutOutcome(attempt);
                return SUSPENDED;
            }

            CompletionStage<T> stage;
            try {
                stage = Objects.requireNonNull(work.get(), "attempt must not return null");
            } catch (Throwable e) {
                return settle(attempt, null, e);
            }
            if (stage instanceof Future<?> future) {
                track(future);
            }
            return continueWhenComplete(stage, (value, error) -> settle(attempt, value, error));
        }

        private int settle(int attempt, T value, Throwable error) {
            if (result.isDone()) {
                // cancelled while the attempt was in flight
                return SUSPENDED;
            }
            AttemptOutcome<T> outcome = error == null
                    ? new AttemptOutcome.Succeeded<>(attempt, value)
                    : new AttemptOutcome.Failed<>(attempt, classifier.classify(operation, error));

            if (outcome instanceof AttemptOutcome.Succeeded<T> succeeded) {
                result.complete(succeeded.value());
                return SUSPENDED;
            }

            Failure failure = ((AttemptOutcome.Failed<T>) outcome).failure();
            RetryDecision decision = policy.decide(attempt, failure);

            if (decision instanceof RetryDecision.Retry retry) {
                return pauseBefore(attempt + 1, retry.delay());
            }
            report(failure, attempt + 1);
            if (decision instanceof RetryDecision.Suppress) {
                result.complete(null);
            } else {
                result.completeExceptionally(FailureClassifier.unwrap(error));
            }
            return SUSPENDED;
        }

        private int pauseBefore(int nextAttempt, Duration delay) {
            CompletableFuture<Void> pause = delayer.delay(delay);
            track(pause);
            return continueWhenComplete(pause, (ignored, error) -> {
                if (error != null) {
                    // cancelled along with the result, or the delayer itself broke
                    result.completeExceptionally(FailureClassifier.unwrap(error));
                    return SUSPENDED;
                }
                return nextAttempt;
            });
        }

        /**
         * Registers {@code then} on {@code stage}. If the stage is complete before this method
         * returns, the attempt chosen by {@code then} is handed back to the caller's loop;
         * otherwise the callback starts a new loop itself.
         */
        private <V> int continueWhenComplete(CompletionStage<V> stage,
                                             BiFunction<? super V, Throwable, Integer> then) {
            AtomicInteger handoff = new AtomicInteger(UNCLAIMED);
            stage.whenComplete((value, error) -> {
                int next;
                try {
                    next = then.apply(value, error);
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                    next = SUSPENDED;
                }
                if (!handoff.compareAndSet(UNCLAIMED, next)) {
                    run(next);
                }
            });
            return handoff.compareAndSet(UNCLAIMED, SUSPENDED) ? SUSPENDED : handoff.get();
        }

        private void exhaustedWithoutOutcome(int attempts) {
            String message = "Retry loop exhausted without a terminal outcome";
            report(Failure.fatal(EXHAUSTED_WITHOUT_OUTCOME,
                    message + " (maxAttempts=" + policy.maxAttempts() + ")",
                    operation,
                    new IllegalStateException(message)), attempts);
            result.complete(null);
        }

        private void report(Failure failure, int attempts) {
            Map<String, String> merged = new HashMap<>(failure.tags());
            merged.putAll(tags);
            merged.put(Failure.ATTEMPTS_TAG, String.valueOf(attempts));
            try {
                reporter.report(failure.withContext(correlationIdFor(failure), merged));
            } catch (RuntimeException e) {
                System.err.println("FailureReporter.report failed for " +
                        reporter.getClass().getName() + ": " + e.getMessage());
            }
        }

        private String correlationIdFor(Failure failure) {
            if (failure.correlationId() != null) {
                return failure.correlationId();
            }
            try {
                return correlationIdSupplier.get();
            } catch (RuntimeException e) {
                // report without one rather than not at all
                System.err.println("Correlation id supplier failed: " + e.getMessage());
                return null;
            }
        }

        private void track(Future<?> future) {
            pending.set(future);
            if (result.isCancelled()) {
                cancelPending();
            }
        }

        private void cancelPending() {
            Future<?> future = pending.get();
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
