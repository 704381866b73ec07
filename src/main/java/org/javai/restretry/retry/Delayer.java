package org.javai.restretry.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Produces a future that completes once a delay has elapsed.
 *
 * <p>Used between attempts instead of a blocking sleep. Cancelling the returned future
 * must abandon the wait.
 */
@FunctionalInterface
public interface Delayer {

    CompletableFuture<Void> delay(Duration duration);

    /**
     * A delayer backed by {@link CompletableFuture#delayedExecutor}, at nanosecond precision.
     * Zero or negative durations complete immediately; durations too long to express in
     * nanoseconds wait {@link Long#MAX_VALUE} nanoseconds.
     */
    static Delayer scheduled() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(() -> {},
                    CompletableFuture.delayedExecutor(saturatedNanos(duration), TimeUnit.NANOSECONDS));
        };
    }

    private static long saturatedNanos(Duration duration) {
        if (duration.compareTo(Duration.ofNanos(Long.MAX_VALUE)) >= 0) {
            return Long.MAX_VALUE;
        }
        return duration.toNanos();
    }
}
