package org.javai.restretry.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Records requested pauses. Completes them at once unless constructed as manual,
 * in which case the test completes or cancels them.
 */
public class RecordingDelayer implements Delayer {

    private final boolean manual;
    private final List<Duration> delays = new ArrayList<>();
    private final List<CompletableFuture<Void>> pauses = new ArrayList<>();

    private RecordingDelayer(boolean manual) {
        this.manual = manual;
    }

    public static RecordingDelayer instant() {
        return new RecordingDelayer(false);
    }

    public static RecordingDelayer manual() {
        return new RecordingDelayer(true);
    }

    @Override
    public synchronized CompletableFuture<Void> delay(Duration duration) {
        delays.add(duration);
        CompletableFuture<Void> pause = manual ? new CompletableFuture<>() : CompletableFuture.completedFuture(null);
        pauses.add(pause);
        return pause;
    }

    public synchronized List<Duration> delays() {
        return List.copyOf(delays);
    }

    public synchronized List<CompletableFuture<Void>> pauses() {
        return List.copyOf(pauses);
    }
}
