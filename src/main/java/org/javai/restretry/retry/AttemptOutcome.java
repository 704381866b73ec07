package org.javai.restretry.retry;

import java.util.Objects;
import org.javai.restretry.Failure;

/**
 * What a single attempt produced. Exists only inside one call's retry loop.
 *
 * @param <T> The type of the successful value
 */
public sealed interface AttemptOutcome<T> permits AttemptOutcome.Succeeded, AttemptOutcome.Failed {

    /**
     * The 0-based index of the attempt.
     */
    int attempt();

    /**
     * @param attempt the 0-based attempt index
     * @param value the value produced (may be null)
     */
    record Succeeded<T>(int attempt, T value) implements AttemptOutcome<T> {
    }

    /**
     * @param attempt the 0-based attempt index
     * @param failure the classified failure
     */
    record Failed<T>(int attempt, Failure failure) implements AttemptOutcome<T> {
        public Failed {
            Objects.requireNonNull(failure, "failure must not be null");
        }
    }
}
