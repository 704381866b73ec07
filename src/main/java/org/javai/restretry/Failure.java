package org.javai.restretry;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A classified failure ready for reporting.
 *
 * @param id The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param type Whether the failure is TRANSIENT or FATAL
 * @param exception The underlying exception (may be null)
 * @param operation The operation that failed (e.g., "RestClient.get")
 * @param occurredAt When the failure happened
 * @param correlationId Trace correlation identifier (may be null)
 * @param tags Additional key-value metadata for observability
 * @param trackingId Stable identifier for metrics aggregation (defaults to operation if null)
 */
public record Failure(
        FailureId id,
        String message,
        FailureType type,
        Throwable exception,
        String operation,
        Instant occurredAt,
        String correlationId,
        Map<String, String> tags,
        String trackingId
) {

    /**
     * Tag carrying how many attempts were made before the failure was reported.
     */
    public static final String ATTEMPTS_TAG = "attempts";

    public Failure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        trackingId = trackingId == null ? operation : trackingId;
    }

    /**
     * Creates a transient failure that may resolve on retry.
     */
    public static Failure transientFailure(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.TRANSIENT, exception,
                operation, Instant.now(), null, null, null);
    }

    /**
     * Creates a fatal failure that must not be retried.
     */
    public static Failure fatal(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.FATAL, exception,
                operation, Instant.now(), null, null, null);
    }

    public static Builder builder(FailureId id, String message, FailureType type, String operation) {
        return new Builder(id, message, type, operation);
    }

    public boolean isTransient() {
        return type == FailureType.TRANSIENT;
    }

    /**
     * The number of attempts recorded in the {@value #ATTEMPTS_TAG} tag, if it holds one.
     */
    public OptionalInt attempts() {
        String value = tags.get(ATTEMPTS_TAG);
        if (value == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Returns a new Failure with the specified correlationId and tags.
     */
    public Failure withContext(String correlationId, Map<String, String> tags) {
        return new Failure(id, message, type, exception, operation,
                occurredAt, correlationId, tags, trackingId);
    }

    public static class Builder {
        private final FailureId id;
        private final String message;
        private final FailureType type;
        private final String operation;
        private Throwable exception;
        private Instant occurredAt = Instant.now();
        private String correlationId;
        private Map<String, String> tags;
        private String trackingId;

        private Builder(FailureId id, String message, FailureType type, String operation) {
            this.id = Objects.requireNonNull(id);
            this.message = Objects.requireNonNull(message);
            this.type = Objects.requireNonNull(type);
            this.operation = Objects.requireNonNull(operation);
        }

        public Builder exception(Throwable exception) {
            this.exception = exception;
            return this;
        }

        public Builder occurredAt(Instant instant) {
            this.occurredAt = instant;
            return this;
        }

        public Builder correlationId(String id) {
            this.correlationId = id;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder trackingId(String trackingId) {
            this.trackingId = trackingId;
            return this;
        }

        public Failure build() {
            return new Failure(id, message, type, exception, operation,
                    occurredAt, correlationId, tags, trackingId);
        }
    }
}
