package org.javai.restretry.ops.metrics;

import org.javai.restretry.Failure;
import org.javai.restretry.ops.FailureReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

import static org.javai.restretry.ops.ReporterUtils.escapeJson;

/**
 * Reports failed calls as JSON-lines metrics via SLF4J.
 *
 * <p>Each failed call becomes one JSON object on one line at INFO. The event type tells the
 * two terminal outcomes apart: {@code retries_exhausted} for a transient failure that used up
 * the policy, {@code fatal_failure} for one that was rethrown. The attempt count is a numeric
 * field rather than a tag so aggregators can sum and bucket it.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retries_exhausted","timestamp":"2024-01-20T10:30:00Z","trackingKey":"orders.RestClient.get",
 *  "code":"network:timeout","attempts":3,"exception":"java.net.SocketTimeoutException",...}
 * }</pre>
 */
public class MetricsFailureReporter implements FailureReporter {

	static final String RETRIES_EXHAUSTED = "retries_exhausted";
	static final String FATAL_FAILURE = "fatal_failure";

	private static final String DEFAULT_LOGGER_NAME = "org.javai.restretry.Metrics";

	private final String namespace;
	private final Logger logger;

	public MetricsFailureReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace prefix for tracking keys, e.g. the calling service (may be null or blank)
	 */
	public MetricsFailureReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public MetricsFailureReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	MetricsFailureReporter(String namespace, Logger logger) {
		this.namespace = namespace == null || namespace.isBlank() ? null : namespace.trim();
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		try {
			logger.info(toJson(failure));
		} catch (RuntimeException e) {
			// a metrics sink must never fail the call being reported
		}
	}

	String toJson(Failure failure) {
		JsonLine line = new JsonLine()
				.string("eventType", failure.isTransient() ? RETRIES_EXHAUSTED : FATAL_FAILURE)
				.string("timestamp", DateTimeFormatter.ISO_INSTANT.format(failure.occurredAt()))
				.string("trackingKey", trackingKey(failure))
				.string("code", failure.id().toString())
				.string("message", failure.message())
				.string("type", failure.type().name())
				.string("operation", failure.operation());

		OptionalInt attempts = failure.attempts();
		if (attempts.isPresent()) {
			line.number("attempts", attempts.getAsInt());
		}
		if (failure.exception() != null) {
			line.string("exception", failure.exception().getClass().getName());
		}
		if (failure.correlationId() != null) {
			line.string("correlationId", failure.correlationId());
		}

		Map<String, String> tags = new TreeMap<>(failure.tags());
		if (attempts.isPresent()) {
			tags.remove(Failure.ATTEMPTS_TAG);
		}
		if (!tags.isEmpty()) {
			line.object("tags", tags);
		}
		return line.toString();
	}

	String trackingKey(Failure failure) {
		return namespace == null ? failure.trackingId() : namespace + "." + failure.trackingId();
	}

	/**
	 * A flat JSON object written field by field.
	 */
	private static final class JsonLine {
		private final StringBuilder sb = new StringBuilder("{");

		JsonLine string(String key, String value) {
			return key(key).quoted(value);
		}

		JsonLine number(String key, long value) {
			key(key).sb.append(value);
			return this;
		}

		JsonLine object(String key, Map<String, String> entries) {
			key(key).sb.append('{');
			int start = sb.length();
			entries.forEach((k, v) -> {
				if (sb.length() > start) {
					sb.append(',');
				}
				quoted(k).sb.append(':');
				quoted(v);
			});
			sb.append('}');
			return this;
		}

		private JsonLine key(String key) {
			if (sb.length() > 1) {
				sb.append(',');
			}
			quoted(key).sb.append(':');
			return this;
		}

		private JsonLine quoted(String value) {
			sb.append('"').append(escapeJson(value)).append('"');
			return this;
		}

		@Override
		public String toString() {
			return sb + "}";
		}
	}
}
