package org.javai.restretry.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.restretry.Failure;
import org.javai.restretry.FailureType;
import org.javai.restretry.ops.FailureReporter;
import org.javai.restretry.ops.ReporterUtils;

/**
 * Reports failures using Log4j2.
 *
 * <p>Transient failures only reach a reporter once retries are exhausted and are logged at
 * {@code WARN}; fatal failures are logged at {@code ERROR}. The underlying exception is
 * attached so the appender can render its stack trace.
 */
public class Log4jFailureReporter implements FailureReporter {

	static final String DEFAULT_LOGGER_NAME = "org.javai.restretry.FailureReporter";

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");

	private final Logger logger;

	/**
	 * Creates a Log4jFailureReporter using the default logger name.
	 */
	public Log4jFailureReporter() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a Log4jFailureReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jFailureReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jFailureReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jFailureReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure.type()))
			.withMarker(FAILURE_MARKER)
			.withThrowable(failure.exception())
			.log(formatFailureMessage(failure));
	}

	static String formatFailureMessage(Failure failure) {
		return """
			Failure in operation [%s]: %s \
			| code=%s, type=%s%s%s\
			""".formatted(
				failure.operation(),
				failure.message(),
				failure.id(),
				failure.type(),
				formatCorrelationId(failure.correlationId()),
				formatTags(failure)
			).trim();
	}

	private static String formatCorrelationId(String correlationId) {
		return correlationId != null ? ", correlationId=" + correlationId : "";
	}

	private static String formatTags(Failure failure) {
		String tags = ReporterUtils.formatTags(failure.tags());
		return tags.isEmpty() ? "" : ", tags={" + tags + "}";
	}

	static Level levelFor(FailureType type) {
		return switch (type) {
			case TRANSIENT -> Level.WARN;
			case FATAL -> Level.ERROR;
		};
	}
}
