package org.javai.callguard.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.callguard.Failure;
import org.javai.callguard.FailureType;
import org.javai.callguard.ops.OpReporter;

import java.time.Duration;
import java.util.Map;

/**
 * Reports call failures through Log4j2.
 *
 * <p>Failures are logged at a level that follows their {@link FailureType}:
 * <ul>
 *   <li>{@code DEFECT} → ERROR</li>
 *   <li>{@code PERMANENT} → WARN</li>
 *   <li>{@code TRANSIENT} → INFO</li>
 * </ul>
 * Each event type carries its own marker so appenders can route them separately.
 */
public class Log4jOpReporter implements OpReporter {

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker GAVE_UP_MARKER = MarkerManager.getMarker("GAVE_UP");
	static final Marker REFRESH_FAILED_MARKER = MarkerManager.getMarker("REFRESH_FAILED");

	private final Logger logger;

	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.callguard.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure.type()))
			.withMarker(FAILURE_MARKER)
			.log("Attempt {} of [{}] failed: {} | kind={}, type={}{}",
				failure.attempt(),
				failure.operation(),
				failure.message(),
				failure.id(),
				failure.type(),
				formatTags(failure.tags()));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retrying [{}] in {}ms after attempt {} failed with {}",
				failure.operation(),
				delay.toMillis(),
				attemptNumber,
				failure.id());
	}

	@Override
	public void reportGaveUp(Failure failure, int totalAttempts, String reason) {
		logger.atWarn()
			.withMarker(GAVE_UP_MARKER)
			.log("Gave up on [{}] after {} attempts ({}). Kind: {}, Message: {}",
				failure.operation(),
				totalAttempts,
				reason,
				failure.id(),
				failure.message());
	}

	@Override
	public void reportRefreshFailure(String key, Throwable error) {
		logger.atWarn()
			.withMarker(REFRESH_FAILED_MARKER)
			.withThrowable(error)
			.log("Background refresh of [{}] failed; serving stale value", key);
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder(", tags={");
		tags.forEach((key, value) -> {
			if (sb.length() > ", tags={".length()) {
				sb.append(", ");
			}
			sb.append(key).append('=').append(value);
		});
		return sb.append('}').toString();
	}

	static Level levelFor(FailureType type) {
		return switch (type) {
			case DEFECT -> Level.ERROR;
			case PERMANENT -> Level.WARN;
			case TRANSIENT -> Level.INFO;
		};
	}
}
