package org.javai.callguard.ops.log4j;

import org.apache.logging.log4j.Level;
import org.javai.callguard.Failure;
import org.javai.callguard.FailureId;
import org.javai.callguard.FailureType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class Log4jOpReporterTest {

	@Test
	void levelFor_mapsSeverityByType() {
		assertThat(Log4jOpReporter.levelFor(FailureType.DEFECT)).isEqualTo(Level.ERROR);
		assertThat(Log4jOpReporter.levelFor(FailureType.PERMANENT)).isEqualTo(Level.WARN);
		assertThat(Log4jOpReporter.levelFor(FailureType.TRANSIENT)).isEqualTo(Level.INFO);
	}

	@Test
	void markers_areDistinctPerEvent() {
		assertThat(Log4jOpReporter.FAILURE_MARKER.getName()).isEqualTo("FAILURE");
		assertThat(Log4jOpReporter.RETRY_MARKER.getName()).isEqualTo("RETRY");
		assertThat(Log4jOpReporter.GAVE_UP_MARKER.getName()).isEqualTo("GAVE_UP");
		assertThat(Log4jOpReporter.REFRESH_FAILED_MARKER.getName()).isEqualTo("REFRESH_FAILED");
	}

	@Test
	void reporting_neverThrows() {
		Log4jOpReporter reporter = new Log4jOpReporter("org.javai.callguard.test.OpReporter");
		Failure failure = Failure.transientFailure(FailureId.http(503), "unavailable", "user:1", null)
				.withTags(Map.of("region", "eu-west-1"));

		assertThatCode(() -> {
			reporter.report(failure);
			reporter.reportRetryAttempt(failure, 1, Duration.ofMillis(100));
			reporter.reportGaveUp(failure, 3, "max attempts reached");
			reporter.reportRefreshFailure("user:1", new IOException("down"));
		}).doesNotThrowAnyException();
	}
}
