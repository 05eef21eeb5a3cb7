package org.javai.callguard.ops;

import org.javai.callguard.Failure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>Every reporter receives every call. A reporter that throws is logged and skipped,
 * so the remaining reporters still run.
 *
 * <p>Example usage:
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(metricsEnabled, new MetricsOpReporter("myapp"))
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(Failure failure) {
		fanOut("report", reporter -> reporter.report(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		fanOut("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(failure, attemptNumber, delay));
	}

	@Override
	public void reportGaveUp(Failure failure, int totalAttempts, String reason) {
		fanOut("reportGaveUp", reporter -> reporter.reportGaveUp(failure, totalAttempts, reason));
	}

	@Override
	public void reportRefreshFailure(String key, Throwable error) {
		fanOut("reportRefreshFailure", reporter -> reporter.reportRefreshFailure(key, error));
	}

	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				log.warn("OpReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}

	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		public Builder add(OpReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Adds the reporter only when {@code condition} holds.
		 */
		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
