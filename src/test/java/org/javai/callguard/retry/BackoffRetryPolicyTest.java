package org.javai.callguard.retry;

import org.javai.callguard.ConfigurationException;
import org.javai.callguard.Failure;
import org.javai.callguard.FailureId;
import org.javai.callguard.FailureKind;
import org.javai.callguard.FailureType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class BackoffRetryPolicyTest {

    private static final Instant START = Instant.parse("2024-01-20T10:00:00Z");

    private final RetryConfig config = RetryConfig.builder()
            .maxAttempts(4)
            .baseDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofMillis(300))
            .backoffMultiplier(2.0)
            .build();

    @Test
    void decide_transientFailure_backsOffExponentially() {
        BackoffRetryPolicy policy = new BackoffRetryPolicy("test", config, () -> 0.5);

        assertThat(delayAfter(policy, 1)).isEqualTo(Duration.ofMillis(100));
        assertThat(delayAfter(policy, 2)).isEqualTo(Duration.ofMillis(200));
    }

    @Test
    void decide_delayIsCappedAtMaxDelay() {
        BackoffRetryPolicy policy = new BackoffRetryPolicy("test", config, () -> 0.5);

        assertThat(delayAfter(policy, 3)).isEqualTo(Duration.ofMillis(300));
        assertThat(policy.cappedDelay(30)).isEqualTo(Duration.ofMillis(300));
    }

    @Test
    void decide_jitterStaysWithinTwentyPercent() {
        BackoffRetryPolicy low = new BackoffRetryPolicy("low", config, () -> 0.0);
        BackoffRetryPolicy high = new BackoffRetryPolicy("high", config, () -> 0.999_999);

        assertThat(delayAfter(low, 1)).isEqualTo(Duration.ofMillis(80));
        assertThat(delayAfter(high, 1)).isBetween(Duration.ofMillis(119), Duration.ofMillis(120));
    }

    @Test
    void decide_zeroJitter_isExact() {
        RetryConfig exact = config.toBuilder().jitter(0.0).build();
        BackoffRetryPolicy policy = new BackoffRetryPolicy("exact", exact, () -> 0.0);

        assertThat(delayAfter(policy, 2)).isEqualTo(Duration.ofMillis(200));
    }

    @Test
    void decide_permitsExactlyMaxAttempts() {
        BackoffRetryPolicy policy = new BackoffRetryPolicy(config);
        Failure failure = transientFailure();

        RetryContext context = RetryContext.first(START);
        int attempts = 1;
        while (policy.decide(context, failure) instanceof RetryDecision.Retry) {
            context = context.next(START);
            attempts++;
        }

        assertThat(attempts).isEqualTo(4);
        RetryDecision last = policy.decide(context, failure);
        assertThat(last).isInstanceOf(RetryDecision.GiveUp.class);
        assertThat(((RetryDecision.GiveUp) last).exhausted()).isTrue();
    }

    @Test
    void decide_permanentFailure_neverRetries() {
        BackoffRetryPolicy policy = new BackoffRetryPolicy(config);
        Failure failure = Failure.permanentFailure(FailureId.http(404), "not found", "op", null);

        RetryDecision decision = policy.decide(RetryContext.first(START), failure);

        assertThat(decision).isInstanceOf(RetryDecision.GiveUp.class);
        assertThat(((RetryDecision.GiveUp) decision).exhausted()).isFalse();
    }

    @Test
    void decide_defect_neverRetries() {
        BackoffRetryPolicy policy = new BackoffRetryPolicy(config);
        Failure defect = Failure.of(FailureKind.defect(FailureId.of("defect", "null_pointer"), "npe"),
                "op", 1, START, new NullPointerException());

        assertThat(policy.decide(RetryContext.first(START), defect)).isInstanceOf(RetryDecision.GiveUp.class);
    }

    @Test
    void decide_nonRetryableKind_givesUpEvenWhenTransient() {
        FailureId throttled = FailureId.http(429);
        RetryConfig strict = config.toBuilder().nonRetryableKind(throttled).build();
        BackoffRetryPolicy policy = new BackoffRetryPolicy(strict);

        RetryDecision decision = policy.decide(RetryContext.first(START),
                Failure.transientFailure(throttled, "slow down", "op", null));

        assertThat(decision).isInstanceOf(RetryDecision.GiveUp.class);
        assertThat(((RetryDecision.GiveUp) decision).reason()).contains("http:429");
    }

    @Test
    void decide_longerRetryAfterHint_replacesComputedDelay() {
        BackoffRetryPolicy policy = new BackoffRetryPolicy("test", config, () -> 0.5);
        FailureKind kind = FailureKind.transientKind(FailureId.http(503), "unavailable")
                .withRetryAfter(Duration.ofSeconds(2));
        Failure failure = Failure.of(kind, "op", 1, START, null);

        RetryDecision decision = policy.decide(RetryContext.first(START), failure);

        assertThat(((RetryDecision.Retry) decision).delay()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void config_rejectsOutOfRangeSettings() {
        assertThatThrownBy(() -> RetryConfig.builder().maxAttempts(0).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> RetryConfig.builder().backoffMultiplier(1.0).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> RetryConfig.builder().jitter(1.0).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> RetryConfig.builder().baseDelay(Duration.ofSeconds(10)).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("maxDelay");
        assertThatThrownBy(() -> RetryConfig.builder().attemptTimeout(Duration.ZERO).build())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void fixedPolicy_retriesTransientWithConstantDelay() {
        RetryPolicy policy = RetryPolicy.fixed("fixed", 2, Duration.ofMillis(50));

        RetryDecision first = policy.decide(RetryContext.first(START), transientFailure());
        RetryDecision second = policy.decide(RetryContext.first(START).next(START), transientFailure());

        assertThat(first).isEqualTo(RetryDecision.Retry.after(Duration.ofMillis(50)));
        assertThat(second).isEqualTo(RetryDecision.GiveUp.exhausted("max attempts reached"));
    }

    @Test
    void noRetryPolicy_givesUpImmediately() {
        RetryDecision decision = RetryPolicy.noRetry().decide(RetryContext.first(START), transientFailure());

        assertThat(decision).isInstanceOf(RetryDecision.GiveUp.class);
        assertThat(transientFailure().type()).isEqualTo(FailureType.TRANSIENT);
    }

    private Duration delayAfter(RetryPolicy policy, int attempt) {
        RetryContext context = RetryContext.first(START);
        for (int i = 1; i < attempt; i++) {
            context = context.next(START);
        }
        RetryDecision decision = policy.decide(context, transientFailure());
        assertThat(decision).isInstanceOf(RetryDecision.Retry.class);
        return ((RetryDecision.Retry) decision).delay();
    }

    private static Failure transientFailure() {
        return Failure.transientFailure(FailureId.http(503), "unavailable", "op", null);
    }
}
