package org.javai.callguard;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class OutcomeTest {

    private final Failure failure = Failure.transientFailure(FailureId.http(503), "unavailable", "op", null);

    @Test
    void ok_holdsValue() {
        Outcome<String> outcome = Outcome.ok("value");

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.isFail()).isFalse();
        assertThat(outcome.getOrElse("default")).isEqualTo("value");
    }

    @Test
    void fail_fallsBackToDefault() {
        Outcome<String> outcome = Outcome.fail(failure);

        assertThat(outcome.isFail()).isTrue();
        assertThat(outcome.getOrElse("default")).isEqualTo("default");
    }

    @Test
    void map_transformsOkAndKeepsFailure() {
        assertThat(Outcome.ok("abc").map(String::length).getOrElse(0)).isEqualTo(3);

        Outcome<Integer> mapped = Outcome.<String>fail(failure).map(String::length);
        assertThat(mapped).isInstanceOf(Outcome.Fail.class);
        assertThat(((Outcome.Fail<Integer>) mapped).failure()).isSameAs(failure);
    }

    @Test
    void fail_requiresFailure() {
        assertThatThrownBy(() -> Outcome.fail(null)).isInstanceOf(NullPointerException.class);
    }
}
