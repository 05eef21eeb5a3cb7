package org.javai.callguard.boundary;

import org.javai.callguard.FailureId;
import org.javai.callguard.FailureKind;
import org.javai.callguard.FailureType;
import org.javai.callguard.PermanentFailureException;
import org.javai.callguard.TimeoutFailureException;
import org.javai.callguard.TransientFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class DefaultFailureClassifierTest {

    private final DefaultFailureClassifier classifier = new DefaultFailureClassifier();

    @Test
    void classify_transientFailureException_keepsItsKindAndRetryAfter() {
        FailureId kind = FailureId.of("payments", "busy");
        TransientFailureException e = new TransientFailureException(kind, "busy", Duration.ofSeconds(3), null);

        FailureKind result = classifier.classify("op", e);

        assertThat(result.id()).isEqualTo(kind);
        assertThat(result.type()).isEqualTo(FailureType.TRANSIENT);
        assertThat(result.retryAfter()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void classify_timeoutFailureException_isTransientDeadlineExceeded() {
        FailureKind result = classifier.classify("op", new TimeoutFailureException("op", Duration.ofSeconds(1)));

        assertThat(result.id()).isEqualTo(TimeoutFailureException.KIND);
        assertThat(result.type()).isEqualTo(FailureType.TRANSIENT);
    }

    @Test
    void classify_permanentFailureException_isPermanent() {
        FailureId kind = FailureId.of("validation", "bad_input");

        FailureKind result = classifier.classify("op", new PermanentFailureException(kind, "bad input"));

        assertThat(result.id()).isEqualTo(kind);
        assertThat(result.type()).isEqualTo(FailureType.PERMANENT);
    }

    @ParameterizedTest
    @ValueSource(ints = {408, 425, 429, 500, 502, 503, 504})
    void classify_retryableHttpStatus_isTransient(int status) {
        FailureKind result = classifier.classify("op", new HttpStatusException(status, "upstream"));

        assertThat(result.id()).isEqualTo(FailureId.http(status));
        assertThat(result.type()).isEqualTo(FailureType.TRANSIENT);
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 403, 404, 409, 422})
    void classify_clientHttpStatus_isPermanent(int status) {
        FailureKind result = classifier.classify("op", new HttpStatusException(status, "rejected"));

        assertThat(result.id()).isEqualTo(FailureId.http(status));
        assertThat(result.type()).isEqualTo(FailureType.PERMANENT);
    }

    @Test
    void classify_statusZero_isTransientNetworkFailure() {
        FailureKind result = classifier.classify("op", new HttpStatusException(0, "Network error"));

        assertThat(result.id()).isEqualTo(FailureId.of("network", "no_response"));
        assertThat(result.type()).isEqualTo(FailureType.TRANSIENT);
    }

    @Test
    void classify_tooManyRequests_carriesRetryAfter() {
        HttpStatusException e = new HttpStatusException(429, "slow down", Duration.ofSeconds(30));

        assertThat(classifier.classify("op", e).retryAfter()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void classify_networkExceptions() {
        assertThat(classifier.classify("op", new SocketTimeoutException("read")).type()).isEqualTo(FailureType.TRANSIENT);
        assertThat(classifier.classify("op", new ConnectException("refused")).type()).isEqualTo(FailureType.TRANSIENT);
        assertThat(classifier.classify("op", new UnknownHostException("nowhere")).type()).isEqualTo(FailureType.PERMANENT);
        assertThat(classifier.classify("op", new IOException("reset")).id()).isEqualTo(FailureId.of("io", "io_error"));
        assertThat(classifier.classify("op", new FileNotFoundException("x")).type()).isEqualTo(FailureType.PERMANENT);
    }

    @Test
    void classify_sqlConnectionState_isTransient() {
        FailureKind connection = classifier.classify("op", new SQLException("gone", "08006"));
        FailureKind syntax = classifier.classify("op", new SQLException("bad", "42000"));

        assertThat(connection.type()).isEqualTo(FailureType.TRANSIENT);
        assertThat(syntax.type()).isEqualTo(FailureType.PERMANENT);
    }

    @Test
    void classify_programmingErrors_areDefects() {
        assertThat(classifier.classify("op", new IllegalArgumentException("x")).type()).isEqualTo(FailureType.DEFECT);
        assertThat(classifier.classify("op", new IllegalStateException("x")).type()).isEqualTo(FailureType.DEFECT);
        assertThat(classifier.classify("op", new NullPointerException()).type()).isEqualTo(FailureType.DEFECT);
        assertThat(classifier.classify("op", new UnsupportedOperationException()).type()).isEqualTo(FailureType.DEFECT);
    }

    @Test
    void classify_unknownException_isTransientWithSimpleName() {
        class UpstreamHiccup extends RuntimeException {}

        FailureKind result = classifier.classify("op", new UpstreamHiccup());

        assertThat(result.type()).isEqualTo(FailureType.TRANSIENT);
        assertThat(result.id()).isEqualTo(FailureId.of("unknown", "UpstreamHiccup"));
    }
}
