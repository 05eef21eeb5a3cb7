package org.javai.callguard.boundary;

import org.javai.callguard.FailureId;
import org.javai.callguard.FailureKind;
import org.javai.callguard.PermanentFailureException;
import org.javai.callguard.TransientFailureException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.concurrent.TimeoutException;

/**
 * Default classifier for outbound calls.
 *
 * <p>Self-classified exceptions keep their own verdict. HTTP statuses, JDK network, IO and SQL
 * exceptions get sensible defaults. Programming errors are defects. Anything unrecognised is
 * treated as transient, because operations are required to be safe to repeat.</p>
 */
public class DefaultFailureClassifier implements FailureClassifier {

    @Override
    public FailureKind classify(String operation, Throwable t) {
        if (t instanceof TransientFailureException tfe) {
            return FailureKind.transientKind(tfe.kind(), describe(t)).withRetryAfter(tfe.retryAfter());
        }

        if (t instanceof PermanentFailureException pfe) {
            return FailureKind.permanent(pfe.kind(), describe(t));
        }

        if (t instanceof HttpStatusException http) {
            return classifyStatus(http);
        }

        // Network
        if (t instanceof SocketTimeoutException) {
            return FailureKind.transientKind(FailureId.of("network", "timeout"), "Socket timeout: " + t.getMessage());
        }

        if (t instanceof HttpTimeoutException) {
            return FailureKind.transientKind(FailureId.of("network", "http_timeout"), "HTTP timeout: " + t.getMessage());
        }

        if (t instanceof ConnectException) {
            return FailureKind.transientKind(FailureId.of("network", "connection_refused"), "Connection refused: " + t.getMessage());
        }

        if (t instanceof UnknownHostException) {
            return FailureKind.permanent(FailureId.of("network", "unknown_host"), "Unknown host: " + t.getMessage());
        }

        if (t instanceof TimeoutException) {
            return FailureKind.transientKind(FailureId.of("operation", "timeout"), "Operation timeout: " + t.getMessage());
        }

        // File system
        if (t instanceof FileNotFoundException || t instanceof NoSuchFileException) {
            return FailureKind.permanent(FailureId.of("io", "file_not_found"), "File not found: " + t.getMessage());
        }

        if (t instanceof AccessDeniedException) {
            return FailureKind.permanent(FailureId.of("io", "access_denied"), "Access denied: " + t.getMessage());
        }

        if (t instanceof IOException) {
            return FailureKind.transientKind(FailureId.of("io", "io_error"), "IO error: " + t.getMessage());
        }

        // SQL: connection class (08xxx) and transient subtypes retry, the rest is the statement's fault
        if (t instanceof SQLTransientException) {
            return FailureKind.transientKind(FailureId.of("sql", "transient"), "SQL transient error: " + t.getMessage());
        }

        if (t instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && sqlState.startsWith("08")) {
                return FailureKind.transientKind(FailureId.of("sql", "connection"), "SQL connection error: " + t.getMessage());
            }
            return FailureKind.permanent(FailureId.of("sql", "error"), "SQL error: " + t.getMessage());
        }

        // Programming errors
        if (t instanceof IllegalArgumentException || t instanceof IllegalStateException) {
            return FailureKind.defect(FailureId.of("defect", "invalid_argument"), "Invalid argument: " + t.getMessage());
        }

        if (t instanceof NullPointerException) {
            return FailureKind.defect(FailureId.of("defect", "null_pointer"), "Null pointer: " + t.getMessage());
        }

        if (t instanceof UnsupportedOperationException) {
            return FailureKind.defect(FailureId.of("defect", "unsupported_operation"), "Unsupported operation: " + t.getMessage());
        }

        return FailureKind.transientKind(FailureId.of("unknown", t.getClass().getSimpleName()), describe(t));
    }

    private static FailureKind classifyStatus(HttpStatusException e) {
        int status = e.status();
        String message = "HTTP " + status + ": " + e.getMessage();
        if (status == 0) {
            return FailureKind.transientKind(FailureId.of("network", "no_response"), message);
        }
        if (status == 408 || status == 425 || status == 429 || status >= 500) {
            return FailureKind.transientKind(FailureId.http(status), message).withRetryAfter(e.retryAfter());
        }
        return FailureKind.permanent(FailureId.http(status), message);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
