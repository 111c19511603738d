package com.di.rawingest.exception;

import com.google.cloud.BaseServiceException;
import org.apache.beam.sdk.Pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories attached to failure logs of an ingest run.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    VALIDATION_ERROR("Validation error", "Invalid arguments, schema or table reference"),
    AUTHENTICATION_ERROR("Authentication error", "Missing credentials or insufficient permissions"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    CLOUD_SERVICE_ERROR("Cloud service error", "BigQuery or Cloud Storage rejected the request"),
    PIPELINE_ERROR("Pipeline error", "Failure while running the Beam pipeline"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof PipelineRunException, PIPELINE_ERROR);
        // Validation messages quote user input (column and table names), so no keyword matcher may run first.
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isAuthenticationError, AUTHENTICATION_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(t -> t instanceof BaseServiceException, CLOUD_SERVICE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof Pipeline.PipelineExecutionException) {
            // Beam wraps the user-code failure; categorize what actually went wrong.
            Throwable cause = exception.getCause();
            return cause != null ? categorize(cause) : PIPELINE_ERROR;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isAuthenticationError(Throwable t) {
        if (t instanceof BaseServiceException) {
            int code = ((BaseServiceException) t).getCode();
            if (code == 401 || code == 403) {
                return true;
            }
        }
        return messageContains(t, "unauthorized", "forbidden", "access denied",
                "permission denied", "application default credentials");
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timed out", "timeout");
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
