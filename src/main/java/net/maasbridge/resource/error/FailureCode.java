package net.maasbridge.resource.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Symbolic codes of the closed failure taxonomy, each with its default status.
 *
 * <p>{@link #CONFLICT}, {@link #RATE_LIMITED} and {@link #BACKEND_ERROR} are only produced by the
 * backend client for status-coded upstream failures; the bridge passes them through unchanged.
 */
public enum FailureCode {
    INVALID_PARAMETERS("invalid_parameters", 400),
    UNAUTHORIZED("unauthorized", 401),
    FORBIDDEN("forbidden", 403),
    RESOURCE_NOT_FOUND("resource_not_found", 404),
    CONFLICT("conflict", 409),
    VALIDATION_ERROR("validation_error", 422),
    RATE_LIMITED("rate_limited", 429),
    REQUEST_ABORTED("request_aborted", 499),
    UNEXPECTED_ERROR("unexpected_error", 500),
    BACKEND_ERROR("backend_error", 502),
    NETWORK_ERROR("network_error", 503),
    REQUEST_TIMEOUT("request_timeout", 504);

    private final String value;
    private final int defaultStatus;

    FailureCode(String value, int defaultStatus) {
        this.value = value;
        this.defaultStatus = defaultStatus;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int defaultStatus() {
        return defaultStatus;
    }

    /**
     * Code used for an upstream HTTP status when the backend client classifies a response.
     */
    public static FailureCode forBackendStatus(int status) {
        return switch (status) {
            case 400 -> INVALID_PARAMETERS;
            case 401 -> UNAUTHORIZED;
            case 403 -> FORBIDDEN;
            case 404 -> RESOURCE_NOT_FOUND;
            case 409 -> CONFLICT;
            case 429 -> RATE_LIMITED;
            default -> BACKEND_ERROR;
        };
    }

    @Override
    public String toString() {
        return value;
    }
}
