package net.maasbridge.resource.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The only failure type that crosses a resource handler boundary.
 *
 * <p>Carries a numeric status (HTTP-like, 499 for client aborts), a symbolic {@link FailureCode}
 * and optional structured details such as schema validation issues. The status normally equals
 * the code's default status; backend pass-through failures keep the upstream status instead.
 */
public class BridgeFailure extends RuntimeException {

    private final int status;
    private final FailureCode code;
    private final Map<String, Object> details;

    public BridgeFailure(int status, FailureCode code, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
        this.details = details == null || details.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public BridgeFailure(FailureCode code, String message) {
        this(code.defaultStatus(), code, message, null, null);
    }

    public BridgeFailure(FailureCode code, String message, Map<String, ?> details) {
        this(code.defaultStatus(), code, message, details, null);
    }

    public BridgeFailure(FailureCode code, String message, Map<String, ?> details, Throwable cause) {
        this(code.defaultStatus(), code, message, details, cause);
    }

    public static BridgeFailure notFound(String message) {
        return new BridgeFailure(FailureCode.RESOURCE_NOT_FOUND, message);
    }

    public static BridgeFailure invalidParameters(String message) {
        return new BridgeFailure(FailureCode.INVALID_PARAMETERS, message);
    }

    public static BridgeFailure unexpected(String message, Throwable cause) {
        return new BridgeFailure(FailureCode.UNEXPECTED_ERROR, message, null, cause);
    }

    public int getStatus() {
        return status;
    }

    public FailureCode getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
