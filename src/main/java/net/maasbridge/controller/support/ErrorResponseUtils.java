package net.maasbridge.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import net.maasbridge.resource.error.BridgeFailure;
import net.maasbridge.resource.error.FailureCode;
import org.springframework.http.ResponseEntity;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(FailureCode code, String message, int status, Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code.value());
        body.put("message", message);
        body.put("status", status);
        if (details != null && !details.isEmpty()) {
            body.put("details", details);
        }
        return body;
    }

    public static ResponseEntity<Map<String, Object>> error(BridgeFailure failure) {
        return ResponseEntity.status(failure.getStatus())
                .body(errorBody(failure.getCode(), failure.getMessage(), failure.getStatus(), failure.getDetails()));
    }

    public static ResponseEntity<Map<String, Object>> error(FailureCode code, String message) {
        return ResponseEntity.status(code.defaultStatus())
                .body(errorBody(code, message, code.defaultStatus(), null));
    }
}
