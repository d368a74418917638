package net.maasbridge.controller;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.maasbridge.controller.support.ErrorResponseUtils;
import net.maasbridge.resource.error.BridgeFailure;
import net.maasbridge.resource.error.FailureCode;
import net.maasbridge.util.LoggingUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders failures as {@code {"error", "message", "status", "details"}} JSON bodies.
 *
 * <p>{@link BridgeFailure}s keep their status, including the non-standard 499 for aborted requests.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BridgeFailure.class)
    public ResponseEntity<Map<String, Object>> handleBridgeFailure(BridgeFailure failure) {
        if (failure.getStatus() >= 500) {
            log.warn("Resource request failed with {} {}: {}", failure.getStatus(), failure.getCode(), failure.getMessage());
        } else {
            log.debug("Resource request rejected with {} {}: {}", failure.getStatus(), failure.getCode(), failure.getMessage());
        }
        return ErrorResponseUtils.error(failure);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException e) {
        return ErrorResponseUtils.error(FailureCode.INVALID_PARAMETERS,
                "Missing required parameter '" + e.getParameterName() + "'");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        LoggingUtils.error(log, e, "Unhandled exception while serving request");
        return ErrorResponseUtils.error(FailureCode.UNEXPECTED_ERROR, "An unexpected error occurred");
    }
}
