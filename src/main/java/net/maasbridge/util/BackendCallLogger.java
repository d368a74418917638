package net.maasbridge.util;

import java.util.Map;
import org.slf4j.Logger;

/**
 * Centralized console logging for calls made to the MAAS REST API.
 *
 * Every line carries the {@code [MAAS-API]} prefix so backend traffic can be grepped
 * out of the bridge's request logs:
 * - ATTEMPT before the request is sent
 * - SUCCESS with status and response size
 * - FAILURE with the reason
 * - RETRY before each client-side retry
 */
public final class BackendCallLogger {

    private static final String PREFIX = "[MAAS-API]";

    private BackendCallLogger() {
    }

    public static void logAttempt(Logger log, String path, Map<String, String> query) {
        if (log.isDebugEnabled()) {
            log.debug(String.format("%s ATTEMPT: GET %s query=%s", PREFIX, path, query));
        }
    }

    public static void logSuccess(Logger log, String path, int status, int responseSize) {
        log.info(String.format("%s SUCCESS: GET %s returned HTTP %d (%d bytes)", PREFIX, path, status, responseSize));
    }

    public static void logFailure(Logger log, String path, String reason) {
        log.warn(String.format("%s FAILURE: GET %s - %s", PREFIX, path, reason));
    }

    public static void logRetry(Logger log, String path, long attempt, String reason) {
        log.warn(String.format("%s RETRY: GET %s attempt #%d after %s", PREFIX, path, attempt, reason));
    }
}
