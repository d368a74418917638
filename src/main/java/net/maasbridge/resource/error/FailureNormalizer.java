/**
 * Single classification boundary for resource handler failures
 *
 * @author William Callahan
 *
 * Features:
 * - Passes existing BridgeFailures through without double wrapping
 * - Rewrites id-scoped 404s into a uniform "not found" message
 * - Classifies cancellation, connectivity and timeout errors anywhere in the cause chain
 * - Maps payload schema failures to 422 with the structured issues
 * - Everything else becomes 500 unexpected_error
 */
package net.maasbridge.resource.error;

import io.netty.channel.ConnectTimeoutException;
import jakarta.annotation.Nullable;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import net.maasbridge.resource.backend.CancellationToken;
import net.maasbridge.resource.schema.SchemaValidationException;
import net.maasbridge.util.LoggingUtils;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class FailureNormalizer {

    private static final int MAX_CAUSE_DEPTH = 16;

    /**
     * Maps any error to a {@link BridgeFailure}. Rules are applied in priority order, first match wins.
     * A cancelled token turns any error that is not already a {@code BridgeFailure} into
     * {@code request_aborted}, so an abort racing a timeout reports the caller's intent.
     *
     * @param error      raw error from fetch or payload validation
     * @param kindLabel  resource kind named in messages
     * @param resourceId id of the requested resource, if any
     * @param token      the request's cancellation token, if any
     */
    public BridgeFailure normalize(Throwable error,
                                   String kindLabel,
                                   @Nullable String resourceId,
                                   @Nullable CancellationToken token) {
        String forId = hasText(resourceId) ? " for '" + resourceId + "'" : "";

        if (error instanceof BridgeFailure failure) {
            if (failure.getStatus() == 404 && hasText(resourceId)) {
                return new BridgeFailure(404, FailureCode.RESOURCE_NOT_FOUND,
                        kindLabel + " '" + resourceId + "' not found", failure.getDetails(), failure);
            }
            return failure;
        }

        if (isCancellation(error) || (token != null && token.isCancelled())) {
            log.info("{} request{} aborted by client", kindLabel, forId);
            return new BridgeFailure(FailureCode.REQUEST_ABORTED,
                    kindLabel + " request" + forId + " was aborted by the client", null, error);
        }

        if (findCause(error, FailureNormalizer::isConnectivityFailure) != null) {
            LoggingUtils.warn(log, error, "Network failure fetching {}{}", kindLabel, forId);
            return new BridgeFailure(FailureCode.NETWORK_ERROR,
                    "Failed to connect to MAAS API: Network connectivity issue",
                    Map.of("originalError", String.valueOf(rootCause(error).getMessage())), error);
        }

        if (findCause(error, FailureNormalizer::isTimeout) != null) {
            LoggingUtils.warn(log, error, "Timeout fetching {}{}", kindLabel, forId);
            return new BridgeFailure(FailureCode.REQUEST_TIMEOUT,
                    "MAAS API request timed out while fetching " + kindLabel + forId, null, error);
        }

        Throwable schemaFailure = findCause(error, t -> t instanceof SchemaValidationException);
        if (schemaFailure instanceof SchemaValidationException invalid) {
            log.warn("{} payload{} failed validation: {}", kindLabel, forId, invalid.getMessage());
            return new BridgeFailure(FailureCode.VALIDATION_ERROR,
                    kindLabel + " data validation failed" + forId
                            + ": The MAAS API returned data in an unexpected format",
                    Map.of("issues", invalid.getIssues()), error);
        }

        LoggingUtils.error(log, error, "Unexpected failure fetching {}{}", kindLabel, forId);
        return BridgeFailure.unexpected("Could not fetch " + kindLabel + forId + ": " + error.getMessage(), error);
    }

    private static boolean isCancellation(Throwable error) {
        return findCause(error, t -> t instanceof CancellationException) != null;
    }

    private static boolean isConnectivityFailure(Throwable t) {
        if (t instanceof ConnectTimeoutException) {
            return false;
        }
        return t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException
                || t instanceof UnresolvedAddressException;
    }

    private static boolean isTimeout(Throwable t) {
        return t instanceof TimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof ConnectTimeoutException
                || t instanceof io.netty.handler.timeout.TimeoutException;
    }

    @Nullable
    private static Throwable findCause(Throwable error, Predicate<Throwable> test) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (test.test(current)) {
                return current;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current.getCause() != null && current.getCause() != current && depth < MAX_CAUSE_DEPTH; depth++) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean hasText(@Nullable String value) {
        return value != null && !value.isBlank();
    }
}
