package net.maasbridge.resource.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Map;

/**
 * Structured audit record for resource reads and cache operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(String eventType,
                         String resourceType,
                         @Nullable String resourceId,
                         String action,
                         String status,
                         @Nullable String userId,
                         @Nullable String ipAddress,
                         @Nullable String requestId,
                         Instant timestamp,
                         Map<String, Object> details) {

    public static final String RESOURCE_ACCESS = "resource_access";
    public static final String CACHE_OPERATION = "cache_operation";

    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";

    public AuditEvent {
        details = details == null ? Map.of() : details;
    }

    public AuditEvent withDetails(Map<String, Object> replacement) {
        return new AuditEvent(eventType, resourceType, resourceId, action, status, userId, ipAddress,
                requestId, timestamp, replacement);
    }
}
