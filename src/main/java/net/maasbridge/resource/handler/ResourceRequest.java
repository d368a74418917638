package net.maasbridge.resource.handler;

import jakarta.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A matched and validated resource read, as seen by fetchers.
 *
 * @param uri        the URI as requested
 * @param path       URI without query string
 * @param params     validated parameters
 * @param resourceId id for id-scoped kinds, otherwise null
 * @param query      raw query parameters minus the reserved presentation/client keys
 * @param filters    validated query parameters forwarded to the backend (list kinds only)
 * @param client     caller identity taken from reserved query parameters
 * @param format     requested rendering
 * @param requestId  correlation id for logs and audit
 */
public record ResourceRequest<P>(String uri,
                                 String path,
                                 P params,
                                 @Nullable String resourceId,
                                 Map<String, String> query,
                                 Map<String, String> filters,
                                 ClientInfo client,
                                 ResponseFormat format,
                                 String requestId) {

    public ResourceRequest {
        query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
        filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    /**
     * Caller identity supplied through the {@code userId} and {@code ipAddress} query parameters.
     */
    public record ClientInfo(@Nullable String userId, @Nullable String ipAddress) {
        public static final ClientInfo ANONYMOUS = new ClientInfo(null, null);
    }
}
