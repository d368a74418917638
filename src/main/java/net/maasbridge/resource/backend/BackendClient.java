package net.maasbridge.resource.backend;

import java.util.Map;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Narrow read contract the resource handlers consume.
 *
 * <p>Implementations either fail with a pre-classified {@code BridgeFailure} (for status-coded
 * backend responses) or with the raw transport error, which the handler's normalizer classifies.
 * An empty {@code Mono} means the backend answered without a body.
 */
public interface BackendClient {

    /**
     * @param path  API path below the versioned root, e.g. {@code /machines/abc123/}
     * @param query query parameters, sent as-is
     * @param token cancellation token observed for the whole call, retries included
     */
    Mono<JsonNode> get(String path, Map<String, String> query, CancellationToken token);

    default Mono<JsonNode> get(String path, CancellationToken token) {
        return get(path, Map.of(), token);
    }
}
