package net.maasbridge.resource.handler;

import net.maasbridge.resource.backend.BackendClient;
import net.maasbridge.resource.backend.CancellationToken;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Fetches the raw backend payload for a validated request.
 */
@FunctionalInterface
public interface ResourceFetcher<P> {

    Mono<JsonNode> fetch(BackendClient backend, ResourceRequest<P> request, CancellationToken token);

    /** {@code GET <endpoint>/<id>/} */
    static <P> ResourceFetcher<P> byId(String endpoint) {
        return (backend, request, token) -> backend.get(endpoint + "/" + request.resourceId() + "/", token);
    }

    /** {@code GET <endpoint>/} with the request's filters as query parameters. */
    static <P> ResourceFetcher<P> collection(String endpoint) {
        return (backend, request, token) -> backend.get(endpoint + "/", request.filters(), token);
    }
}
