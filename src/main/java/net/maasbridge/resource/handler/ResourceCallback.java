package net.maasbridge.resource.handler;

import java.util.Map;
import net.maasbridge.resource.backend.CancellationToken;
import reactor.core.publisher.Mono;

/**
 * Read callback registered with the host for a URI template.
 */
@FunctionalInterface
public interface ResourceCallback {

    Mono<ResourceResponse> read(String uri, Map<String, String> variables, CancellationToken token);
}
