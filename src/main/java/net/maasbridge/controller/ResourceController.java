/**
 * HTTP front door for registered MAAS resources
 *
 * @author William Callahan
 *
 * Features:
 * - Resolves a resource URI against the registered templates and returns the response envelope
 * - Copies Cache-Control, ETag and Age from the content onto the HTTP response
 * - Cancels the in-flight backend call when the client goes away
 * - Lists registered templates and exposes per-resource cache invalidation
 */
package net.maasbridge.controller;

import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.maasbridge.resource.backend.CancellationToken;
import net.maasbridge.resource.error.BridgeFailure;
import net.maasbridge.resource.handler.RegisteredResource;
import net.maasbridge.resource.handler.ResourceContent;
import net.maasbridge.resource.handler.ResourceRegistry;
import net.maasbridge.resource.handler.ResourceResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/resources")
public class ResourceController {

    private static final List<String> FORWARDED_HEADERS =
            List.of(ResourceContent.CACHE_CONTROL, ResourceContent.ETAG, ResourceContent.AGE);

    private final ResourceRegistry registry;

    public ResourceController(ResourceRegistry registry) {
        this.registry = registry;
    }

    /**
     * Reads one resource.
     *
     * @param uri resource URI such as {@code maas://machine/abc123/details?format=xml}
     * @return response envelope; failures are rendered by {@link GlobalExceptionHandler}
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ResourceResponse>> read(@RequestParam("uri") String uri) {
        ResourceRegistry.Resolution resolution = registry.resolve(uri)
                .orElseThrow(() -> BridgeFailure.notFound("No resource template matches '" + uri + "'"));
        CancellationToken token = new CancellationToken();
        return resolution.resource().callback()
                .read(uri, resolution.variables(), token)
                .map(ResourceController::toEntity)
                .doOnCancel(() -> {
                    log.debug("Client went away while reading {}", uri);
                    token.cancel();
                });
    }

    @GetMapping(value = "/templates", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Map<String, String>> templates() {
        return registry.list().stream()
                .map(resource -> Map.of(
                        "name", resource.name(),
                        "template", resource.template().template(),
                        "description", resource.description() == null ? "" : resource.description()))
                .toList();
    }

    @DeleteMapping(value = "/{name}/cache", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Integer> invalidate(@PathVariable("name") String name) {
        return Map.of("removed", find(name).cache().invalidateCache());
    }

    @DeleteMapping(value = "/{name}/cache/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Integer> invalidateById(@PathVariable("name") String name, @PathVariable("id") String id) {
        return Map.of("removed", find(name).cache().invalidateCacheById(id));
    }

    private RegisteredResource find(String name) {
        return registry.find(name)
                .orElseThrow(() -> BridgeFailure.notFound("Resource '" + name + "' is not registered"));
    }

    private static ResponseEntity<ResourceResponse> toEntity(ResourceResponse response) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok();
        ResourceContent content = response.first();
        for (String header : FORWARDED_HEADERS) {
            String value = content.header(header);
            if (value != null) {
                builder.header(header, value);
            }
        }
        return builder.body(response);
    }
}
