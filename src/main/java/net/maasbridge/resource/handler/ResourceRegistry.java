package net.maasbridge.resource.handler;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import net.maasbridge.resource.template.UriTemplateMatch;
import org.springframework.stereotype.Component;

/**
 * Host-side registry of named resource templates.
 *
 * <p>Resolution walks registrations in order and hands the URI to the first template that
 * matches it, together with the variables that template extracted.
 */
@Slf4j
@Component
public class ResourceRegistry {

    private final List<RegisteredResource> resources = new CopyOnWriteArrayList<>();

    public synchronized void register(RegisteredResource resource) {
        if (find(resource.name()).isPresent()) {
            throw new IllegalStateException("Resource already registered: " + resource.name());
        }
        resources.add(resource);
        log.info("Registered resource '{}' for template {}", resource.name(), resource.template().template());
    }

    public Optional<RegisteredResource> find(String name) {
        return resources.stream().filter(resource -> resource.name().equals(name)).findFirst();
    }

    public Optional<Resolution> resolve(String uri) {
        for (RegisteredResource resource : resources) {
            Optional<UriTemplateMatch> match = resource.template().match(uri);
            if (match.isPresent()) {
                return Optional.of(new Resolution(resource, match.get().variables()));
            }
        }
        return Optional.empty();
    }

    public List<RegisteredResource> list() {
        return List.copyOf(resources);
    }

    /**
     * A registration together with the variables its template extracted from the URI.
     */
    public record Resolution(RegisteredResource resource, Map<String, String> variables) {
    }
}
