package net.maasbridge.resource.handler;

import net.maasbridge.resource.template.UriTemplate;

/**
 * A resource published to the host under a name.
 */
public record RegisteredResource(String name,
                                 UriTemplate template,
                                 String description,
                                 ResourceCallback callback,
                                 CacheInvalidation cache) {
}
