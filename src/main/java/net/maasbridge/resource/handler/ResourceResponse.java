package net.maasbridge.resource.handler;

import java.util.List;

/**
 * Response envelope returned by a resource resolution.
 */
public record ResourceResponse(List<ResourceContent> contents) {

    public ResourceResponse {
        contents = List.copyOf(contents);
    }

    public static ResourceResponse of(ResourceContent content) {
        return new ResourceResponse(List.of(content));
    }

    /** The single content item every handler response carries. */
    public ResourceContent first() {
        return contents.get(0);
    }
}
