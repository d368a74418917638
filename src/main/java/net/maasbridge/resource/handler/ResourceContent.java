package net.maasbridge.resource.handler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One content item of a response envelope.
 *
 * @param uri      canonical URI of the resource
 * @param text     serialized payload
 * @param mimeType media type of {@code text}
 * @param headers  Content-Type, Cache-Control, ETag and, for cache hits only, Age
 */
public record ResourceContent(String uri, String text, String mimeType, Map<String, String> headers) {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CACHE_CONTROL = "Cache-Control";
    public static final String ETAG = "ETag";
    public static final String AGE = "Age";

    public ResourceContent {
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public String header(String name) {
        return headers.get(name);
    }
}
