package net.maasbridge.resource.cache;

import java.time.Duration;

/**
 * Cache-Control flags attached to a handler's cache options and to every stored entry.
 */
public record CacheControlDirectives(boolean privateCache, boolean mustRevalidate, boolean immutable) {

    public static final CacheControlDirectives NONE = new CacheControlDirectives(false, false, false);
    public static final CacheControlDirectives MUST_REVALIDATE = new CacheControlDirectives(false, true, false);

    /**
     * Renders the header value, e.g. {@code max-age=60, private, must-revalidate}.
     */
    public String toHeaderValue(Duration ttl) {
        StringBuilder value = new StringBuilder("max-age=").append(Math.max(0, ttl.getSeconds()));
        if (privateCache) {
            value.append(", private");
        }
        if (mustRevalidate) {
            value.append(", must-revalidate");
        }
        if (immutable) {
            value.append(", immutable");
        }
        return value.toString();
    }
}
