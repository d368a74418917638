package net.maasbridge.resource.cache;

import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.Set;

/**
 * Per-handler cache behaviour.
 *
 * @param enabled            handler-level switch, combined with the store's global switch
 * @param ttl                overrides the store's per-kind TTL when non-null
 * @param directives         Cache-Control flags for responses and stored entries
 * @param includeQueryParams whether query parameters take part in the cache key
 * @param keyQueryParams     allow-list of query parameter names used in the key; empty means all
 */
public record ResourceCacheOptions(boolean enabled,
                                   @Nullable Duration ttl,
                                   CacheControlDirectives directives,
                                   boolean includeQueryParams,
                                   Set<String> keyQueryParams) {

    public ResourceCacheOptions {
        directives = directives == null ? CacheControlDirectives.NONE : directives;
        keyQueryParams = keyQueryParams == null ? Set.of() : Set.copyOf(keyQueryParams);
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be non-negative: " + ttl);
        }
    }

    public static ResourceCacheOptions defaults() {
        return new ResourceCacheOptions(true, null, CacheControlDirectives.NONE, true, Set.of());
    }

    public static ResourceCacheOptions ofTtl(Duration ttl) {
        return defaults().withTtl(ttl);
    }

    public ResourceCacheOptions withEnabled(boolean value) {
        return new ResourceCacheOptions(value, ttl, directives, includeQueryParams, keyQueryParams);
    }

    public ResourceCacheOptions withTtl(@Nullable Duration value) {
        return new ResourceCacheOptions(enabled, value, directives, includeQueryParams, keyQueryParams);
    }

    public ResourceCacheOptions withDirectives(CacheControlDirectives value) {
        return new ResourceCacheOptions(enabled, ttl, value, includeQueryParams, keyQueryParams);
    }

    public ResourceCacheOptions withIncludeQueryParams(boolean value) {
        return new ResourceCacheOptions(enabled, ttl, directives, value, keyQueryParams);
    }

    public ResourceCacheOptions withKeyQueryParams(Set<String> value) {
        return new ResourceCacheOptions(enabled, ttl, directives, includeQueryParams, value);
    }
}
