package net.maasbridge.resource.handler;

/**
 * Cache invalidation entry points a registered resource exposes to operators.
 */
public interface CacheInvalidation {

    /** @return number of entries removed for the resource kind */
    int invalidateCache();

    /** @return number of entries removed for one resource id */
    int invalidateCacheById(String resourceId);
}
