package net.maasbridge.resource.cache;

import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.Optional;

/**
 * Shared TTL store of validated resource payloads.
 *
 * <p>The store is an optimization layer only. {@link #get} never throws and reports internal
 * faults as a miss; {@link #set} is best-effort and never fails the request that produced the
 * payload. Concurrent writers to the same key resolve to last-writer-wins.
 */
public interface ResourceCacheStore {

    /**
     * @return the live entry, or empty on a miss, an expired entry, a disabled store or a lookup fault
     */
    Optional<CacheEntry> get(CacheKey key);

    /**
     * Stores a payload under {@code key}. TTL comes from {@code options} when set, otherwise from
     * {@link #ttlFor(String)}.
     */
    void set(CacheKey key, Object payload, String kind, ResourceCacheOptions options);

    /** Global kill-switch, independent of per-handler options. */
    boolean isEnabled();

    /** Per-kind TTL, falling back to the default TTL. */
    Duration ttlFor(String kind);

    /**
     * Removes every entry of {@code kind}, or only those whose key carries {@code id}.
     *
     * @return number of entries removed
     */
    int invalidate(String kind, @Nullable String id);

    default int invalidate(String kind) {
        return invalidate(kind, null);
    }

    void setEnabled(boolean enabled);

    void setDefaultTtl(Duration ttl);

    void setResourceTtl(String kind, Duration ttl);

    /** Number of entries currently held (expired entries not yet read may be included). */
    long size();
}
