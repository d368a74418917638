package net.maasbridge.resource.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cached payload with the metadata needed for lazy expiry and the Age header.
 */
public record CacheEntry(Object payload, Instant storedAt, Duration ttl, CacheControlDirectives directives) {

    /**
     * Entries expire once strictly more than {@code ttl} has elapsed since they were stored.
     */
    public boolean isExpiredAt(Instant now) {
        return Duration.between(storedAt, now).compareTo(ttl) > 0;
    }

    /** Whole seconds since the entry was stored, never negative. */
    public long ageSeconds(Instant now) {
        return Math.max(0L, Duration.between(storedAt, now).getSeconds());
    }
}
