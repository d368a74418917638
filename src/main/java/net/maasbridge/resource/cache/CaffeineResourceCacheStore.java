/**
 * Caffeine-backed resource cache store
 *
 * @author William Callahan
 *
 * Features:
 * - Bounded size with Caffeine's size-based eviction
 * - Variable per-entry TTL through a custom Expiry
 * - Lazy expiry at read time against an injected Clock
 * - Structured invalidation by kind or by kind plus resource id
 * - Runtime switches for the global flag and TTL table
 */
package net.maasbridge.resource.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import jakarta.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import net.maasbridge.config.BridgeCacheProperties;
import net.maasbridge.util.LoggingUtils;

@Slf4j
public class CaffeineResourceCacheStore implements ResourceCacheStore {

    private final Cache<CacheKey, CacheEntry> entries;
    private final Clock clock;
    private final Map<String, Duration> resourceTtls = new ConcurrentHashMap<>();
    private volatile boolean enabled;
    private volatile Duration defaultTtl;

    public CaffeineResourceCacheStore(BridgeCacheProperties properties, Clock clock) {
        this(Caffeine.newBuilder()
                .maximumSize(properties.getMaxSize())
                .expireAfter(new EntryTtlExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build(), properties, clock);
    }

    CaffeineResourceCacheStore(Cache<CacheKey, CacheEntry> entries, BridgeCacheProperties properties, Clock clock) {
        this.entries = entries;
        this.clock = clock;
        this.enabled = properties.isEnabled();
        this.defaultTtl = properties.getDefaultTtl();
        properties.getResourceTtl().forEach(this::setResourceTtl);
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            CacheEntry entry = entries.getIfPresent(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpiredAt(clock.instant())) {
                entries.asMap().remove(key, entry);
                log.debug("Cache entry expired for {}", key);
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Cache lookup failed for {}; falling back to backend", key);
            return Optional.empty();
        }
    }

    @Override
    public void set(CacheKey key, Object payload, String kind, ResourceCacheOptions options) {
        if (!enabled) {
            return;
        }
        try {
            Duration ttl = options.ttl() != null ? options.ttl() : ttlFor(kind);
            entries.put(key, new CacheEntry(payload, clock.instant(), ttl, options.directives()));
            log.debug("Cached {} for {}s", key, ttl.getSeconds());
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Cache write failed for {}; response is still served", key);
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Duration ttlFor(String kind) {
        Duration ttl = kind == null ? null : resourceTtls.get(kind.toLowerCase(Locale.ROOT));
        return ttl != null ? ttl : defaultTtl;
    }

    @Override
    public int invalidate(String kind, @Nullable String id) {
        try {
            List<CacheKey> doomed = new ArrayList<>();
            for (CacheKey key : entries.asMap().keySet()) {
                if (key.belongsTo(kind, id)) {
                    doomed.add(key);
                }
            }
            int removed = 0;
            for (CacheKey key : doomed) {
                if (entries.asMap().remove(key) != null) {
                    removed++;
                }
            }
            log.debug("Invalidated {} cache entries for kind={} id={}", removed, kind, id);
            return removed;
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Cache invalidation failed for kind={} id={}; nothing removed", kind, id);
            return 0;
        }
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        log.info("Resource cache {}", enabled ? "enabled" : "disabled");
    }

    @Override
    public void setDefaultTtl(Duration ttl) {
        requireNonNegative(ttl);
        this.defaultTtl = ttl;
    }

    @Override
    public void setResourceTtl(String kind, Duration ttl) {
        requireNonNegative(ttl);
        resourceTtls.put(kind.toLowerCase(Locale.ROOT), ttl);
    }

    @Override
    public long size() {
        return entries.estimatedSize();
    }

    private static void requireNonNegative(Duration ttl) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be non-negative: " + ttl);
        }
    }

    /**
     * Lets Caffeine reclaim an entry once its own TTL has passed. Reads do not extend the lifetime.
     */
    private static final class EntryTtlExpiry implements Expiry<CacheKey, CacheEntry> {
        @Override
        public long expireAfterCreate(CacheKey key, CacheEntry value, long currentTime) {
            return saturatedNanos(value.ttl());
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CacheEntry value, long currentTime, long currentDuration) {
            return saturatedNanos(value.ttl());
        }

        @Override
        public long expireAfterRead(CacheKey key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        // Caffeine treats an elapsed duration as expired, so add one tick to keep "age == ttl" live
        private static long saturatedNanos(Duration ttl) {
            try {
                return Math.addExact(ttl.toNanos(), TimeUnit.MILLISECONDS.toNanos(1));
            } catch (ArithmeticException overflow) {
                return Long.MAX_VALUE;
            }
        }
    }
}
