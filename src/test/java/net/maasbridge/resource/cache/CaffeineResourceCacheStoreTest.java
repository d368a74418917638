package net.maasbridge.resource.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Cache;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import net.maasbridge.config.BridgeCacheProperties;
import net.maasbridge.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CaffeineResourceCacheStoreTest {

    private MutableClock clock;
    private BridgeCacheProperties properties;
    private CaffeineResourceCacheStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        properties = new BridgeCacheProperties();
        store = new CaffeineResourceCacheStore(properties, clock);
    }

    private static CacheKey machineKey(String id) {
        return CacheKey.of("Machine", "maas://machine/" + id + "/details", id, Map.of(), ResourceCacheOptions.defaults());
    }

    @Test
    void shouldReturnStoredPayloadUntilTtlElapses() {
        CacheKey key = machineKey("abc");
        store.set(key, "payload", "Machine", ResourceCacheOptions.ofTtl(Duration.ofSeconds(60)));

        clock.advance(Duration.ofSeconds(60));
        assertThat(store.get(key)).get().extracting(CacheEntry::payload).isEqualTo("payload");

        clock.advance(Duration.ofMillis(1));
        assertThat(store.get(key)).isEmpty();
    }

    @Test
    void shouldUsePerKindTtlWhenOptionsLeaveItUnset() {
        CacheKey key = machineKey("abc");
        store.set(key, "payload", "Machine", ResourceCacheOptions.defaults());

        assertThat(store.get(key)).get().extracting(CacheEntry::ttl).isEqualTo(Duration.ofSeconds(60));
        assertThat(store.ttlFor("machines")).isEqualTo(Duration.ofSeconds(30));
        assertThat(store.ttlFor("Unknown")).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void shouldApplyRuntimeTtlChanges() {
        store.setResourceTtl("Zone", Duration.ofSeconds(5));
        store.setDefaultTtl(Duration.ofSeconds(7));

        assertThat(store.ttlFor("zone")).isEqualTo(Duration.ofSeconds(5));
        assertThat(store.ttlFor("anything")).isEqualTo(Duration.ofSeconds(7));
        assertThatThrownBy(() -> store.setDefaultTtl(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void repeatedSetShouldKeepLastWriter() {
        CacheKey key = machineKey("abc");
        store.set(key, "first", "Machine", ResourceCacheOptions.defaults());
        store.set(key, "second", "Machine", ResourceCacheOptions.defaults());

        assertThat(store.get(key)).get().extracting(CacheEntry::payload).isEqualTo("second");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void shouldReportAgeInWholeSeconds() {
        CacheKey key = machineKey("abc");
        store.set(key, "payload", "Machine", ResourceCacheOptions.defaults());

        clock.advance(Duration.ofMillis(12_900));

        assertThat(store.get(key)).get()
                .extracting(entry -> entry.ageSeconds(clock.instant()))
                .isEqualTo(12L);
    }

    @Test
    void invalidateByIdShouldOnlyRemoveMatchingEntries() {
        store.set(machineKey("a"), "a", "Machine", ResourceCacheOptions.defaults());
        store.set(machineKey("b"), "b", "Machine", ResourceCacheOptions.defaults());
        CacheKey list = CacheKey.of("Machines", "maas://machines/list", null, Map.of(), ResourceCacheOptions.defaults());
        store.set(list, "list", "Machines", ResourceCacheOptions.defaults());

        assertThat(store.invalidate("Machine", "a")).isEqualTo(1);
        assertThat(store.get(machineKey("a"))).isEmpty();
        assertThat(store.get(machineKey("b"))).isPresent();
        assertThat(store.get(list)).isPresent();
    }

    @Test
    void invalidateByKindShouldRemoveEveryEntryOfThatKindOnly() {
        store.set(machineKey("a"), "a", "Machine", ResourceCacheOptions.defaults());
        store.set(machineKey("b"), "b", "Machine", ResourceCacheOptions.defaults());
        CacheKey list = CacheKey.of("Machines", "maas://machines/list", null, Map.of(), ResourceCacheOptions.defaults());
        store.set(list, "list", "Machines", ResourceCacheOptions.defaults());

        assertThat(store.invalidate("Machine")).isEqualTo(2);
        assertThat(store.get(list)).isPresent();
        assertThat(store.invalidate("Machine")).isZero();
    }

    @Test
    void disabledStoreShouldNeitherStoreNorServe() {
        CacheKey key = machineKey("abc");
        store.set(key, "payload", "Machine", ResourceCacheOptions.defaults());
        store.setEnabled(false);

        assertThat(store.get(key)).isEmpty();
        store.set(machineKey("other"), "payload", "Machine", ResourceCacheOptions.defaults());

        store.setEnabled(true);
        assertThat(store.get(machineKey("other"))).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void lookupFaultShouldBeTreatedAsMiss() {
        Cache<CacheKey, CacheEntry> broken = mock(Cache.class);
        when(broken.getIfPresent(any())).thenThrow(new IllegalStateException("backing store unavailable"));
        doThrow(new IllegalStateException("backing store unavailable")).when(broken).put(any(), any());
        CaffeineResourceCacheStore faulty = new CaffeineResourceCacheStore(broken, properties, clock);

        CacheKey key = machineKey("abc");
        faulty.set(key, "payload", "Machine", ResourceCacheOptions.defaults());

        assertThat(faulty.get(key)).isEqualTo(Optional.empty());
    }
}
