package net.maasbridge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import net.maasbridge.resource.cache.ResourceCacheStore;
import net.maasbridge.resource.handler.ResourceRegistry;
import net.maasbridge.resource.kinds.MaasResourceCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Application context smoke test for the MAAS resource bridge
 *
 * @author William Callahan
 *
 * Features:
 * - Verifies that the Spring application context loads without a reachable MAAS server
 * - Checks that every resource kind is registered with the host registry
 * - Checks that per-kind cache TTLs are bound from configuration
 */
@SpringBootTest(properties = {
    "maas.api.base-url=http://localhost:1/MAAS",
    "maas.cache.resource-ttl.zones=42s"
})
class MaasResourceBridgeApplicationTests {

    @Autowired
    private ResourceRegistry resourceRegistry;

    @Autowired
    private MaasResourceCatalog catalog;

    @Autowired
    private ResourceCacheStore resourceCacheStore;

    @Autowired
    @Qualifier("taskScheduler")
    private TaskScheduler applicationTaskScheduler;

    @Test
    void contextLoads() {
        // Test will pass if the context loads
    }

    @Test
    void should_RegisterEveryResourceKind_When_ContextStarts() {
        assertEquals(13, resourceRegistry.list().size());
        assertEquals(13, catalog.handlers().size());
        assertTrue(resourceRegistry.resolve("maas://machine/abc123/details").isPresent());
    }

    @Test
    void should_BindPerKindTtls_When_PropertiesOverrideDefaults() {
        assertEquals(Duration.ofSeconds(42), resourceCacheStore.ttlFor("Zones"));
        assertEquals(Duration.ofSeconds(60), resourceCacheStore.ttlFor("Machine"));
        assertTrue(resourceCacheStore.isEnabled());
    }

    @Test
    void should_UseDedicatedSchedulerPrefix_When_ContextLoadsTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = assertInstanceOf(ThreadPoolTaskScheduler.class, applicationTaskScheduler);
        assertEquals("BridgeScheduler-", scheduler.getThreadNamePrefix());
    }
}
