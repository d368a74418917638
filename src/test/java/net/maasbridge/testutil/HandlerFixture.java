package net.maasbridge.testutil;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import net.maasbridge.config.BridgeCacheProperties;
import net.maasbridge.resource.audit.AuditEvent;
import net.maasbridge.resource.audit.AuditSink;
import net.maasbridge.resource.cache.CaffeineResourceCacheStore;
import net.maasbridge.resource.cache.ResourceCacheStore;
import net.maasbridge.resource.error.FailureNormalizer;
import net.maasbridge.resource.handler.ResourceHandlerSupport;
import net.maasbridge.resource.handler.ResourceMetrics;
import net.maasbridge.resource.handler.ResourceRegistry;
import net.maasbridge.resource.handler.ResponseRenderer;

/** Wires real handler collaborators around a scripted backend, a mutable clock and recording audit and meter sinks. */
public final class HandlerFixture {

    public final StubBackendClient backend = new StubBackendClient();
    public final MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    public final ResourceCacheStore cacheStore;
    public final ResourceRegistry registry = new ResourceRegistry();
    public final List<AuditEvent> auditEvents = new ArrayList<>();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final ResourceHandlerSupport support;

    public HandlerFixture() {
        this(clock -> new CaffeineResourceCacheStore(new BridgeCacheProperties(), clock));
    }

    public HandlerFixture(Function<MutableClock, ResourceCacheStore> storeFactory) {
        this.cacheStore = storeFactory.apply(clock);
        AuditSink sink = event -> {
            synchronized (auditEvents) {
                auditEvents.add(event);
            }
        };
        this.support = new ResourceHandlerSupport(backend, cacheStore, TestSchemas.parameterValidator(),
                new FailureNormalizer(), new ResponseRenderer(TestSchemas.MAPPER), sink,
                new ResourceMetrics(meterRegistry), registry, TestSchemas.MAPPER, clock);
    }

    public List<AuditEvent> auditEvents(String eventType) {
        synchronized (auditEvents) {
            return auditEvents.stream().filter(event -> event.eventType().equals(eventType)).toList();
        }
    }
}
