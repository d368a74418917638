package net.maasbridge.config;

import java.time.Clock;
import net.maasbridge.resource.audit.AuditSink;
import net.maasbridge.resource.backend.BackendClient;
import net.maasbridge.resource.cache.CaffeineResourceCacheStore;
import net.maasbridge.resource.cache.ResourceCacheStore;
import net.maasbridge.resource.error.FailureNormalizer;
import net.maasbridge.resource.handler.ResourceHandlerSupport;
import net.maasbridge.resource.handler.ResourceMetrics;
import net.maasbridge.resource.handler.ResourceRegistry;
import net.maasbridge.resource.handler.ResponseRenderer;
import net.maasbridge.resource.schema.ParameterValidator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

/**
 * Wires the shared cache store and the collaborators every resource handler uses.
 */
@Configuration
public class ResourceHandlerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One store shared by all handlers; TTL and the global switch come from {@code maas.cache.*}.
     */
    @Bean
    public ResourceCacheStore resourceCacheStore(BridgeCacheProperties properties, Clock clock) {
        return new CaffeineResourceCacheStore(properties, clock);
    }

    @Bean
    public ResourceHandlerSupport resourceHandlerSupport(BackendClient backendClient,
                                                         ResourceCacheStore resourceCacheStore,
                                                         ParameterValidator parameterValidator,
                                                         FailureNormalizer failureNormalizer,
                                                         ResponseRenderer responseRenderer,
                                                         AuditSink auditSink,
                                                         ResourceMetrics resourceMetrics,
                                                         ResourceRegistry resourceRegistry,
                                                         ObjectMapper objectMapper,
                                                         Clock clock) {
        return new ResourceHandlerSupport(backendClient, resourceCacheStore, parameterValidator,
                failureNormalizer, responseRenderer, auditSink, resourceMetrics, resourceRegistry, objectMapper, clock);
    }
}
