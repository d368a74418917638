package net.maasbridge.resource.handler;

import java.time.Clock;
import net.maasbridge.resource.audit.AuditSink;
import net.maasbridge.resource.backend.BackendClient;
import net.maasbridge.resource.cache.ResourceCacheStore;
import net.maasbridge.resource.error.FailureNormalizer;
import net.maasbridge.resource.schema.ParameterValidator;
import tools.jackson.databind.ObjectMapper;

/**
 * Collaborators shared by every {@link ResourceHandler}, injected once instead of per kind.
 */
public record ResourceHandlerSupport(BackendClient backend,
                                     ResourceCacheStore cacheStore,
                                     ParameterValidator parameterValidator,
                                     FailureNormalizer failureNormalizer,
                                     ResponseRenderer renderer,
                                     AuditSink auditSink,
                                     ResourceMetrics metrics,
                                     ResourceRegistry registry,
                                     ObjectMapper objectMapper,
                                     Clock clock) {
}
