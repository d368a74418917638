/**
 * Generic read handler shared by every MAAS resource kind
 *
 * @author William Callahan
 *
 * Features:
 * - Matches the URI against the kind's template and validates the extracted parameters
 * - Serves from the shared TTL store when caching is enabled, otherwise fetches from MAAS
 * - Validates backend payloads before they are cached or returned
 * - Normalizes every failure through the FailureNormalizer priority order
 * - Builds the response envelope with Content-Type, Cache-Control, ETag and Age headers
 * - Emits resource_access and cache_operation audit events
 */
package net.maasbridge.resource.handler;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import net.maasbridge.resource.audit.AuditEvent;
import net.maasbridge.resource.backend.CancellationToken;
import net.maasbridge.resource.cache.CacheEntry;
import net.maasbridge.resource.cache.CacheKey;
import net.maasbridge.resource.cache.ResourceCacheOptions;
import net.maasbridge.resource.cache.ResourceCacheStore;
import net.maasbridge.resource.error.BridgeFailure;
import net.maasbridge.resource.error.FailureCode;
import net.maasbridge.resource.handler.ResourceRequest.ClientInfo;
import net.maasbridge.resource.template.UriTemplate;
import net.maasbridge.resource.template.UriTemplateMatch;
import net.maasbridge.util.HashUtils;
import net.maasbridge.util.IdGenerator;
import net.maasbridge.util.LoggingUtils;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.MissingNode;

@Slf4j
public class ResourceHandler<P, T> implements CacheInvalidation {

    static final String FORMAT_PARAMETER = "format";
    static final String USER_ID_PARAMETER = "userId";
    static final String IP_ADDRESS_PARAMETER = "ipAddress";

    private final ResourceKind<P, T> kind;
    private final UriTemplate template;
    private final ResourceHandlerSupport support;
    private final AtomicReference<ResourceCacheOptions> cacheOptions;

    public ResourceHandler(ResourceKind<P, T> kind, ResourceHandlerSupport support) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.support = Objects.requireNonNull(support, "support");
        this.template = UriTemplate.compile(kind.getTemplate());
        this.cacheOptions = new AtomicReference<>(kind.getDefaultCacheOptions());
    }

    /**
     * Publishes this handler with the host registry under {@code name}.
     */
    public RegisteredResource register(String name) {
        RegisteredResource resource = new RegisteredResource(
                name, template, kind.getDescription(), this::resolve, this);
        support.registry().register(resource);
        return resource;
    }

    /**
     * Resolves one resource read.
     *
     * @param uri       requested URI, including any query string
     * @param variables variables the host extracted; the handler's own template match takes precedence
     * @param token     caller-owned cancellation signal
     * @return the response envelope, or a {@link BridgeFailure} error signal
     */
    public Mono<ResourceResponse> resolve(String uri, Map<String, String> variables, CancellationToken token) {
        CancellationToken effectiveToken = token == null ? CancellationToken.none() : token;
        long startedNanos = System.nanoTime();
        String requestId = IdGenerator.requestId();
        AtomicReference<ResourceRequest<P>> prepared = new AtomicReference<>();

        return Mono.defer(() -> {
                    ResourceRequest<P> request = prepare(uri, variables, requestId);
                    prepared.set(request);
                    return serve(request, effectiveToken);
                })
                .onErrorMap(error -> support.failureNormalizer()
                        .normalize(error, kind.subjectLabel(), null, effectiveToken))
                .doOnNext(served -> auditAccess(prepared.get(), requestId, uri, served, null, startedNanos))
                .doOnError(error -> auditAccess(prepared.get(), requestId, uri, null, error, startedNanos))
                .map(Served::response);
    }

    private ResourceRequest<P> prepare(String uri, Map<String, String> hostVariables, String requestId) {
        UriTemplateMatch match = support.parameterValidator().extract(() -> matchUri(uri), kind.getLabel());

        Map<String, String> query = new LinkedHashMap<>(match.query());
        ResponseFormat format = ResponseFormat.fromParameter(query.remove(FORMAT_PARAMETER));
        ClientInfo client = new ClientInfo(query.remove(USER_ID_PARAMETER), query.remove(IP_ADDRESS_PARAMETER));

        Map<String, String> rawParameters = new LinkedHashMap<>();
        if (hostVariables != null) {
            rawParameters.putAll(hostVariables);
        }
        rawParameters.putAll(query);
        rawParameters.putAll(match.variables());

        P params = support.parameterValidator().validate(rawParameters, kind.getParameterSchema(), kind.getLabel());

        String resourceId = null;
        if (kind.isIdScoped()) {
            resourceId = kind.getIdExtractor().apply(params);
            if (resourceId == null || resourceId.isBlank()) {
                throw new BridgeFailure(FailureCode.INVALID_PARAMETERS,
                        kind.subjectLabel() + " ID is missing or empty in the resource URI");
            }
        }

        Map<String, String> filters = kind.getVariant() == ResourceKind.Variant.LIST
                ? toBackendQuery(params)
                : Map.of();
        return new ResourceRequest<>(uri, match.path(), params, resourceId, query, filters, client, format, requestId);
    }

    private UriTemplateMatch matchUri(String uri) {
        if (uri == null) {
            throw new BridgeFailure(FailureCode.INVALID_PARAMETERS, "Resource URI is required");
        }
        return template.match(uri).orElseThrow(() -> new BridgeFailure(FailureCode.INVALID_PARAMETERS,
                "Invalid " + kind.getLabel() + " URI '" + uri + "': expected " + template.template()));
    }

    private Map<String, String> toBackendQuery(P params) {
        JsonNode tree = support.objectMapper().valueToTree(params);
        Map<String, String> backendQuery = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> property : tree.properties()) {
            JsonNode value = property.getValue();
            if (value == null || value.isNull() || value.isMissingNode()) {
                continue;
            }
            backendQuery.put(property.getKey(), value.isValueNode() ? value.asString() : value.toString());
        }
        return backendQuery;
    }

    private Mono<Served> serve(ResourceRequest<P> request, CancellationToken token) {
        ResourceCacheOptions options = cacheOptions.get();
        ResourceCacheStore store = support.cacheStore();
        boolean caching = options.enabled() && store.isEnabled();

        if (caching && kind.getVariant() == ResourceKind.Variant.LIST && hasFilters(request.query())) {
            int removed = store.invalidate(kind.getLabel());
            log.debug("Filtered {} request; invalidated {} cached entries", kind.getLabel(), removed);
            auditCacheOperation("invalidate_on_filter", null, removed, request.client());
        }

        CacheKey key = CacheKey.of(kind.getLabel(), request.path(), request.resourceId(), request.query(), options);
        if (caching) {
            Optional<CacheEntry> cached = store.get(key);
            if (cached.isPresent()) {
                CacheEntry entry = cached.get();
                log.debug("Cache hit for {}", key);
                long age = entry.ageSeconds(support.clock().instant());
                return Mono.just(new Served(respond(request, entry.payload(), options, age), entry.payload(), true));
            }
        }

        return Mono.defer(() -> kind.getFetcher().fetch(support.backend(), request, token))
                .defaultIfEmpty(MissingNode.getInstance())
                .map(node -> validatePayload(node, request))
                .map(payload -> {
                    if (caching) {
                        store.set(key, payload, kind.getLabel(), options);
                    }
                    return new Served(respond(request, payload, options, null), payload, false);
                })
                .onErrorMap(error -> support.failureNormalizer()
                        .normalize(error, kind.subjectLabel(), request.resourceId(), token));
    }

    private boolean hasFilters(Map<String, String> query) {
        return query.keySet().stream().anyMatch(kind.getFilterParameters()::contains);
    }

    private T validatePayload(JsonNode node, ResourceRequest<P> request) {
        if (kind.isIdScoped() && (node.isMissingNode() || node.isNull())) {
            throw BridgeFailure.notFound(kind.subjectLabel() + " '" + request.resourceId() + "' not found");
        }
        return kind.getPayloadSchema().validate(node);
    }

    private ResourceResponse respond(ResourceRequest<P> request, Object payload, ResourceCacheOptions options,
                                     Long ageSeconds) {
        ResponseRenderer.RenderedBody body = support.renderer()
                .render(payload, request.format(), kind.xmlRootName());
        Duration ttl = options.ttl() != null ? options.ttl() : support.cacheStore().ttlFor(kind.getLabel());

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(ResourceContent.CONTENT_TYPE, body.mimeType());
        headers.put(ResourceContent.CACHE_CONTROL, options.directives().toHeaderValue(ttl));
        headers.put(ResourceContent.ETAG, HashUtils.entityTag(body.text()));
        if (ageSeconds != null) {
            headers.put(ResourceContent.AGE, String.valueOf(ageSeconds));
        }
        return ResourceResponse.of(new ResourceContent(request.uri(), body.text(), body.mimeType(), headers));
    }

    @Override
    public int invalidateCache() {
        return invalidate(null);
    }

    @Override
    public int invalidateCacheById(String resourceId) {
        Objects.requireNonNull(resourceId, "resourceId");
        return invalidate(resourceId);
    }

    private int invalidate(String resourceId) {
        if (!cacheOptions.get().enabled() || !support.cacheStore().isEnabled()) {
            return 0;
        }
        int removed = support.cacheStore().invalidate(kind.getLabel(), resourceId);
        log.info("Invalidated {} cached {} entries{}", removed, kind.getLabel(),
                resourceId == null ? "" : " for '" + resourceId + "'");
        auditCacheOperation(resourceId == null ? "invalidate" : "invalidate_by_id", resourceId, removed,
                ClientInfo.ANONYMOUS);
        return removed;
    }

    public void setCacheOptions(ResourceCacheOptions options) {
        cacheOptions.set(Objects.requireNonNull(options, "options"));
        log.info("Cache options for {} updated: {}", kind.getLabel(), options);
    }

    public ResourceCacheOptions updateCacheOptions(UnaryOperator<ResourceCacheOptions> update) {
        ResourceCacheOptions updated = cacheOptions.updateAndGet(update);
        log.info("Cache options for {} updated: {}", kind.getLabel(), updated);
        return updated;
    }

    public ResourceCacheOptions getCacheOptions() {
        return cacheOptions.get();
    }

    public ResourceKind<P, T> kind() {
        return kind;
    }

    public UriTemplate template() {
        return template;
    }

    private void auditAccess(ResourceRequest<P> request, String requestId, String uri, Served served,
                             Throwable error, long startedNanos) {
        long elapsedNanos = System.nanoTime() - startedNanos;
        String outcome = served != null
                ? (served.cacheHit() ? ResourceMetrics.OUTCOME_HIT : ResourceMetrics.OUTCOME_MISS)
                : outcomeOf(error);
        support.metrics().recordRead(kind.getLabel(), outcome, elapsedNanos);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("uri", uri);
        details.put("durationMs", TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        if (served != null) {
            details.put("cacheHit", served.cacheHit());
            details.put("resourceState", served.payload());
        }
        if (error instanceof BridgeFailure failure) {
            details.put("errorCode", failure.getCode().value());
            details.put("errorStatus", failure.getStatus());
            details.put("errorMessage", failure.getMessage());
        } else if (error != null) {
            details.put("errorMessage", error.getMessage());
        }
        ClientInfo client = request != null ? request.client() : ClientInfo.ANONYMOUS;
        record(new AuditEvent(
                AuditEvent.RESOURCE_ACCESS,
                kind.getLabel(),
                request != null ? request.resourceId() : null,
                "read",
                error == null ? AuditEvent.SUCCESS : AuditEvent.FAILURE,
                client.userId(),
                client.ipAddress(),
                requestId,
                support.clock().instant(),
                details));
    }

    private static String outcomeOf(Throwable error) {
        return error instanceof BridgeFailure failure ? failure.getCode().value() : FailureCode.UNEXPECTED_ERROR.value();
    }

    private void auditCacheOperation(String action, String resourceId, int removed, ClientInfo client) {
        support.metrics().recordInvalidation(kind.getLabel(), action, removed);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("removed", removed);
        record(new AuditEvent(
                AuditEvent.CACHE_OPERATION,
                kind.getLabel(),
                resourceId,
                action,
                AuditEvent.SUCCESS,
                client.userId(),
                client.ipAddress(),
                null,
                support.clock().instant(),
                details));
    }

    private void record(AuditEvent event) {
        try {
            support.auditSink().record(event);
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Audit sink rejected {} event for {}", event.eventType(), kind.getLabel());
        }
    }

    private record Served(ResourceResponse response, Object payload, boolean cacheHit) {
    }
}
