/**
 * WebClient implementation of the MAAS read API
 *
 * @author William Callahan
 *
 * Features:
 * - GET requests below {@code <base-url>/api/2.0} with an optional Authorization header
 * - Classifies status-coded responses into BridgeFailures (401, 403, 404, 409, 429, others)
 * - Retries 429/502/503/504 and transport failures with exponential backoff
 * - Client-side rate limiting through Resilience4j
 * - Cancellation token observed across all attempts
 * - Request accounting through BackendRequestMonitor
 */
package net.maasbridge.service;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.maasbridge.config.MaasApiProperties;
import net.maasbridge.resource.backend.BackendClient;
import net.maasbridge.resource.backend.CancellationToken;
import net.maasbridge.resource.error.BridgeFailure;
import net.maasbridge.resource.error.FailureCode;
import net.maasbridge.util.BackendCallLogger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

@Service
@Slf4j
public class MaasApiClient implements BackendClient {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 502, 503, 504);
    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private final WebClient webClient;
    private final MaasApiProperties properties;
    private final RateLimiter rateLimiter;
    private final BackendRequestMonitor requestMonitor;
    private final ObjectMapper objectMapper;

    public MaasApiClient(WebClient.Builder webClientBuilder,
                         MaasApiProperties properties,
                         RateLimiter maasApiRateLimiter,
                         BackendRequestMonitor requestMonitor,
                         ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.clone().baseUrl(properties.apiRoot()).build();
        this.properties = properties;
        this.rateLimiter = maasApiRateLimiter;
        this.requestMonitor = requestMonitor;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<JsonNode> get(String path, Map<String, String> query, CancellationToken token) {
        Map<String, String> params = query == null ? Map.of() : query;
        String endpoint = normalizeEndpoint(path);
        Mono<JsonNode> call = Mono.defer(() -> {
                    BackendCallLogger.logAttempt(log, path, params);
                    return webClient.get()
                            .uri(uriBuilder -> buildUri(uriBuilder, path, params))
                            .accept(MediaType.APPLICATION_JSON)
                            .headers(this::applyAuthorization)
                            .exchangeToMono(response -> readResponse(response, path));
                })
                .transformDeferred(RateLimiterOperator.of(rateLimiter))
                .timeout(properties.getTimeout())
                .retryWhen(Retry.backoff(properties.getMaxRetries(), properties.getRetryBackoff())
                        .filter(error -> !token.isCancelled() && isRetryable(error))
                        .doBeforeRetry(signal -> BackendCallLogger.logRetry(log, path,
                                signal.totalRetries() + 1, String.valueOf(signal.failure().getMessage())))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .onErrorMap(RequestNotPermitted.class, e -> new BridgeFailure(FailureCode.RATE_LIMITED,
                        "MAAS API client rate limit exceeded", null, e))
                .doOnSuccess(body -> requestMonitor.recordSuccessfulRequest(endpoint))
                .doOnError(e -> {
                    BackendCallLogger.logFailure(log, path, String.valueOf(e.getMessage()));
                    requestMonitor.recordFailedRequest(endpoint, String.valueOf(e.getMessage()));
                });
        return token.observe(call);
    }

    private URI buildUri(UriBuilder uriBuilder, String path, Map<String, String> query) {
        // Segments and values go through template variables so braces and percent signs stay literal
        Map<String, Object> values = new HashMap<>();
        int index = 0;
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            String variable = "p" + index++;
            uriBuilder.pathSegment("{" + variable + "}");
            values.put(variable, segment);
        }
        if (path.endsWith("/")) {
            uriBuilder.path("/");
        }
        for (Map.Entry<String, String> entry : query.entrySet()) {
            String variable = "q" + index++;
            uriBuilder.queryParam(entry.getKey(), "{" + variable + "}");
            values.put(variable, entry.getValue());
        }
        return uriBuilder.build(values);
    }

    private void applyAuthorization(HttpHeaders headers) {
        String apiKey = properties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set(HttpHeaders.AUTHORIZATION, apiKey);
        }
    }

    private Mono<JsonNode> readResponse(ClientResponse response, String path) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return Mono.error(toFailure(status, body));
                    }
                    BackendCallLogger.logSuccess(log, path, status, body.length());
                    if (body.isBlank()) {
                        return Mono.empty();
                    }
                    return Mono.fromCallable(() -> parseJson(body, path));
                });
    }

    private JsonNode parseJson(String body, String path) {
        try {
            return objectMapper.readTree(body);
        } catch (JacksonException e) {
            throw new BridgeFailure(502, FailureCode.BACKEND_ERROR,
                    "Failed to parse MAAS API response for " + path,
                    Map.of("reason", "json_parse_error"), e);
        }
    }

    BridgeFailure toFailure(int status, String body) {
        String backendMessage = extractMessage(body);
        String message = backendMessage != null
                ? backendMessage
                : "MAAS API Error (" + status + "): " + reasonPhrase(status);
        return new BridgeFailure(status, FailureCode.forBackendStatus(status), message,
                Map.of("backendStatus", status), null);
    }

    private String extractMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        String trimmed = body.trim();
        if (trimmed.startsWith("{")) {
            try {
                JsonNode node = objectMapper.readTree(trimmed);
                for (String field : new String[] {"message", "error", "detail"}) {
                    JsonNode value = node.get(field);
                    if (value != null && value.isString() && !value.asString().isBlank()) {
                        return value.asString();
                    }
                }
            } catch (JacksonException e) {
                log.debug("Backend error body is not valid JSON: {}", e.getOriginalMessage());
            }
        }
        return trimmed.length() > MAX_ERROR_BODY_LENGTH ? trimmed.substring(0, MAX_ERROR_BODY_LENGTH) : trimmed;
    }

    private static String reasonPhrase(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved != null ? resolved.getReasonPhrase() : "HTTP " + status;
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof BridgeFailure failure) {
            return RETRYABLE_STATUSES.contains(failure.getStatus());
        }
        return error instanceof WebClientRequestException;
    }

    /**
     * Collapses ids so the monitor keys stay bounded: {@code /machines/abc/} becomes {@code /machines/{id}/}.
     */
    static String normalizeEndpoint(String path) {
        String[] segments = path.split("/");
        StringBuilder normalized = new StringBuilder();
        boolean first = true;
        for (String segment : segments) {
            if (segment.isEmpty()) {
                continue;
            }
            normalized.append('/').append(first ? segment : "{id}");
            first = false;
        }
        if (path.endsWith("/")) {
            normalized.append('/');
        }
        return normalized.length() == 0 ? "/" : normalized.toString();
    }
}
