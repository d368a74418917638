package net.maasbridge.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import net.maasbridge.config.MaasApiProperties;
import net.maasbridge.resource.backend.CancellationToken;
import net.maasbridge.resource.error.BridgeFailure;
import net.maasbridge.resource.error.FailureCode;
import net.maasbridge.testutil.MaasFixtures;
import net.maasbridge.testutil.TestSchemas;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class MaasApiClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private MaasApiProperties properties;
    private BackendRequestMonitor monitor;

    @BeforeEach
    void setUp() {
        properties = new MaasApiProperties();
        properties.setBaseUrl("http://maas.test/MAAS/");
        properties.setApiKey("OAuth oauth_token=\"abc\"");
        properties.setMaxRetries(2);
        properties.setRetryBackoff(Duration.ofMillis(1));
        properties.setTimeout(Duration.ofSeconds(5));
        monitor = new BackendRequestMonitor();
    }

    private MaasApiClient client(Function<ClientRequest, Mono<ClientResponse>> exchange) {
        return client(exchange, RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(100)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build()));
    }

    private MaasApiClient client(Function<ClientRequest, Mono<ClientResponse>> exchange, RateLimiter rateLimiter) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return exchange.apply(request);
        });
        return new MaasApiClient(builder, properties, rateLimiter, monitor, TestSchemas.MAPPER);
    }

    private static Mono<ClientResponse> respond(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    void shouldGetJsonBelowVersionedRootWithAuthorization() {
        MaasApiClient client = client(request -> respond(HttpStatus.OK, MaasFixtures.machineJson("abc", "web-01")));

        StepVerifier.create(client.get("/machines/abc/", CancellationToken.none()))
                .assertNext(node -> assertThat(node.get("hostname").asString()).isEqualTo("web-01"))
                .verifyComplete();

        assertThat(requests).singleElement().satisfies(request -> {
            assertThat(request.url().toString()).isEqualTo("http://maas.test/MAAS/api/2.0/machines/abc/");
            assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("OAuth oauth_token=\"abc\"");
        });
        assertThat(monitor.getMetricsMap()).containsEntry("total_successful", 1L);
        assertThat(monitor.getMetricsMap().get("endpoints"))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsKey("/machines/{id}/");
    }

    @Test
    void shouldEncodeQueryParameters() {
        MaasApiClient client = client(request -> respond(HttpStatus.OK, "[]"));

        StepVerifier.create(client.get("/machines/", Map.of("hostname", "web 01&x"), CancellationToken.none()))
                .assertNext(node -> assertThat(node.isArray()).isTrue())
                .verifyComplete();

        assertThat(requests.get(0).url().getRawQuery()).isEqualTo("hostname=web%2001%26x");
    }

    @Test
    void shouldEncodePathSegmentsLiterally() {
        MaasApiClient client = client(request -> respond(HttpStatus.OK, "{}"));

        StepVerifier.create(client.get("/machines/{x}/", CancellationToken.none())).expectNextCount(1).verifyComplete();
        StepVerifier.create(client.get("/machines/a%20b/", CancellationToken.none())).expectNextCount(1).verifyComplete();

        assertThat(requests).extracting(request -> request.url().getRawPath())
                .containsExactly("/MAAS/api/2.0/machines/%7Bx%7D/", "/MAAS/api/2.0/machines/a%2520b/");
    }

    @Test
    void shouldOmitAuthorizationWhenNoKeyConfigured() {
        properties.setApiKey("");
        MaasApiClient client = client(request -> respond(HttpStatus.OK, "[]"));

        StepVerifier.create(client.get("/zones/", CancellationToken.none())).expectNextCount(1).verifyComplete();

        assertThat(requests.get(0).headers().containsHeader(HttpHeaders.AUTHORIZATION)).isFalse();
    }

    @Test
    void shouldMapNotFoundWithoutRetrying() {
        MaasApiClient client = client(request -> respond(HttpStatus.NOT_FOUND, "No Machine matches the given query."));

        StepVerifier.create(client.get("/machines/missing/", CancellationToken.none()))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(BridgeFailure.class);
                    BridgeFailure failure = (BridgeFailure) e;
                    assertThat(failure.getStatus()).isEqualTo(404);
                    assertThat(failure.getCode()).isEqualTo(FailureCode.RESOURCE_NOT_FOUND);
                    assertThat(failure.getMessage()).isEqualTo("No Machine matches the given query.");
                })
                .verify();
        assertThat(requests).hasSize(1);
        assertThat(monitor.getMetricsMap()).containsEntry("total_failed", 1L);
    }

    @Test
    void shouldPreferJsonMessageFieldAndMapAuthFailures() {
        MaasApiClient client = client(request -> respond(HttpStatus.UNAUTHORIZED, "{\"message\": \"Invalid token\"}"));

        StepVerifier.create(client.get("/machines/", CancellationToken.none()))
                .expectErrorSatisfies(e -> {
                    BridgeFailure failure = (BridgeFailure) e;
                    assertThat(failure.getCode()).isEqualTo(FailureCode.UNAUTHORIZED);
                    assertThat(failure.getMessage()).isEqualTo("Invalid token");
                    assertThat(failure.getDetails()).containsEntry("backendStatus", 401);
                })
                .verify();
    }

    @Test
    void shouldUseReasonPhraseForEmptyErrorBody() {
        MaasApiClient client = client(request -> respond(HttpStatus.INTERNAL_SERVER_ERROR, ""));

        StepVerifier.create(client.get("/subnets/", CancellationToken.none()))
                .expectErrorSatisfies(e -> {
                    BridgeFailure failure = (BridgeFailure) e;
                    assertThat(failure.getStatus()).isEqualTo(500);
                    assertThat(failure.getCode()).isEqualTo(FailureCode.BACKEND_ERROR);
                    assertThat(failure.getMessage()).isEqualTo("MAAS API Error (500): Internal Server Error");
                })
                .verify();
        assertThat(requests).hasSize(1);
    }

    @Test
    void shouldRetryTransientStatusesThenSucceed() {
        AtomicInteger attempts = new AtomicInteger();
        MaasApiClient client = client(request -> attempts.incrementAndGet() < 3
                ? respond(HttpStatus.SERVICE_UNAVAILABLE, "busy")
                : respond(HttpStatus.OK, "[]"));

        StepVerifier.create(client.get("/machines/", CancellationToken.none()))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(requests).hasSize(3);
    }

    @Test
    void shouldSurfaceLastFailureWhenRetriesAreExhausted() {
        MaasApiClient client = client(request -> respond(HttpStatus.TOO_MANY_REQUESTS, "slow down"));

        StepVerifier.create(client.get("/machines/", CancellationToken.none()))
                .expectErrorSatisfies(e -> assertThat(((BridgeFailure) e).getCode()).isEqualTo(FailureCode.RATE_LIMITED))
                .verify();
        assertThat(requests).hasSize(3);
    }

    @Test
    void shouldCompleteEmptyForNoContent() {
        MaasApiClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.NO_CONTENT).build()));

        StepVerifier.create(client.get("/machines/abc/", CancellationToken.none())).verifyComplete();
    }

    @Test
    void shouldReportUnparseableBodyAsBackendError() {
        MaasApiClient client = client(request -> respond(HttpStatus.OK, "<html>proxy error</html>"));

        StepVerifier.create(client.get("/machines/", CancellationToken.none()))
                .expectErrorSatisfies(e -> {
                    BridgeFailure failure = (BridgeFailure) e;
                    assertThat(failure.getStatus()).isEqualTo(502);
                    assertThat(failure.getDetails()).containsEntry("reason", "json_parse_error");
                })
                .verify();
    }

    @Test
    void cancellationShouldEndTheCallWithoutRetry() {
        CancellationToken token = new CancellationToken();
        MaasApiClient client = client(request -> Mono.never());

        StepVerifier.create(client.get("/machines/", token))
                .expectSubscription()
                .then(token::cancel)
                .expectError(CancellationException.class)
                .verify(Duration.ofSeconds(5));
        assertThat(requests).hasSize(1);
    }

    @Test
    void shouldRejectCallsBeyondClientRateLimit() {
        RateLimiter oneCall = RateLimiter.of("tight", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofHours(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        MaasApiClient client = client(request -> respond(HttpStatus.OK, "[]"), oneCall);

        StepVerifier.create(client.get("/tags/", CancellationToken.none())).expectNextCount(1).verifyComplete();
        StepVerifier.create(client.get("/tags/", CancellationToken.none()))
                .expectErrorSatisfies(e -> {
                    BridgeFailure failure = (BridgeFailure) e;
                    assertThat(failure.getStatus()).isEqualTo(429);
                    assertThat(failure.getCode()).isEqualTo(FailureCode.RATE_LIMITED);
                })
                .verify();
        assertThat(requests).hasSize(1);
    }

    @Test
    void shouldNormalizeEndpointsForMetrics() {
        assertThat(MaasApiClient.normalizeEndpoint("/machines/abc123/")).isEqualTo("/machines/{id}/");
        assertThat(MaasApiClient.normalizeEndpoint("/machines/")).isEqualTo("/machines/");
        assertThat(MaasApiClient.normalizeEndpoint("/")).isEqualTo("/");
    }
}
