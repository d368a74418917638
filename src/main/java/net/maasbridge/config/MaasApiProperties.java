package net.maasbridge.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Connection settings for the MAAS REST API.
 */
@Component
@ConfigurationProperties(prefix = "maas.api")
public class MaasApiProperties {

    /**
     * MAAS root URL; requests are sent below {@code <base-url>/api/2.0}.
     */
    private String baseUrl = "http://localhost:5240/MAAS";

    /**
     * Pre-built Authorization header value, sent verbatim when set.
     */
    private String apiKey = "";

    /**
     * Per-attempt response timeout.
     */
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Retries for 429/502/503/504 responses and connection failures.
     */
    private int maxRetries = 3;

    /**
     * Delay before the first retry; doubled for each further attempt.
     */
    private Duration retryBackoff = Duration.ofSeconds(1);

    /**
     * Client-side request budget per second.
     */
    private int requestsPerSecond = 20;

    @PostConstruct
    void validate() {
        Assert.hasText(baseUrl, "maas.api.base-url must be set");
        Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "maas.api.timeout must be positive");
        Assert.isTrue(maxRetries >= 0, "maas.api.max-retries must be non-negative");
        Assert.isTrue(requestsPerSecond > 0, "maas.api.requests-per-second must be positive");
    }

    /** Versioned API root without a trailing slash. */
    public String apiRoot() {
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return trimmed + "/api/2.0";
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public int getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public void setRequestsPerSecond(int requestsPerSecond) {
        this.requestsPerSecond = requestsPerSecond;
    }
}
