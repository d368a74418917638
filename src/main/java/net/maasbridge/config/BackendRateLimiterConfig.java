/**
 * Configuration for the MAAS API rate limiter
 * - Caps outbound requests per second across all resource kinds
 * - Fails fast instead of queueing when the budget is exhausted
 *
 * @author William Callahan
 */
package net.maasbridge.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BackendRateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(BackendRateLimiterConfig.class);

    /**
     * Rate limiter for MAAS API calls
     * - Refreshes every second with {@code maas.api.requests-per-second} permits
     * - Zero wait so an exhausted budget surfaces as a 429 right away
     *
     * @return Configured rate limiter instance
     */
    @Bean
    public RateLimiter maasApiRateLimiter(MaasApiProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(properties.getRequestsPerSecond())
                .timeoutDuration(Duration.ZERO)
                .build();

        RateLimiter rateLimiter = RateLimiter.of("maasApiRateLimiter", config);

        logger.info("MAAS API rate limiter initialized with limit of {} requests/second",
                properties.getRequestsPerSecond());

        return rateLimiter;
    }
}
