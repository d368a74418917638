/**
 * Service for monitoring MAAS API request metrics
 * - Tracks backend call counts by endpoint
 * - Maintains hourly and daily statistics
 * - Keeps the last failure reason per endpoint
 * - Provides visibility into backend usage patterns
 *
 * @author William Callahan
 */
package net.maasbridge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Service for tracking MAAS API request metrics
 * Provides real-time monitoring of backend call volume and failures
 */
@Service
public class BackendRequestMonitor {
    private static final Logger logger = LoggerFactory.getLogger(BackendRequestMonitor.class);
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // Guards against unbounded growth when endpoints carry unexpected ids
    private static final int MAX_TRACKED_ENDPOINTS = 200;

    // Track total calls since application start
    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong totalSuccessful = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);

    // Track calls per hour (reset every hour)
    private final AtomicInteger hourlyRequests = new AtomicInteger(0);
    private final AtomicInteger hourlySuccessful = new AtomicInteger(0);
    private final AtomicInteger hourlyFailed = new AtomicInteger(0);

    // Track calls per day (reset at midnight)
    private final AtomicInteger dailyRequests = new AtomicInteger(0);
    private final AtomicInteger dailySuccessful = new AtomicInteger(0);
    private final AtomicInteger dailyFailed = new AtomicInteger(0);

    private final Map<String, AtomicInteger> endpointCounts = new ConcurrentHashMap<>();
    private final Map<String, String> lastFailureByEndpoint = new ConcurrentHashMap<>();

    private volatile LocalDateTime lastHourlyReset = LocalDateTime.now();
    private volatile LocalDateTime lastDailyReset = LocalDateTime.now();

    /**
     * Records a successful backend request
     * @param endpoint The normalized endpoint that was called
     */
    public void recordSuccessfulRequest(String endpoint) {
        totalRequests.incrementAndGet();
        totalSuccessful.incrementAndGet();
        hourlyRequests.incrementAndGet();
        hourlySuccessful.incrementAndGet();
        dailyRequests.incrementAndGet();
        dailySuccessful.incrementAndGet();
        countEndpoint(endpoint);

        int hourly = hourlyRequests.get();
        if (hourly % 100 == 0) {
            logger.info("MAAS API request count: {} in the current hour", hourly);
        }
    }

    /**
     * Records a failed backend request
     * @param endpoint The normalized endpoint that was called
     * @param errorMessage Reason of the failure
     */
    public void recordFailedRequest(String endpoint, String errorMessage) {
        totalRequests.incrementAndGet();
        totalFailed.incrementAndGet();
        hourlyRequests.incrementAndGet();
        hourlyFailed.incrementAndGet();
        dailyRequests.incrementAndGet();
        dailyFailed.incrementAndGet();
        countEndpoint(endpoint);
        if (lastFailureByEndpoint.size() < MAX_TRACKED_ENDPOINTS || lastFailureByEndpoint.containsKey(endpoint)) {
            lastFailureByEndpoint.put(endpoint, TIME_FORMATTER.format(LocalDateTime.now()) + ": " + errorMessage);
        }
        logger.warn("Failed MAAS API request to endpoint {}: {}", endpoint, errorMessage);
    }

    private void countEndpoint(String endpoint) {
        if (endpointCounts.size() >= MAX_TRACKED_ENDPOINTS && !endpointCounts.containsKey(endpoint)) {
            logger.debug("Endpoint '{}' not tracked: limit of {} endpoints reached", endpoint, MAX_TRACKED_ENDPOINTS);
            return;
        }
        endpointCounts.computeIfAbsent(endpoint, k -> new AtomicInteger(0)).incrementAndGet();
    }

    /**
     * Scheduled task to reset hourly counters
     * Runs at the beginning of each hour
     */
    @Scheduled(cron = "0 0 * * * ?")
    public void resetHourlyCounters() {
        int requests = hourlyRequests.getAndSet(0);
        int successful = hourlySuccessful.getAndSet(0);
        int failed = hourlyFailed.getAndSet(0);
        lastHourlyReset = LocalDateTime.now();
        logger.info("Hourly MAAS API metrics reset. Previous hour: {} requests ({} successful, {} failed)",
                requests, successful, failed);
    }

    /**
     * Scheduled task to reset daily counters
     * Runs at midnight every day
     */
    @Scheduled(cron = "0 0 0 * * ?")
    public void resetDailyCounters() {
        int requests = dailyRequests.getAndSet(0);
        int successful = dailySuccessful.getAndSet(0);
        int failed = dailyFailed.getAndSet(0);
        endpointCounts.clear();
        lastFailureByEndpoint.clear();
        lastDailyReset = LocalDateTime.now();
        logger.info("Daily MAAS API metrics reset. Previous day: {} requests ({} successful, {} failed)",
                requests, successful, failed);
    }

    public int getCurrentHourlyRequests() {
        return hourlyRequests.get();
    }

    public int getCurrentDailyRequests() {
        return dailyRequests.get();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    /**
     * Generates a human-readable report of backend usage metrics
     * @return String containing the formatted report
     */
    public String generateReport() {
        StringBuilder report = new StringBuilder();
        report.append(String.format("MAAS API Request Monitor Report%n"));
        report.append(String.format("===============================%n"));
        report.append(String.format("Generated at: %s%n%n", TIME_FORMATTER.format(LocalDateTime.now())));

        report.append(String.format("Current Counts:%n"));
        report.append(String.format("  Hourly: %d requests (%d successful, %d failed)%n",
                hourlyRequests.get(), hourlySuccessful.get(), hourlyFailed.get()));
        report.append(String.format("  Daily: %d requests (%d successful, %d failed)%n",
                dailyRequests.get(), dailySuccessful.get(), dailyFailed.get()));
        report.append(String.format("  Total: %d requests (%d successful, %d failed)%n%n",
                totalRequests.get(), totalSuccessful.get(), totalFailed.get()));

        report.append(String.format("Endpoint Counts:%n"));
        new TreeMap<>(endpointCounts).forEach((endpoint, count) ->
            report.append(String.format("  %s: %d requests%n", endpoint, count.get())));

        if (!lastFailureByEndpoint.isEmpty()) {
            report.append(String.format("%nLast Failures:%n"));
            new TreeMap<>(lastFailureByEndpoint).forEach((endpoint, failure) ->
                report.append(String.format("  %s: %s%n", endpoint, failure)));
        }

        report.append(String.format("%nLast Reset Times:%n"));
        report.append(String.format("  Hourly: %s%n", TIME_FORMATTER.format(lastHourlyReset)));
        report.append(String.format("  Daily: %s%n", TIME_FORMATTER.format(lastDailyReset)));
        return report.toString();
    }

    /**
     * Returns a map of all current metrics
     * @return Map containing all metrics
     */
    public Map<String, Object> getMetricsMap() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();
        metrics.put("hourly_requests", hourlyRequests.get());
        metrics.put("hourly_successful", hourlySuccessful.get());
        metrics.put("hourly_failed", hourlyFailed.get());

        metrics.put("daily_requests", dailyRequests.get());
        metrics.put("daily_successful", dailySuccessful.get());
        metrics.put("daily_failed", dailyFailed.get());

        metrics.put("total_requests", totalRequests.get());
        metrics.put("total_successful", totalSuccessful.get());
        metrics.put("total_failed", totalFailed.get());

        Map<String, Integer> endpoints = new ConcurrentHashMap<>();
        endpointCounts.forEach((endpoint, count) -> endpoints.put(endpoint, count.get()));
        metrics.put("endpoints", endpoints);
        metrics.put("last_failures", Map.copyOf(lastFailureByEndpoint));

        metrics.put("last_hourly_reset", TIME_FORMATTER.format(lastHourlyReset));
        metrics.put("last_daily_reset", TIME_FORMATTER.format(lastDailyReset));
        return metrics;
    }
}
