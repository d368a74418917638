package net.maasbridge.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the resource cache store.
 */
@Component
@ConfigurationProperties(prefix = "maas.cache")
public class BridgeCacheProperties {

    static final Map<String, Duration> DEFAULT_RESOURCE_TTL = Map.ofEntries(
            Map.entry("machine", Duration.ofSeconds(60)),
            Map.entry("machines", Duration.ofSeconds(30)),
            Map.entry("tag", Duration.ofSeconds(300)),
            Map.entry("tags", Duration.ofSeconds(300)),
            Map.entry("tagmachines", Duration.ofSeconds(60)),
            Map.entry("subnet", Duration.ofSeconds(300)),
            Map.entry("subnets", Duration.ofSeconds(300)),
            Map.entry("zone", Duration.ofSeconds(600)),
            Map.entry("zones", Duration.ofSeconds(600)),
            Map.entry("device", Duration.ofSeconds(60)),
            Map.entry("devices", Duration.ofSeconds(60)),
            Map.entry("domain", Duration.ofSeconds(600)),
            Map.entry("domains", Duration.ofSeconds(600)));

    /**
     * Global cache switch; handlers never cache while this is off.
     */
    private boolean enabled = true;

    /**
     * Maximum number of cached payloads across all resource kinds.
     */
    private long maxSize = 1000;

    /**
     * TTL for resource kinds without an entry in {@link #resourceTtl}.
     */
    private Duration defaultTtl = Duration.ofSeconds(300);

    /**
     * Per-kind TTL keyed by lower-case kind label (machine, machines, tagmachines, ...).
     */
    private Map<String, Duration> resourceTtl = new LinkedHashMap<>(DEFAULT_RESOURCE_TTL);

    @PostConstruct
    void validate() {
        Assert.isTrue(maxSize > 0, "maas.cache.max-size must be positive");
        Assert.isTrue(!defaultTtl.isNegative(), "maas.cache.default-ttl must be non-negative");
        resourceTtl.forEach((kind, ttl) ->
                Assert.isTrue(!ttl.isNegative(), "maas.cache.resource-ttl." + kind + " must be non-negative"));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(long maxSize) {
        this.maxSize = maxSize;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Map<String, Duration> getResourceTtl() {
        return resourceTtl;
    }

    public void setResourceTtl(Map<String, Duration> resourceTtl) {
        this.resourceTtl = resourceTtl;
    }
}
