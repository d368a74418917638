package net.maasbridge.resource.handler;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for resource reads and cache invalidations, tagged by resource kind.
 */
@Component
public class ResourceMetrics {

    static final String READS = "maas.resource.reads";
    static final String READ_DURATION = "maas.resource.read.duration";
    static final String INVALIDATED_ENTRIES = "maas.resource.cache.invalidated";

    static final String OUTCOME_HIT = "hit";
    static final String OUTCOME_MISS = "miss";

    private final MeterRegistry meterRegistry;

    public ResourceMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param outcome {@code hit}, {@code miss} or the failure code of a failed read
     */
    public void recordRead(String kind, String outcome, long durationNanos) {
        meterRegistry.counter(READS, "kind", kind, "outcome", outcome).increment();
        meterRegistry.timer(READ_DURATION, "kind", kind).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordInvalidation(String kind, String action, int removed) {
        meterRegistry.counter(INVALIDATED_ENTRIES, "kind", kind, "action", action).increment(removed);
    }
}
