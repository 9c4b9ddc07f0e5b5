package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Latest metrics snapshot of one backend
 * <p>
 * Always a full snapshot: updates replace the previous value, they never merge into it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BackendMetrics {

    double avgLatencyMs;

    /**
     * Success rate in [0, 1]
     */
    @Builder.Default
    double successRate = 1.0;

    double throughputMbps;

    double storageCostPerGb;

    double retrievalCostPerGb;

    double bandwidthCostPerGb;

    long totalStoredBytes;

    long totalRetrievedBytes;

    /**
     * Region id, resolved to coordinates by the region catalog
     */
    String region;

    boolean multiRegion;

    /**
     * Uptime percentage in [0, 100]
     */
    @Builder.Default
    double uptimePct = 100.0;

    Instant updatedAt;
}
