package win.ixuni.stratum.server.metrics;

import win.ixuni.stratum.core.model.BackendMetrics;

import java.util.Map;

/**
 * Source of backend metrics snapshots
 * <p>
 * Implementations are Spring beans; {@link MetricsCollectionService} polls all of them.
 */
public interface BackendMetricsSource {

    /**
     * Source name, used in logs
     */
    String getName();

    /**
     * Current snapshot per backend name
     */
    Map<String, BackendMetrics> collect();
}
