package win.ixuni.stratum.server.metrics;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.config.BackendConfig;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.model.BackendMetrics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes the static metrics declared next to each enabled backend in configuration
 */
@Component
@RequiredArgsConstructor
public class ConfiguredMetricsSource implements BackendMetricsSource {

    private final StratumProperties properties;

    @Override
    public String getName() {
        return "configuration";
    }

    @Override
    public Map<String, BackendMetrics> collect() {
        Map<String, BackendMetrics> snapshots = new LinkedHashMap<>();
        for (BackendConfig config : properties.getBackends()) {
            if (config.isEnabled() && config.getMetrics() != null) {
                snapshots.put(config.getName(), toMetrics(config.getMetrics()));
            }
        }
        return snapshots;
    }

    static BackendMetrics toMetrics(BackendConfig.MetricsDefinition def) {
        return BackendMetrics.builder()
                .avgLatencyMs(def.getAvgLatencyMs())
                .successRate(def.getSuccessRate())
                .throughputMbps(def.getThroughputMbps())
                .storageCostPerGb(def.getStorageCostPerGb())
                .retrievalCostPerGb(def.getRetrievalCostPerGb())
                .bandwidthCostPerGb(def.getBandwidthCostPerGb())
                .totalStoredBytes(def.getTotalStoredBytes())
                .totalRetrievedBytes(def.getTotalRetrievedBytes())
                .region(def.getRegion())
                .multiRegion(def.isMultiRegion())
                .uptimePct(def.getUptimePct())
                .build();
    }
}
