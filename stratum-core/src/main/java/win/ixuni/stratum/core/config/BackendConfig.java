package win.ixuni.stratum.core.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Backend configuration
 * <p>
 * Generic backend configuration structure. Each backend type reads its specific settings from properties.
 */
@Data
public class BackendConfig {

    /**
     * Backend instance name (unique identifier, used as the routing target)
     */
    private String name;

    /**
     * Backend type (memory, local, ...)
     */
    private String type;

    /**
     * Whether enabled
     */
    private boolean enabled = true;

    /**
     * Backend-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    /**
     * Static metrics snapshot, published by the configuration metrics source
     */
    private MetricsDefinition metrics;

    /**
     * Get a string configuration value
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * 静态指标定义
     * <p>
     * Mirrors {@link win.ixuni.stratum.core.model.BackendMetrics} in a bindable form.
     */
    @Data
    public static class MetricsDefinition {
        private double avgLatencyMs;
        private double successRate = 1.0;
        private double throughputMbps;
        private double storageCostPerGb;
        private double retrievalCostPerGb;
        private double bandwidthCostPerGb;
        private long totalStoredBytes;
        private long totalRetrievedBytes;
        private String region;
        private boolean multiRegion;
        private double uptimePct = 100.0;
    }
}
