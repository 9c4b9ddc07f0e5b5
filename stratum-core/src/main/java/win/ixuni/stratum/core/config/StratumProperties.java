package win.ixuni.stratum.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stratum main configuration
 */
@Data
@ConfigurationProperties(prefix = "stratum")
public class StratumProperties {

    /**
     * List of backend configurations
     */
    private List<BackendConfig> backends = new ArrayList<>();

    /**
     * Routing configuration
     */
    private RoutingConfig routing = new RoutingConfig();

    /**
     * Region coordinates, keyed by region id (merged over the built-in catalog)
     */
    private Map<String, RegionDefinition> regions = new LinkedHashMap<>();

    /**
     * Metrics collection configuration
     */
    private MetricsConfig metrics = new MetricsConfig();

    /**
     * Migration configuration
     */
    private MigrationConfig migration = new MigrationConfig();

    /**
     * Persistence configuration
     */
    private PersistenceConfig persistence = new PersistenceConfig();

    /**
     * Routing configuration
     */
    @Data
    public static class RoutingConfig {

        /**
         * Strategy used when no rule matches and the caller supplies none
         */
        private String defaultStrategy = "balanced";

        /**
         * Priority used when no rule matches and the caller supplies none
         */
        private String defaultPriority = "normal";

        /**
         * Rules seeded into an empty rule store at startup
         */
        private List<RoutingRuleDefinition> rules = new ArrayList<>();
    }

    @Data
    public static class RegionDefinition {
        private double latitude;
        private double longitude;
    }

    @Data
    public static class MetricsConfig {

        /**
         * Whether the scheduled collection is enabled
         */
        private boolean collectEnabled = true;

        /**
         * Delay between two scheduled collections, in milliseconds
         */
        private long collectIntervalMs = 60_000;
    }

    /**
     * Migration configuration
     */
    @Data
    public static class MigrationConfig {

        /**
         * Number of concurrent migration workers
         */
        private int workers = 4;

        /**
         * Retries before a task is marked failed
         */
        private int maxRetries = 3;

        /**
         * Base retry delay, doubled on every retry
         */
        private Duration baseDelay = Duration.ofSeconds(1);

        /**
         * How long an idle worker waits before looking for work again
         */
        private Duration pollInterval = Duration.ofMillis(500);

        /**
         * Upper bound for a single source fetch or destination write
         */
        private Duration transferTimeout = Duration.ofMinutes(5);

        /**
         * Whether the executor starts with the application
         */
        private boolean autoStart = true;

        /**
         * Policies created at startup when no policy with the same name exists
         */
        private List<MigrationPolicyDefinition> policies = new ArrayList<>();

        private CleanupConfig cleanup = new CleanupConfig();
    }

    @Data
    public static class CleanupConfig {

        private boolean enabled = true;

        private String cron = "0 0 * * * *";

        /**
         * Terminal tasks older than this many days are removed
         */
        private int retentionDays = 7;
    }

    @Data
    public static class PersistenceConfig {

        /**
         * Store type: memory or file
         */
        private String type = "memory";

        /**
         * Base directory for the file store
         */
        private String path = "./data/stratum";
    }
}
