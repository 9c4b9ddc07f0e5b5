package win.ixuni.stratum.core.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Migration policy definition
 * <p>
 * Bindable form of a migration policy. Priority and schedule mode stay raw strings until the policy is created.
 */
@Data
public class MigrationPolicyDefinition {

    private String name;

    private String description;

    private String sourceBackend;

    private String destinationBackend;

    /**
     * Content filter
     */
    private FilterDefinition filter = new FilterDefinition();

    private String scheduleMode = "manual";

    private String priority = "normal";

    private boolean deleteSource;

    private boolean enabled = true;

    @Data
    public static class FilterDefinition {

        /**
         * Content type prefix, e.g. "image/"
         */
        private String type;

        /**
         * Content type prefixes, any of which may match
         */
        private List<String> contentTypes = new ArrayList<>();

        /**
         * Content id or filename prefix
         */
        private String prefix;

        private Long minSizeBytes;

        private Long maxSizeBytes;

        /**
         * Only content created at least this many days ago
         */
        private Integer minAgeDays;

        /**
         * Tags, any of which may match
         */
        private List<String> tags = new ArrayList<>();

        /**
         * Metadata entries that must match exactly
         */
        private Map<String, String> custom = new HashMap<>();
    }
}
