package win.ixuni.stratum.core.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Routing rule definition
 * <p>
 * Bindable form of a routing rule, used to seed the rule engine from configuration.
 * Strategy and priority stay raw strings here; they are parsed (and rejected if invalid) when the
 * definition is turned into a rule.
 */
@Data
public class RoutingRuleDefinition {

    /**
     * Rule id (generated when empty)
     */
    private String id;

    private String name;

    /**
     * Content categories, e.g. "image", "video" (empty = any)
     */
    private List<String> contentCategories = new ArrayList<>();

    /**
     * Filename patterns
     * <p>
     * Supports wildcards:
     * - * matches any characters
     * - ? matches a single character
     * <p>
     * A pattern without wildcards matches when the filename contains it.
     */
    private List<String> contentPatterns = new ArrayList<>();

    private Long minSizeBytes;

    private Long maxSizeBytes;

    private List<String> preferredBackends = new ArrayList<>();

    private List<String> excludedBackends = new ArrayList<>();

    /**
     * Rule priority (higher value = evaluated first)
     */
    private String priority = "normal";

    private String strategy = "balanced";

    private Map<String, Double> customFactors = new HashMap<>();

    private boolean active = true;

    /**
     * Explicit match-all marker, required when no category or pattern is given
     */
    private boolean wildcard;
}
