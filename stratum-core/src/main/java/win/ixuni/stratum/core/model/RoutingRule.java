package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Routing rule
 * <p>
 * Maps a class of content (category, filename pattern, size range) to a strategy, a priority and an
 * optional preferred/excluded backend list. Rules are evaluated by descending priority, ties by id.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RoutingRule {

    String id;

    String name;

    /**
     * Empty = any category
     */
    @Builder.Default
    List<ContentCategory> contentCategories = List.of();

    /**
     * Filename globs (* and ?) or substrings; empty = any filename
     */
    @Builder.Default
    List<String> contentPatterns = List.of();

    /**
     * Inclusive lower bound, null = unbounded
     */
    Long minSizeBytes;

    /**
     * Inclusive upper bound, null = unbounded
     */
    Long maxSizeBytes;

    @Builder.Default
    List<String> preferredBackends = List.of();

    @Builder.Default
    List<String> excludedBackends = List.of();

    @Builder.Default
    Priority priority = Priority.NORMAL;

    @Builder.Default
    RoutingStrategy strategy = RoutingStrategy.BALANCED;

    /**
     * Weight overrides keyed by factor name (cost, latency, reliability, geo)
     */
    @Builder.Default
    Map<String, Double> customFactors = Map.of();

    @Builder.Default
    boolean active = true;

    /**
     * Explicitly matches every category and filename
     */
    boolean wildcard;

    Instant createdAt;

    Instant updatedAt;
}
