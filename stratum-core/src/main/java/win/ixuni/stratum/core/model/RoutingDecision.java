package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a routing analysis
 */
@Value
@Builder
public class RoutingDecision {

    String selectedBackend;

    /**
     * Id of the rule that matched, null when the default strategy applied
     */
    String matchedRuleId;

    /**
     * Ranked candidate scores, best first; empty for an explicit backend override
     */
    @Builder.Default
    List<BackendScore> scores = List.of();

    RoutingStrategy strategy;

    Priority priority;

    ContentDescriptor content;

    /**
     * Whether the caller named the backend directly
     */
    boolean overridden;

    Instant decidedAt;
}
