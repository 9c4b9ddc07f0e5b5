package win.ixuni.stratum.server.routing;

import lombok.Builder;
import lombok.Value;
import win.ixuni.stratum.core.model.GeoLocation;
import win.ixuni.stratum.core.model.Priority;
import win.ixuni.stratum.core.model.RoutingStrategy;

import java.util.Map;

/**
 * Routing request
 */
@Value
@Builder(toBuilder = true)
public class RouteRequest {

    /**
     * Content bytes; analysis accepts null or a sample, storing requires the full content
     */
    byte[] content;

    @Builder.Default
    Map<String, String> metadata = Map.of();

    /**
     * Caller strategy, used when no rule matches
     */
    RoutingStrategy strategy;

    /**
     * Caller priority, used when no rule matches
     */
    Priority priority;

    GeoLocation clientLocation;

    /**
     * Explicit target backend; bypasses rule matching and scoring
     */
    String backend;
}
