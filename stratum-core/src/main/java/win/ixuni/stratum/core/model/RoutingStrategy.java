package win.ixuni.stratum.core.model;

/**
 * Routing strategies, each selecting a weight vector in the scoring engine
 */
public enum RoutingStrategy {

    COST_OPTIMIZED,
    LATENCY_OPTIMIZED,
    GEO_OPTIMIZED,
    BALANCED;

    public static RoutingStrategy parse(String raw) {
        return EnumParsing.parse(RoutingStrategy.class, "strategy", raw);
    }
}
