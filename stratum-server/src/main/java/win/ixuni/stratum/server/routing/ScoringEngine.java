package win.ixuni.stratum.server.routing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.exception.NoEligibleBackendException;
import win.ixuni.stratum.core.model.BackendMetrics;
import win.ixuni.stratum.core.model.BackendScore;
import win.ixuni.stratum.core.model.GeoLocation;
import win.ixuni.stratum.core.model.RoutingStrategy;
import win.ixuni.stratum.core.util.GeoDistance;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Scoring engine
 * <p>
 * Ranks candidate backends by a weighted sum of four factors, each min-max normalized across the candidates:
 * <ul>
 *   <li>cost: storage + retrieval cost per GB, lower is better</li>
 *   <li>latency: average latency, lower is better</li>
 *   <li>reliability: success rate x uptime, higher is better</li>
 *   <li>geo: distance from the client to the backend region, lower is better</li>
 * </ul>
 * The result depends only on the candidate set, never on its order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScoringEngine {

    public static final String COST = "cost";
    public static final String LATENCY = "latency";
    public static final String RELIABILITY = "reliability";
    public static final String GEO = "geo";

    static final Comparator<BackendScore> RANKING = Comparator
            .comparingDouble(BackendScore::getScore).reversed()
            .thenComparing(BackendScore::getBackend);

    private final RegionCatalog regionCatalog;

    /**
     * Score and rank candidates
     *
     * @param candidates     candidate backend names; names without metrics are ignored
     * @param strategy       strategy selecting the base weights
     * @param customFactors  weight overrides, may be empty
     * @param clientLocation client location, may be null
     * @param metrics        metrics snapshot
     * @return scores, best first
     * @throws NoEligibleBackendException if no candidate has metrics
     */
    public List<BackendScore> score(Collection<String> candidates, RoutingStrategy strategy,
            Map<String, Double> customFactors, GeoLocation clientLocation, Map<String, BackendMetrics> metrics) {
        List<String> eligible = new ArrayList<>();
        for (String name : new TreeSet<>(candidates)) {
            if (metrics.containsKey(name)) {
                eligible.add(name);
            }
        }
        if (eligible.isEmpty()) {
            throw new NoEligibleBackendException("No eligible backend among candidates " + candidates);
        }

        Map<String, Double> weights = Collections.unmodifiableMap(weights(strategy, customFactors));

        Map<String, double[]> raw = new LinkedHashMap<>();
        for (String name : eligible) {
            BackendMetrics m = metrics.get(name);
            raw.put(name, new double[]{
                    m.getStorageCostPerGb() + m.getRetrievalCostPerGb(),
                    m.getAvgLatencyMs(),
                    m.getSuccessRate() * m.getUptimePct(),
                    distanceKm(m, clientLocation)
            });
        }

        String[] factors = {COST, LATENCY, RELIABILITY, GEO};
        boolean[] lowerIsBetter = {true, true, false, true};
        double[] min = new double[4];
        double[] max = new double[4];
        for (int i = 0; i < 4; i++) {
            min[i] = Double.POSITIVE_INFINITY;
            max[i] = Double.NEGATIVE_INFINITY;
            for (double[] values : raw.values()) {
                min[i] = Math.min(min[i], values[i]);
                max[i] = Math.max(max[i], values[i]);
            }
        }

        List<BackendScore> scores = new ArrayList<>();
        for (Map.Entry<String, double[]> entry : raw.entrySet()) {
            Map<String, Double> components = new LinkedHashMap<>();
            double total = 0;
            for (int i = 0; i < 4; i++) {
                double range = max[i] - min[i];
                double credit;
                if (range == 0) {
                    // 所有候选值相同，全部满分
                    credit = 1.0;
                } else {
                    double normalized = (entry.getValue()[i] - min[i]) / range;
                    credit = lowerIsBetter[i] ? 1.0 - normalized : normalized;
                }
                components.put(factors[i], credit);
                total += weights.get(factors[i]) * credit;
            }
            scores.add(BackendScore.builder()
                    .backend(entry.getKey())
                    .score(Math.max(0.0, Math.min(1.0, total)))
                    .components(components)
                    .weights(weights)
                    .build());
        }

        scores.sort(RANKING);
        log.debug("Scored {} candidates with {}: {}", scores.size(), strategy, scores);
        return scores;
    }

    /**
     * Base weights of a strategy with custom overrides applied, normalized to sum to 1
     */
    public static Map<String, Double> weights(RoutingStrategy strategy, Map<String, Double> customFactors) {
        Map<String, Double> weights = new LinkedHashMap<>();
        switch (strategy) {
            case COST_OPTIMIZED:
                put(weights, 0.7, 0.1, 0.1, 0.1);
                break;
            case LATENCY_OPTIMIZED:
                put(weights, 0.1, 0.7, 0.1, 0.1);
                break;
            case GEO_OPTIMIZED:
                put(weights, 0.05, 0.2, 0.05, 0.7);
                break;
            case BALANCED:
            default:
                put(weights, 0.25, 0.25, 0.25, 0.25);
                break;
        }
        if (customFactors != null) {
            customFactors.forEach((factor, weight) -> {
                if (weights.containsKey(factor)) {
                    weights.put(factor, weight);
                }
            });
        }

        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (sum <= 0) {
            put(weights, 0.25, 0.25, 0.25, 0.25);
            return weights;
        }
        weights.replaceAll((factor, weight) -> weight / sum);
        return weights;
    }

    private static void put(Map<String, Double> weights, double cost, double latency, double reliability, double geo) {
        weights.put(COST, cost);
        weights.put(LATENCY, latency);
        weights.put(RELIABILITY, reliability);
        weights.put(GEO, geo);
    }

    private double distanceKm(BackendMetrics metrics, GeoLocation clientLocation) {
        if (clientLocation == null || metrics.isMultiRegion()) {
            return 0;
        }
        Optional<GeoLocation> region = regionCatalog.locate(metrics.getRegion());
        return region.map(location -> GeoDistance.haversineKm(clientLocation, location)).orElse(0.0);
    }
}
