package win.ixuni.stratum.server.routing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.exception.NoEligibleBackendException;
import win.ixuni.stratum.core.model.BackendMetrics;
import win.ixuni.stratum.core.model.BackendScore;
import win.ixuni.stratum.core.model.GeoLocation;
import win.ixuni.stratum.core.model.RoutingStrategy;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ScoringEngineTest {

    private ScoringEngine engine;

    private Map<String, BackendMetrics> metrics;

    @BeforeEach
    void setUp() {
        engine = new ScoringEngine(new RegionCatalog(new StratumProperties()));
        metrics = Map.of(
                "a", BackendMetrics.builder().storageCostPerGb(0.01).avgLatencyMs(50).region("us-east-1").build(),
                "b", BackendMetrics.builder().storageCostPerGb(0.05).avgLatencyMs(10).region("eu-west-1").build());
    }

    @Test
    @DisplayName("Cost-optimized routing picks the cheaper backend despite its latency")
    void testCostOptimizedPrefersCheapBackend() {
        List<BackendScore> scores = engine.score(List.of("a", "b"), RoutingStrategy.COST_OPTIMIZED, Map.of(), null, metrics);

        assertEquals("a", scores.get(0).getBackend());
        assertEquals(0.9, scores.get(0).getScore(), 1e-9);
        assertEquals(0.3, scores.get(1).getScore(), 1e-9);
        assertEquals(1.0, scores.get(0).getComponents().get(ScoringEngine.COST), 1e-9);
        assertEquals(0.0, scores.get(0).getComponents().get(ScoringEngine.LATENCY), 1e-9);
    }

    @Test
    void testLatencyOptimizedPrefersFastBackend() {
        List<BackendScore> scores = engine.score(List.of("a", "b"), RoutingStrategy.LATENCY_OPTIMIZED, Map.of(), null, metrics);

        assertEquals("b", scores.get(0).getBackend());
    }

    @Test
    @DisplayName("结果与候选顺序无关")
    void testOrderIndependent() {
        List<BackendScore> forward = engine.score(List.of("a", "b"), RoutingStrategy.BALANCED, Map.of(), null, metrics);
        List<BackendScore> backward = engine.score(List.of("b", "a"), RoutingStrategy.BALANCED, Map.of(), null, metrics);

        assertEquals(forward, backward);
    }

    @Test
    void testTieBrokenByName() {
        BackendMetrics same = BackendMetrics.builder().storageCostPerGb(0.02).avgLatencyMs(20).build();
        Map<String, BackendMetrics> identical = Map.of("zeta", same, "alpha", same, "mid", same);

        List<BackendScore> scores = engine.score(List.of("zeta", "mid", "alpha"), RoutingStrategy.BALANCED,
                Map.of(), null, identical);

        assertEquals(List.of("alpha", "mid", "zeta"), scores.stream().map(BackendScore::getBackend).collect(Collectors.toList()));
        scores.forEach(s -> assertEquals(1.0, s.getScore(), 1e-9));
    }

    @Test
    void testGeoOptimizedPrefersNearestRegion() {
        BackendMetrics base = BackendMetrics.builder().storageCostPerGb(0.02).avgLatencyMs(20).build();
        Map<String, BackendMetrics> regional = Map.of(
                "virginia", base.toBuilder().region("us-east-1").build(),
                "dublin", base.toBuilder().region("eu-west-1").build());
        GeoLocation london = GeoLocation.of(51.5074, -0.1278);

        List<BackendScore> scores = engine.score(List.of("virginia", "dublin"), RoutingStrategy.GEO_OPTIMIZED,
                Map.of(), london, regional);

        assertEquals("dublin", scores.get(0).getBackend());
    }

    @Test
    @DisplayName("No candidate with metrics is a NoEligibleBackend failure")
    void testNoEligibleBackend() {
        assertThrows(NoEligibleBackendException.class,
                () -> engine.score(List.of(), RoutingStrategy.BALANCED, Map.of(), null, metrics));
        assertThrows(NoEligibleBackendException.class,
                () -> engine.score(List.of("unknown"), RoutingStrategy.BALANCED, Map.of(), null, metrics));
    }

    @Test
    void testCustomFactorsAreRenormalized() {
        Map<String, Double> weights = ScoringEngine.weights(RoutingStrategy.BALANCED, Map.of(ScoringEngine.COST, 3.0));

        assertEquals(0.8, weights.get(ScoringEngine.COST), 1e-9);
        assertEquals(1.0, weights.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
    }

    @Test
    void testAllZeroWeightsFallBackToUniform() {
        Map<String, Double> weights = ScoringEngine.weights(RoutingStrategy.COST_OPTIMIZED, Map.of(
                ScoringEngine.COST, 0.0, ScoringEngine.LATENCY, 0.0,
                ScoringEngine.RELIABILITY, 0.0, ScoringEngine.GEO, 0.0));

        weights.values().forEach(w -> assertEquals(0.25, w, 1e-9));
    }

    @Test
    void testScoresStayWithinUnitRange() {
        List<BackendScore> scores = engine.score(List.of("a", "b"), RoutingStrategy.BALANCED, Map.of(),
                GeoLocation.of(35.0, 139.0), metrics);

        scores.forEach(s -> {
            assertTrue(s.getScore() >= 0.0);
            assertTrue(s.getScore() <= 1.0);
        });
    }
}
