package win.ixuni.stratum.server.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import win.ixuni.stratum.core.config.BackendConfig;
import win.ixuni.stratum.core.config.RoutingRuleDefinition;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.exception.MetricsNotFoundException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.BackendMetrics;
import win.ixuni.stratum.core.model.Priority;
import win.ixuni.stratum.core.model.RouteResult;
import win.ixuni.stratum.core.model.RoutingStrategy;
import win.ixuni.stratum.core.persistence.InMemoryDocumentStore;
import win.ixuni.stratum.server.metrics.ConfiguredMetricsSource;
import win.ixuni.stratum.server.metrics.MetricsCollectionService;
import win.ixuni.stratum.server.registry.BackendRegistry;
import win.ixuni.stratum.server.routing.BackendMetricsStore;
import win.ixuni.stratum.server.routing.ContentAnalyzer;
import win.ixuni.stratum.server.routing.DataRouter;
import win.ixuni.stratum.server.routing.RegionCatalog;
import win.ixuni.stratum.server.routing.RoutingRuleEngine;
import win.ixuni.stratum.server.routing.ScoringEngine;
import win.ixuni.stratum.server.support.TestBackends;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RoutingServiceTest {

    private RoutingService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        StratumProperties properties = new StratumProperties();
        BackendConfig.MetricsDefinition metrics = new BackendConfig.MetricsDefinition();
        metrics.setAvgLatencyMs(12);
        BackendConfig config = new BackendConfig();
        config.setName("solo");
        config.setType("memory");
        config.setMetrics(metrics);
        properties.getBackends().add(config);

        BackendRegistry registry = TestBackends.emptyRegistry();
        registry.register(TestBackends.memory("solo"));
        BackendMetricsStore metricsStore = new BackendMetricsStore(clock);
        RoutingRuleEngine ruleEngine = new RoutingRuleEngine(new InMemoryDocumentStore(), properties, clock);
        ruleEngine.initialize();

        DataRouter router = new DataRouter(new ContentAnalyzer(), ruleEngine,
                new ScoringEngine(new RegionCatalog(properties)), metricsStore, registry, properties, clock);
        MetricsCollectionService collection = new MetricsCollectionService(
                List.of(new ConfiguredMetricsSource(properties)), metricsStore, properties);
        service = new RoutingService(router, ruleEngine, metricsStore, collection);
    }

    @Test
    void testMetricsOperations() {
        assertThrows(MetricsNotFoundException.class, () -> service.getMetrics("solo"));

        assertEquals(12, service.collectMetrics().get("solo").getAvgLatencyMs());
        service.updateMetrics("solo", BackendMetrics.builder().avgLatencyMs(3).build());

        assertEquals(3, service.getMetrics("solo").getAvgLatencyMs());
        assertEquals(1, service.getAllMetrics().size());
    }

    @Test
    void testRouteParsesStrategyAndPriority() {
        service.collectMetrics();

        RouteResult result = service.route(new byte[4], Map.of(), "latency-optimized", "critical", null, "");

        assertEquals("solo", result.getDecision().getSelectedBackend());
        assertEquals(RoutingStrategy.LATENCY_OPTIMIZED, result.getDecision().getStrategy());
        assertEquals(Priority.CRITICAL, result.getDecision().getPriority());
        assertFalse(result.getDecision().isOverridden());
        assertTrue(result.getStoreResult().isSuccess());
    }

    @Test
    void testRuleOperations() {
        RoutingRuleDefinition definition = new RoutingRuleDefinition();
        definition.setWildcard(true);
        definition.setPriority("bogus");
        assertThrows(ValidationException.class, () -> service.createRule(definition));

        definition.setPriority("high");
        String id = service.createRule(definition).getId();

        assertEquals(1, service.listRules().size());
        assertEquals(Priority.HIGH, service.getRule(id).getPriority());
        assertTrue(service.deleteRule(id));
        assertTrue(service.listRules().isEmpty());
    }
}
