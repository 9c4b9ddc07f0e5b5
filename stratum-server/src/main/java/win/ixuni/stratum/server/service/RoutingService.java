package win.ixuni.stratum.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import win.ixuni.stratum.core.config.RoutingRuleDefinition;
import win.ixuni.stratum.core.model.BackendMetrics;
import win.ixuni.stratum.core.model.GeoLocation;
import win.ixuni.stratum.core.model.Priority;
import win.ixuni.stratum.core.model.RouteResult;
import win.ixuni.stratum.core.model.RoutingDecision;
import win.ixuni.stratum.core.model.RoutingRule;
import win.ixuni.stratum.core.model.RoutingStrategy;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.server.metrics.MetricsCollectionService;
import win.ixuni.stratum.server.routing.BackendMetricsStore;
import win.ixuni.stratum.server.routing.DataRouter;
import win.ixuni.stratum.server.routing.RouteRequest;
import win.ixuni.stratum.server.routing.RoutingRuleEngine;

import java.util.List;
import java.util.Map;

/**
 * Routing operations
 * <p>
 * Entry point for routing.* operations. Raw strategy and priority strings are parsed here; core
 * components only ever see the enums.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoutingService {

    private final DataRouter dataRouter;
    private final RoutingRuleEngine ruleEngine;
    private final BackendMetricsStore metricsStore;
    private final MetricsCollectionService metricsCollectionService;

    // ==================== routing.analyze / routing.route ====================

    /**
     * Decide where content would go, without storing it
     *
     * @param content        content bytes or a sample, may be null when metadata carries the size
     * @param metadata       content metadata
     * @param clientLocation client location, may be null
     */
    public RoutingDecision analyze(byte[] content, Map<String, String> metadata, GeoLocation clientLocation) {
        return dataRouter.analyze(RouteRequest.builder()
                .content(content)
                .metadata(metadata != null ? metadata : Map.of())
                .clientLocation(validLocation(clientLocation))
                .build());
    }

    /**
     * Route content and store it on the selected backend
     *
     * @param strategy strategy name, may be null
     * @param priority priority name or value, may be null
     * @param backend  explicit backend, may be null
     */
    public RouteResult route(byte[] content, Map<String, String> metadata, String strategy, String priority,
            GeoLocation clientLocation, String backend) {
        return dataRouter.route(RouteRequest.builder()
                .content(content)
                .metadata(metadata != null ? metadata : Map.of())
                .strategy(isBlank(strategy) ? null : RoutingStrategy.parse(strategy))
                .priority(isBlank(priority) ? null : Priority.parse(priority))
                .clientLocation(validLocation(clientLocation))
                .backend(backend)
                .build());
    }

    // ==================== routing.rules ====================

    public List<RoutingRule> listRules() {
        return ruleEngine.list();
    }

    public RoutingRule getRule(String id) {
        return ruleEngine.get(id);
    }

    public RoutingRule createRule(RoutingRuleDefinition definition) {
        String id = ruleEngine.add(RoutingRuleEngine.fromDefinition(definition));
        return ruleEngine.get(id);
    }

    public boolean updateRule(String id, RoutingRuleDefinition definition) {
        return ruleEngine.update(id, RoutingRuleEngine.fromDefinition(definition));
    }

    public boolean deleteRule(String id) {
        return ruleEngine.delete(id);
    }

    // ==================== routing.metrics ====================

    public BackendMetrics getMetrics(String backend) {
        return metricsStore.get(backend);
    }

    public Map<String, BackendMetrics> getAllMetrics() {
        return metricsStore.getAll();
    }

    public BackendMetrics updateMetrics(String backend, BackendMetrics metrics) {
        return metricsStore.update(backend, metrics);
    }

    /**
     * Refresh metrics from every source now
     */
    public Map<String, BackendMetrics> collectMetrics() {
        return metricsCollectionService.collect();
    }

    private static GeoLocation validLocation(GeoLocation location) {
        if (location != null && !location.isValid()) {
            throw new ValidationException("Client location out of range: " + location);
        }
        return location;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
