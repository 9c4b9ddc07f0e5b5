package win.ixuni.stratum.server.routing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.backend.BackendStore;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.exception.BackendNotFoundException;
import win.ixuni.stratum.core.exception.BackendUnavailableException;
import win.ixuni.stratum.core.exception.StratumException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.BackendMetrics;
import win.ixuni.stratum.core.model.BackendScore;
import win.ixuni.stratum.core.model.ContentDescriptor;
import win.ixuni.stratum.core.model.Priority;
import win.ixuni.stratum.core.model.RouteResult;
import win.ixuni.stratum.core.model.RoutingDecision;
import win.ixuni.stratum.core.model.RoutingRule;
import win.ixuni.stratum.core.model.RoutingStrategy;
import win.ixuni.stratum.core.model.StoreResult;
import win.ixuni.stratum.server.registry.BackendRegistry;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Data router
 * <p>
 * Decides which backend should hold a piece of content: analyze, match a rule, narrow the candidates,
 * score them. {@link #route} then stores the content on the winner. A failed store is reported in the
 * result and never retried on another backend.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataRouter {

    private final ContentAnalyzer contentAnalyzer;
    private final RoutingRuleEngine ruleEngine;
    private final ScoringEngine scoringEngine;
    private final BackendMetricsStore metricsStore;
    private final BackendRegistry backendRegistry;
    private final StratumProperties properties;
    private final Clock clock;

    /**
     * Decide where content should go, without storing it
     */
    public RoutingDecision analyze(RouteRequest request) {
        ContentDescriptor descriptor = contentAnalyzer.analyze(request.getContent(), request.getMetadata());

        if (request.getBackend() != null && !request.getBackend().isBlank()) {
            if (!backendRegistry.hasBackend(request.getBackend())) {
                throw new BackendNotFoundException(request.getBackend());
            }
            return RoutingDecision.builder()
                    .selectedBackend(request.getBackend())
                    .strategy(request.getStrategy() != null ? request.getStrategy() : defaultStrategy())
                    .priority(request.getPriority() != null ? request.getPriority() : defaultPriority())
                    .content(descriptor)
                    .overridden(true)
                    .decidedAt(Instant.now(clock))
                    .build();
        }

        Map<String, BackendMetrics> metrics = metricsStore.getAll();
        Optional<RoutingRule> rule = ruleEngine.match(descriptor);

        RoutingStrategy strategy = rule.map(RoutingRule::getStrategy)
                .orElse(request.getStrategy() != null ? request.getStrategy() : defaultStrategy());
        Priority priority = rule.map(RoutingRule::getPriority)
                .orElse(request.getPriority() != null ? request.getPriority() : defaultPriority());

        Set<String> candidates = candidates(rule.orElse(null), metrics);
        List<BackendScore> scores = scoringEngine.score(candidates, strategy,
                rule.map(RoutingRule::getCustomFactors).orElse(Map.of()), request.getClientLocation(), metrics);

        RoutingDecision decision = RoutingDecision.builder()
                .selectedBackend(scores.get(0).getBackend())
                .matchedRuleId(rule.map(RoutingRule::getId).orElse(null))
                .scores(scores)
                .strategy(strategy)
                .priority(priority)
                .content(descriptor)
                .decidedAt(Instant.now(clock))
                .build();
        log.debug("Routing decision: backend={}, rule={}, strategy={}, category={}",
                decision.getSelectedBackend(), decision.getMatchedRuleId(), strategy, descriptor.getCategory());
        return decision;
    }

    /**
     * Decide where content should go and store it there
     */
    public RouteResult route(RouteRequest request) {
        if (request.getContent() == null) {
            throw new ValidationException("content is required to route");
        }
        RoutingDecision decision = analyze(request);
        String target = decision.getSelectedBackend();

        StoreResult storeResult;
        try {
            BackendStore backend = backendRegistry.getBackend(target);
            String contentId = backend.add(request.getContent(), request.getMetadata()).block();
            storeResult = StoreResult.stored(target, contentId);
            log.info("Routed {} bytes to backend {} as {}", request.getContent().length, target, contentId);
        } catch (StratumException e) {
            log.warn("Store on backend {} failed: {}", target, e.getMessage());
            storeResult = StoreResult.failed(target, e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Store on backend {} failed", target, e);
            storeResult = StoreResult.failed(target, BackendUnavailableException.ERROR_CODE, e.getMessage());
        }
        return new RouteResult(decision, storeResult);
    }

    /**
     * Available backends (registered and reporting metrics), narrowed by the rule's preferred and excluded lists
     */
    private Set<String> candidates(RoutingRule rule, Map<String, BackendMetrics> metrics) {
        Set<String> available = new TreeSet<>(backendRegistry.getBackendNames());
        available.retainAll(metrics.keySet());

        if (rule == null) {
            return available;
        }
        Set<String> candidates = available;
        if (!rule.getPreferredBackends().isEmpty()) {
            candidates = new TreeSet<>(rule.getPreferredBackends());
            candidates.retainAll(available);
        }
        candidates.removeAll(rule.getExcludedBackends());
        return candidates;
    }

    private RoutingStrategy defaultStrategy() {
        return RoutingStrategy.parse(properties.getRouting().getDefaultStrategy());
    }

    private Priority defaultPriority() {
        return Priority.parse(properties.getRouting().getDefaultPriority());
    }
}
