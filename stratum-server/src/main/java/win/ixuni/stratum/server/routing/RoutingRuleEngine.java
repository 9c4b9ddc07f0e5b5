package win.ixuni.stratum.server.routing;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.config.RoutingRuleDefinition;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.exception.RuleNotFoundException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.ContentCategory;
import win.ixuni.stratum.core.model.ContentDescriptor;
import win.ixuni.stratum.core.model.Priority;
import win.ixuni.stratum.core.model.RoutingRule;
import win.ixuni.stratum.core.model.RoutingStrategy;
import win.ixuni.stratum.core.persistence.DocumentStore;
import win.ixuni.stratum.core.util.GlobPatterns;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Routing rule engine
 * <p>
 * Owns the routing rules. Matching takes the read lock, CRUD the write lock; every write is validated before
 * anything is persisted or changed in memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoutingRuleEngine {

    static final String COLLECTION = "routing_rules";

    /**
     * Evaluation order: priority value descending, then id ascending
     */
    static final Comparator<RoutingRule> EVALUATION_ORDER = Comparator
            .comparingInt((RoutingRule r) -> r.getPriority().getValue()).reversed()
            .thenComparing(RoutingRule::getId);

    private static final Set<String> FACTOR_KEYS = Set.of(
            ScoringEngine.COST, ScoringEngine.LATENCY, ScoringEngine.RELIABILITY, ScoringEngine.GEO);

    private final DocumentStore documentStore;
    private final StratumProperties properties;
    private final Clock clock;

    private final Map<String, RoutingRule> rules = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Load persisted rules; seed from configuration when none are persisted
     */
    @PostConstruct
    public void initialize() {
        List<RoutingRule> persisted = documentStore.list(COLLECTION, RoutingRule.class);
        if (!persisted.isEmpty()) {
            lock.writeLock().lock();
            try {
                persisted.forEach(rule -> rules.put(rule.getId(), rule));
            } finally {
                lock.writeLock().unlock();
            }
            log.info("Loaded {} routing rules from the document store", persisted.size());
            return;
        }

        List<RoutingRuleDefinition> definitions = properties.getRouting().getRules();
        if (!definitions.isEmpty()) {
            List<RoutingRule> seeded = definitions.stream()
                    .map(RoutingRuleEngine::fromDefinition)
                    .collect(Collectors.toList());
            importRules(seeded, false);
            log.info("Seeded {} routing rules from configuration", seeded.size());
        }
    }

    // ==================== Matching ====================

    /**
     * First active rule matching the content, in evaluation order
     */
    public Optional<RoutingRule> match(ContentDescriptor descriptor) {
        lock.readLock().lock();
        try {
            return rules.values().stream()
                    .filter(RoutingRule::isActive)
                    .sorted(EVALUATION_ORDER)
                    .filter(rule -> matches(rule, descriptor))
                    .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    static boolean matches(RoutingRule rule, ContentDescriptor descriptor) {
        if (!rule.getContentCategories().isEmpty() && !rule.getContentCategories().contains(descriptor.getCategory())) {
            return false;
        }
        if (!rule.getContentPatterns().isEmpty()
                && rule.getContentPatterns().stream().noneMatch(p -> GlobPatterns.matches(p, descriptor.getFilename()))) {
            return false;
        }
        if (rule.getMinSizeBytes() != null && descriptor.getSizeBytes() < rule.getMinSizeBytes()) {
            return false;
        }
        return rule.getMaxSizeBytes() == null || descriptor.getSizeBytes() <= rule.getMaxSizeBytes();
    }

    // ==================== CRUD ====================

    /**
     * Add a rule
     *
     * @return the rule id (generated when blank)
     */
    public String add(RoutingRule rule) {
        RoutingRule prepared = withId(rule);
        validate(prepared);

        lock.writeLock().lock();
        try {
            if (rules.containsKey(prepared.getId())) {
                throw new ValidationException("Routing rule already exists: " + prepared.getId());
            }
            Instant now = Instant.now(clock);
            RoutingRule stored = prepared.toBuilder().createdAt(now).updatedAt(now).build();
            documentStore.put(COLLECTION, stored.getId(), stored);
            rules.put(stored.getId(), stored);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Added routing rule {} ({})", prepared.getId(), prepared.getName());
        return prepared.getId();
    }

    /**
     * Replace a rule, keeping its id and creation time
     *
     * @return false when no rule has this id
     */
    public boolean update(String id, RoutingRule rule) {
        RoutingRule prepared = rule.toBuilder().id(id).build();
        validate(prepared);

        lock.writeLock().lock();
        try {
            RoutingRule existing = rules.get(id);
            if (existing == null) {
                return false;
            }
            RoutingRule stored = prepared.toBuilder()
                    .createdAt(existing.getCreatedAt())
                    .updatedAt(Instant.now(clock))
                    .build();
            documentStore.put(COLLECTION, id, stored);
            rules.put(id, stored);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Updated routing rule {}", id);
        return true;
    }

    public boolean delete(String id) {
        lock.writeLock().lock();
        try {
            if (!rules.containsKey(id)) {
                return false;
            }
            documentStore.delete(COLLECTION, id);
            rules.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Deleted routing rule {}", id);
        return true;
    }

    public RoutingRule get(String id) {
        lock.readLock().lock();
        try {
            RoutingRule rule = rules.get(id);
            if (rule == null) {
                throw new RuleNotFoundException(id);
            }
            return rule;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All rules in evaluation order
     */
    public List<RoutingRule> list() {
        lock.readLock().lock();
        try {
            return rules.values().stream().sorted(EVALUATION_ORDER).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Bulk ====================

    public List<RoutingRule> exportRules() {
        return list();
    }

    /**
     * Import rules in one step
     * <p>
     * Every rule is validated first; if any rule is invalid or its id collides, nothing changes.
     *
     * @param replace drop existing rules before importing
     * @return number of imported rules
     */
    public int importRules(List<RoutingRule> imported, boolean replace) {
        List<RoutingRule> prepared = imported.stream().map(RoutingRuleEngine::withId).collect(Collectors.toList());
        Set<String> ids = new HashSet<>();
        for (RoutingRule rule : prepared) {
            validate(rule);
            if (!ids.add(rule.getId())) {
                throw new ValidationException("Duplicate routing rule id in import: " + rule.getId());
            }
        }

        lock.writeLock().lock();
        try {
            if (!replace) {
                for (String id : ids) {
                    if (rules.containsKey(id)) {
                        throw new ValidationException("Routing rule already exists: " + id);
                    }
                }
            } else {
                for (String id : new ArrayList<>(rules.keySet())) {
                    documentStore.delete(COLLECTION, id);
                }
                rules.clear();
            }
            Instant now = Instant.now(clock);
            for (RoutingRule rule : prepared) {
                RoutingRule stored = rule.toBuilder()
                        .createdAt(rule.getCreatedAt() != null ? rule.getCreatedAt() : now)
                        .updatedAt(now)
                        .build();
                documentStore.put(COLLECTION, stored.getId(), stored);
                rules.put(stored.getId(), stored);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Imported {} routing rules (replace={})", prepared.size(), replace);
        return prepared.size();
    }

    // ==================== Conversion & validation ====================

    /**
     * Convert a bindable definition into a rule, parsing its enum values
     */
    public static RoutingRule fromDefinition(RoutingRuleDefinition definition) {
        List<ContentCategory> categories = definition.getContentCategories().stream()
                .map(ContentCategory::parse)
                .collect(Collectors.toList());
        return RoutingRule.builder()
                .id(definition.getId())
                .name(definition.getName())
                .contentCategories(categories)
                .contentPatterns(List.copyOf(definition.getContentPatterns()))
                .minSizeBytes(definition.getMinSizeBytes())
                .maxSizeBytes(definition.getMaxSizeBytes())
                .preferredBackends(List.copyOf(definition.getPreferredBackends()))
                .excludedBackends(List.copyOf(definition.getExcludedBackends()))
                .priority(Priority.parse(definition.getPriority()))
                .strategy(RoutingStrategy.parse(definition.getStrategy()))
                .customFactors(Map.copyOf(definition.getCustomFactors()))
                .active(definition.isActive())
                .wildcard(definition.isWildcard())
                .build();
    }

    private static RoutingRule withId(RoutingRule rule) {
        if (rule == null) {
            throw new ValidationException("rule must not be null");
        }
        if (rule.getId() == null || rule.getId().isBlank()) {
            return rule.toBuilder().id(UUID.randomUUID().toString()).build();
        }
        return rule;
    }

    static void validate(RoutingRule rule) {
        if (rule.getPriority() == null) {
            throw new ValidationException("Rule " + rule.getId() + ": priority is required");
        }
        if (rule.getStrategy() == null) {
            throw new ValidationException("Rule " + rule.getId() + ": strategy is required");
        }
        if (rule.getMinSizeBytes() != null && rule.getMinSizeBytes() < 0) {
            throw new ValidationException("Rule " + rule.getId() + ": minSizeBytes must not be negative");
        }
        if (rule.getMaxSizeBytes() != null && rule.getMaxSizeBytes() < 0) {
            throw new ValidationException("Rule " + rule.getId() + ": maxSizeBytes must not be negative");
        }
        if (rule.getMinSizeBytes() != null && rule.getMaxSizeBytes() != null
                && rule.getMinSizeBytes() > rule.getMaxSizeBytes()) {
            throw new ValidationException("Rule " + rule.getId() + ": minSizeBytes is greater than maxSizeBytes");
        }
        if (!rule.isWildcard() && rule.getContentCategories().isEmpty() && rule.getContentPatterns().isEmpty()) {
            throw new ValidationException("Rule " + rule.getId()
                    + ": needs a content category or pattern, or wildcard=true");
        }
        for (Map.Entry<String, Double> factor : rule.getCustomFactors().entrySet()) {
            if (!FACTOR_KEYS.contains(factor.getKey())) {
                throw new ValidationException("Rule " + rule.getId() + ": unknown scoring factor '"
                        + factor.getKey() + "', expected one of " + FACTOR_KEYS);
            }
            if (factor.getValue() == null || !Double.isFinite(factor.getValue()) || factor.getValue() < 0) {
                throw new ValidationException("Rule " + rule.getId() + ": factor '" + factor.getKey()
                        + "' must be a finite non-negative number");
            }
        }
        if (rule.getCustomFactors().size() == FACTOR_KEYS.size()
                && rule.getCustomFactors().values().stream().allMatch(v -> v == 0)) {
            throw new ValidationException("Rule " + rule.getId() + ": custom factors must not all be zero");
        }
    }
}
