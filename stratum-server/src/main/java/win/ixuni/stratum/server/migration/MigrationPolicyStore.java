package win.ixuni.stratum.server.migration;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.exception.PolicyNotFoundException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.MigrationPolicy;
import win.ixuni.stratum.core.model.ScheduleMode;
import win.ixuni.stratum.core.persistence.DocumentStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Migration policy store
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationPolicyStore {

    static final String COLLECTION = "migration_policies";

    private final DocumentStore documentStore;
    private final Clock clock;

    private final Map<String, MigrationPolicy> policies = new ConcurrentHashMap<>();

    @PostConstruct
    public void initialize() {
        documentStore.list(COLLECTION, MigrationPolicy.class).forEach(p -> policies.put(p.getName(), p));
        if (!policies.isEmpty()) {
            log.info("Loaded {} migration policies from the document store", policies.size());
        }
    }

    public synchronized MigrationPolicy create(MigrationPolicy policy) {
        validate(policy);
        if (policies.containsKey(policy.getName())) {
            throw new ValidationException("Migration policy already exists: " + policy.getName());
        }
        MigrationPolicy stored = policy.toBuilder()
                .createdAt(Instant.now(clock))
                .lastRunAt(null)
                .runCount(0)
                .totalMigrations(0)
                .totalBytesMigrated(0)
                .build();
        save(stored);
        log.info("Created migration policy {}: {} -> {}", stored.getName(),
                stored.getSourceBackend(), stored.getDestinationBackend());
        return stored;
    }

    /**
     * Replace a policy's definition, keeping its creation time and run statistics
     */
    public synchronized MigrationPolicy update(String name, MigrationPolicy policy) {
        MigrationPolicy existing = get(name);
        MigrationPolicy prepared = policy.toBuilder().name(name).build();
        validate(prepared);
        MigrationPolicy stored = prepared.toBuilder()
                .createdAt(existing.getCreatedAt())
                .lastRunAt(existing.getLastRunAt())
                .runCount(existing.getRunCount())
                .totalMigrations(existing.getTotalMigrations())
                .totalBytesMigrated(existing.getTotalBytesMigrated())
                .build();
        save(stored);
        log.info("Updated migration policy {}", name);
        return stored;
    }

    public synchronized boolean delete(String name) {
        if (!policies.containsKey(name)) {
            return false;
        }
        documentStore.delete(COLLECTION, name);
        policies.remove(name);
        log.info("Deleted migration policy {}", name);
        return true;
    }

    public MigrationPolicy get(String name) {
        return find(name).orElseThrow(() -> new PolicyNotFoundException(name));
    }

    public Optional<MigrationPolicy> find(String name) {
        return name != null ? Optional.ofNullable(policies.get(name)) : Optional.empty();
    }

    /**
     * All policies, sorted by name
     */
    public List<MigrationPolicy> list() {
        return policies.values().stream()
                .sorted(Comparator.comparing(MigrationPolicy::getName))
                .collect(Collectors.toList());
    }

    /**
     * Add one execution to the policy's run statistics
     */
    public synchronized MigrationPolicy recordRun(String name, long newTasks, long bytes) {
        MigrationPolicy existing = get(name);
        MigrationPolicy stored = existing.toBuilder()
                .lastRunAt(Instant.now(clock))
                .runCount(existing.getRunCount() + 1)
                .totalMigrations(existing.getTotalMigrations() + newTasks)
                .totalBytesMigrated(existing.getTotalBytesMigrated() + bytes)
                .build();
        save(stored);
        return stored;
    }

    private void save(MigrationPolicy policy) {
        documentStore.put(COLLECTION, policy.getName(), policy);
        policies.put(policy.getName(), policy);
    }

    static void validate(MigrationPolicy policy) {
        if (policy == null) {
            throw new ValidationException("policy must not be null");
        }
        if (policy.getName() == null || policy.getName().isBlank()) {
            throw new ValidationException("policy name must not be empty");
        }
        if (policy.getSourceBackend() == null || policy.getSourceBackend().isBlank()
                || policy.getDestinationBackend() == null || policy.getDestinationBackend().isBlank()) {
            throw new ValidationException("Policy " + policy.getName() + ": source and destination are required");
        }
        if (policy.getSourceBackend().equals(policy.getDestinationBackend())) {
            throw new ValidationException("Policy " + policy.getName() + ": source and destination must differ");
        }
        if (policy.getPriority() == null) {
            throw new ValidationException("Policy " + policy.getName() + ": priority is required");
        }
        if (policy.getScheduleMode() != ScheduleMode.MANUAL) {
            throw new ValidationException("Policy " + policy.getName() + ": schedule mode "
                    + policy.getScheduleMode() + " is not supported, use manual");
        }
        if (policy.getContentFilter() == null) {
            throw new ValidationException("Policy " + policy.getName() + ": content filter is required");
        }
        Long min = policy.getContentFilter().getMinSizeBytes();
        Long max = policy.getContentFilter().getMaxSizeBytes();
        if (min != null && max != null && min > max) {
            throw new ValidationException("Policy " + policy.getName() + ": minSizeBytes is greater than maxSizeBytes");
        }
        Integer minAgeDays = policy.getContentFilter().getMinAgeDays();
        if (minAgeDays != null && minAgeDays < 0) {
            throw new ValidationException("Policy " + policy.getName() + ": minAgeDays must not be negative");
        }
    }
}
