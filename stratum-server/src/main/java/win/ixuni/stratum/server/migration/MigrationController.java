package win.ixuni.stratum.server.migration;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.backend.BackendStore;
import win.ixuni.stratum.core.config.MigrationPolicyDefinition;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.exception.BackendNotFoundException;
import win.ixuni.stratum.core.exception.BackendUnavailableException;
import win.ixuni.stratum.core.exception.ContentNotFoundException;
import win.ixuni.stratum.core.exception.InvalidStateException;
import win.ixuni.stratum.core.exception.StratumException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.BackendMetrics;
import win.ixuni.stratum.core.model.ContentFilter;
import win.ixuni.stratum.core.model.ContentItem;
import win.ixuni.stratum.core.model.MigrationBatch;
import win.ixuni.stratum.core.model.MigrationEstimate;
import win.ixuni.stratum.core.model.MigrationPolicy;
import win.ixuni.stratum.core.model.MigrationSummary;
import win.ixuni.stratum.core.model.MigrationTask;
import win.ixuni.stratum.core.model.Priority;
import win.ixuni.stratum.core.model.ScheduleMode;
import win.ixuni.stratum.server.error.ErrorResponse;
import win.ixuni.stratum.server.registry.BackendRegistry;
import win.ixuni.stratum.server.routing.BackendMetricsStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Migration controller
 * <p>
 * Policy CRUD, policy execution and the task lifecycle operations. Tasks are only created here; the
 * executor picks them up from the task store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationController {

    private static final double BYTES_PER_GB = 1024.0 * 1024 * 1024;

    private final MigrationPolicyStore policyStore;
    private final MigrationTaskStore taskStore;
    private final BackendRegistry backendRegistry;
    private final BackendMetricsStore metricsStore;
    private final StratumProperties properties;
    private final Clock clock;

    /**
     * Create the policies declared in configuration that do not exist yet
     */
    @PostConstruct
    public void seedPolicies() {
        for (MigrationPolicyDefinition definition : properties.getMigration().getPolicies()) {
            if (policyStore.find(definition.getName()).isPresent()) {
                continue;
            }
            try {
                createPolicy(fromDefinition(definition));
            } catch (StratumException e) {
                log.error("Skipping configured migration policy '{}': {}", definition.getName(), e.getMessage());
            }
        }
    }

    // ==================== Policies ====================

    public MigrationPolicy createPolicy(MigrationPolicy policy) {
        MigrationPolicyStore.validate(policy);
        requireBackend(policy.getSourceBackend());
        requireBackend(policy.getDestinationBackend());
        return policyStore.create(policy);
    }

    public MigrationPolicy updatePolicy(String name, MigrationPolicy policy) {
        policyStore.get(name);
        MigrationPolicyStore.validate(policy.toBuilder().name(name).build());
        requireBackend(policy.getSourceBackend());
        requireBackend(policy.getDestinationBackend());
        return policyStore.update(name, policy);
    }

    public boolean deletePolicy(String name) {
        return policyStore.delete(name);
    }

    public MigrationPolicy getPolicy(String name) {
        return policyStore.get(name);
    }

    public List<MigrationPolicy> listPolicies() {
        return policyStore.list();
    }

    /**
     * Execute a policy
     * <p>
     * Lists the source with the policy filter and creates one task per item, reusing tasks already pending
     * for the same content. Items the destination already holds are skipped. All tasks of the run are
     * recorded in one batch.
     *
     * @return ids of the new and reused tasks
     */
    public List<String> executePolicy(String name) {
        MigrationPolicy policy = policyStore.get(name);
        if (!policy.isEnabled()) {
            throw new InvalidStateException("Migration policy " + name + " is disabled");
        }
        BackendStore source = backendRegistry.getBackend(policy.getSourceBackend());
        BackendStore destination = backendRegistry.getBackend(policy.getDestinationBackend());

        Set<String> present = new HashSet<>();
        for (ContentItem item : listSource(destination, ContentFilter.all())) {
            present.add(item.getId());
        }
        List<ContentItem> items = new ArrayList<>();
        for (ContentItem item : listSource(source, policy.getContentFilter())) {
            if (!present.contains(item.getId())) {
                items.add(item);
            }
        }

        String batchId = MigrationTaskStore.newBatchId();
        Set<String> taskIds = new LinkedHashSet<>();
        long newTasks = 0;
        long bytes = 0;
        for (ContentItem item : items) {
            MigrationTask task = taskStore.createOrReuse(MigrationTask.builder()
                    .sourceBackend(policy.getSourceBackend())
                    .destinationBackend(policy.getDestinationBackend())
                    .contentId(item.getId())
                    .priority(policy.getPriority())
                    .deleteSource(policy.isDeleteSource())
                    .policyName(name)
                    .batchId(batchId)
                    .build());
            taskIds.add(task.getId());
            if (batchId.equals(task.getBatchId())) {
                newTasks++;
                bytes += item.getSizeBytes();
            }
        }

        List<String> ids = new ArrayList<>(taskIds);
        taskStore.saveBatch(batchId, name, ids);
        policyStore.recordRun(name, newTasks, bytes);
        log.info("Executed migration policy {}: {} items, {} new tasks, {} reused",
                name, items.size(), newTasks, ids.size() - newTasks);
        return ids;
    }

    /**
     * Execute every enabled policy; a failing policy does not stop the others
     */
    public List<PolicyRunResult> runAllPolicies() {
        List<PolicyRunResult> results = new ArrayList<>();
        for (MigrationPolicy policy : policyStore.list()) {
            if (!policy.isEnabled()) {
                continue;
            }
            try {
                results.add(new PolicyRunResult(policy.getName(), executePolicy(policy.getName()), null));
            } catch (RuntimeException e) {
                results.add(new PolicyRunResult(policy.getName(), List.of(),
                        ErrorResponse.from(e, "policy/" + policy.getName())));
            }
        }
        return results;
    }

    // ==================== Tasks ====================

    /**
     * Create a single migration task
     *
     * @throws win.ixuni.stratum.core.exception.DuplicateTaskException if one is already pending for the content
     */
    public MigrationTask createTask(String source, String destination, String contentId,
            Priority priority, boolean deleteSource) {
        validateTransfer(source, destination, contentId);
        MigrationTask task = taskStore.create(MigrationTask.builder()
                .sourceBackend(source)
                .destinationBackend(destination)
                .contentId(contentId)
                .priority(priority != null ? priority : Priority.NORMAL)
                .deleteSource(deleteSource)
                .build());
        log.info("Created migration task {}: {} {} -> {}", task.getId(), contentId, source, destination);
        return task;
    }

    /**
     * Create tasks for many content ids in one batch; content already pending keeps its existing task
     */
    public List<MigrationTask> createBatch(String source, String destination, List<String> contentIds,
            Priority priority, boolean deleteSource) {
        if (contentIds == null || contentIds.isEmpty()) {
            throw new ValidationException("contentIds must not be empty");
        }
        for (String contentId : contentIds) {
            validateTransfer(source, destination, contentId);
        }

        String batchId = MigrationTaskStore.newBatchId();
        Set<String> taskIds = new LinkedHashSet<>();
        List<MigrationTask> result = new ArrayList<>();
        for (String contentId : new LinkedHashSet<>(contentIds)) {
            MigrationTask task = taskStore.createOrReuse(MigrationTask.builder()
                    .sourceBackend(source)
                    .destinationBackend(destination)
                    .contentId(contentId)
                    .priority(priority != null ? priority : Priority.NORMAL)
                    .deleteSource(deleteSource)
                    .batchId(batchId)
                    .build());
            taskIds.add(task.getId());
            result.add(task);
        }
        taskStore.saveBatch(batchId, null, new ArrayList<>(taskIds));
        log.info("Created migration batch {} with {} tasks: {} -> {}", batchId, result.size(), source, destination);
        return result;
    }

    public MigrationTask getTask(String id) {
        return taskStore.get(id);
    }

    public List<MigrationTask> listTasks(MigrationTaskQuery query) {
        return taskStore.list(query);
    }

    public MigrationTask cancel(String id) {
        MigrationTask cancelled = taskStore.cancel(id);
        log.info("Cancelled migration task {}", id);
        return cancelled;
    }

    public MigrationSummary getSummary() {
        return taskStore.summary();
    }

    public int cleanupOldMigrations(int days) {
        return taskStore.cleanup(days);
    }

    public MigrationBatch getBatch(String batchId) {
        return taskStore.getBatch(batchId);
    }

    // ==================== Estimate ====================

    /**
     * Project the cost and duration of moving one content item, without creating a task
     */
    public MigrationEstimate estimate(String source, String destination, String contentId) {
        validateTransfer(source, destination, contentId);
        BackendStore sourceStore = backendRegistry.getBackend(source);
        BackendMetrics sourceMetrics = metricsStore.get(source);
        BackendMetrics destinationMetrics = metricsStore.get(destination);

        ContentItem item = listSource(sourceStore, ContentFilter.builder().prefix(contentId).build()).stream()
                .filter(i -> contentId.equals(i.getId()))
                .findFirst()
                .orElseThrow(() -> new ContentNotFoundException(source, contentId));

        double gigabytes = item.getSizeBytes() / BYTES_PER_GB;
        double transferCost = gigabytes * (sourceMetrics.getRetrievalCostPerGb() + sourceMetrics.getBandwidthCostPerGb());
        double monthlyStorageCost = gigabytes * destinationMetrics.getStorageCostPerGb();

        double throughput = Math.min(sourceMetrics.getThroughputMbps(), destinationMetrics.getThroughputMbps());
        double seconds = (sourceMetrics.getAvgLatencyMs() + destinationMetrics.getAvgLatencyMs()) / 1000.0;
        if (throughput > 0) {
            seconds += item.getSizeBytes() * 8.0 / (throughput * 1_000_000);
        }

        return MigrationEstimate.builder()
                .sourceBackend(source)
                .destinationBackend(destination)
                .contentId(contentId)
                .sizeBytes(item.getSizeBytes())
                .transferCost(transferCost)
                .monthlyStorageCost(monthlyStorageCost)
                .estimatedSeconds(seconds)
                .build();
    }

    // ==================== Helpers ====================

    /**
     * Convert a bindable definition into a policy, parsing its enum values
     */
    public static MigrationPolicy fromDefinition(MigrationPolicyDefinition definition) {
        MigrationPolicyDefinition.FilterDefinition filter = definition.getFilter() != null
                ? definition.getFilter() : new MigrationPolicyDefinition.FilterDefinition();
        return MigrationPolicy.builder()
                .name(definition.getName())
                .description(definition.getDescription())
                .sourceBackend(definition.getSourceBackend())
                .destinationBackend(definition.getDestinationBackend())
                .contentFilter(ContentFilter.builder()
                        .type(filter.getType())
                        .contentTypes(List.copyOf(filter.getContentTypes()))
                        .prefix(filter.getPrefix())
                        .minSizeBytes(filter.getMinSizeBytes())
                        .maxSizeBytes(filter.getMaxSizeBytes())
                        .minAgeDays(filter.getMinAgeDays())
                        .tags(List.copyOf(filter.getTags()))
                        .custom(Map.copyOf(filter.getCustom()))
                        .build())
                .scheduleMode(ScheduleMode.parse(definition.getScheduleMode()))
                .priority(Priority.parse(definition.getPriority()))
                .deleteSource(definition.isDeleteSource())
                .enabled(definition.isEnabled())
                .build();
    }

    private List<ContentItem> listSource(BackendStore source, ContentFilter filter) {
        Duration timeout = properties.getMigration().getTransferTimeout();
        List<ContentItem> items;
        try {
            items = source.list(filter).collectList().block(timeout);
        } catch (StratumException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendUnavailableException(source.getBackendName(), "listing failed: " + e.getMessage(), e);
        }
        Instant now = Instant.now(clock);
        List<ContentItem> matching = new ArrayList<>();
        if (items != null) {
            for (ContentItem item : items) {
                if (filter.matches(item, now)) {
                    matching.add(item);
                }
            }
        }
        return matching;
    }

    private void validateTransfer(String source, String destination, String contentId) {
        if (contentId == null || contentId.isBlank()) {
            throw new ValidationException("contentId must not be empty");
        }
        if (source == null || source.isBlank() || destination == null || destination.isBlank()) {
            throw new ValidationException("source and destination backends are required");
        }
        if (source.equals(destination)) {
            throw new ValidationException("source and destination must differ: " + source);
        }
        requireBackend(source);
        requireBackend(destination);
    }

    private void requireBackend(String name) {
        if (!backendRegistry.hasBackend(name)) {
            throw new BackendNotFoundException(name);
        }
    }
}
