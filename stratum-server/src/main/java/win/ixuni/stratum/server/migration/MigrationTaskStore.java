package win.ixuni.stratum.server.migration;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.exception.DuplicateTaskException;
import win.ixuni.stratum.core.exception.InvalidStateException;
import win.ixuni.stratum.core.exception.TaskNotFoundException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.MigrationBatch;
import win.ixuni.stratum.core.model.MigrationStatus;
import win.ixuni.stratum.core.model.MigrationSummary;
import win.ixuni.stratum.core.model.MigrationTask;
import win.ixuni.stratum.core.persistence.DocumentStore;
import win.ixuni.stratum.core.util.KeyLockManager;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Migration task store
 * <p>
 * Sole owner of task records and the work queue of the executor. Two lock scopes keep it consistent:
 * <ul>
 *   <li>creation runs under a lock keyed by (source, destination, content id), so at most one
 *   non-terminal task exists per triple</li>
 *   <li>every state change runs under a lock keyed by task id and checks the current state first,
 *   so a terminal task is never changed again</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationTaskStore {

    static final String TASKS = "migration_tasks";
    static final String BATCHES = "migration_batches";

    /**
     * Claim order: priority value descending, then oldest first
     */
    static final Comparator<MigrationTask> CLAIM_ORDER = Comparator
            .comparingInt((MigrationTask t) -> t.getPriority().getValue()).reversed()
            .thenComparing(MigrationTask::getCreatedAt)
            .thenComparing(MigrationTask::getId);

    /**
     * Listing order: newest first
     */
    static final Comparator<MigrationTask> NEWEST_FIRST = Comparator
            .comparing(MigrationTask::getCreatedAt).reversed()
            .thenComparing(MigrationTask::getId, Comparator.reverseOrder());

    private final DocumentStore documentStore;
    private final Clock clock;

    private final Map<String, MigrationTask> tasks = new ConcurrentHashMap<>();

    /**
     * Non-terminal task per idempotency key: "source|destination|contentId" -> task id
     */
    private final Map<String, String> activeByKey = new ConcurrentHashMap<>();

    private final Map<String, MigrationBatch> batches = new ConcurrentHashMap<>();

    private final KeyLockManager keyLocks = new KeyLockManager();

    private final KeyLockManager taskLocks = new KeyLockManager();

    private final List<Runnable> queueListeners = new CopyOnWriteArrayList<>();

    /**
     * Load persisted tasks and batches; tasks interrupted mid-transfer go back to the queue
     */
    @PostConstruct
    public void initialize() {
        int requeued = 0;
        for (MigrationTask task : documentStore.list(TASKS, MigrationTask.class)) {
            if (task.getStatus() == MigrationStatus.IN_PROGRESS) {
                task = task.toBuilder().status(MigrationStatus.QUEUED).startedAt(null).build();
                documentStore.put(TASKS, task.getId(), task);
                requeued++;
            }
            tasks.put(task.getId(), task);
            if (!task.isTerminal()) {
                activeByKey.put(task.taskKey(), task.getId());
            }
        }
        for (MigrationBatch batch : documentStore.list(BATCHES, MigrationBatch.class)) {
            batches.put(batch.getBatchId(), batch);
        }
        if (!tasks.isEmpty()) {
            log.info("Loaded {} migration tasks ({} requeued after restart) and {} batches",
                    tasks.size(), requeued, batches.size());
        }
    }

    /**
     * Register a callback run whenever a task becomes claimable
     */
    public void addQueueListener(Runnable listener) {
        queueListeners.add(listener);
    }

    // ==================== Creation ====================

    /**
     * Create a queued task from a template carrying source, destination, content id and options
     *
     * @throws DuplicateTaskException if a non-terminal task exists for the same triple
     */
    public MigrationTask create(MigrationTask template) {
        MigrationTask task = keyLocks.withLock(template.taskKey(), () -> {
            Optional<MigrationTask> active = findActive(template.taskKey());
            if (active.isPresent()) {
                throw new DuplicateTaskException(template.getSourceBackend(), template.getDestinationBackend(),
                        template.getContentId(), active.get().getId());
            }
            return insert(template);
        });
        notifyQueued();
        return task;
    }

    /**
     * Create a queued task, or return the non-terminal task that already exists for the same triple
     */
    public MigrationTask createOrReuse(MigrationTask template) {
        boolean[] created = {false};
        MigrationTask task = keyLocks.withLock(template.taskKey(), () -> findActive(template.taskKey())
                .orElseGet(() -> {
                    created[0] = true;
                    return insert(template);
                }));
        if (created[0]) {
            notifyQueued();
        } else {
            log.debug("Reusing pending task {} for {}", task.getId(), template.taskKey());
        }
        return task;
    }

    private Optional<MigrationTask> findActive(String key) {
        String id = activeByKey.get(key);
        if (id == null) {
            return Optional.empty();
        }
        MigrationTask task = tasks.get(id);
        return task != null && !task.isTerminal() ? Optional.of(task) : Optional.empty();
    }

    private MigrationTask insert(MigrationTask template) {
        MigrationTask task = template.toBuilder()
                .id(UUID.randomUUID().toString())
                .status(MigrationStatus.QUEUED)
                .createdAt(Instant.now(clock))
                .startedAt(null)
                .completedAt(null)
                .notBefore(null)
                .error(null)
                .retryCount(0)
                .bytesTransferred(0)
                .build();
        documentStore.put(TASKS, task.getId(), task);
        tasks.put(task.getId(), task);
        activeByKey.put(task.taskKey(), task.getId());
        return task;
    }

    // ==================== Queries ====================

    public MigrationTask get(String id) {
        return find(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    public Optional<MigrationTask> find(String id) {
        return id != null ? Optional.ofNullable(tasks.get(id)) : Optional.empty();
    }

    /**
     * Tasks matching the query, newest first, paged
     */
    public List<MigrationTask> list(MigrationTaskQuery query) {
        if (query.getLimit() < 0 || query.getOffset() < 0) {
            throw new ValidationException("limit and offset must not be negative");
        }
        return new ArrayList<>(tasks.values()).stream()
                .filter(query::matches)
                .sorted(NEWEST_FIRST)
                .skip(query.getOffset())
                .limit(query.getLimit())
                .collect(Collectors.toList());
    }

    /**
     * Counts per status, all taken from the same snapshot
     */
    public MigrationSummary summary() {
        List<MigrationTask> snapshot = new ArrayList<>(tasks.values());
        Map<MigrationStatus, Long> counts = new EnumMap<>(MigrationStatus.class);
        for (MigrationStatus status : MigrationStatus.values()) {
            counts.put(status, 0L);
        }
        long bytes = 0;
        for (MigrationTask task : snapshot) {
            counts.merge(task.getStatus(), 1L, Long::sum);
            if (task.getStatus() == MigrationStatus.COMPLETED) {
                bytes += task.getBytesTransferred();
            }
        }
        return new MigrationSummary(counts, snapshot.size(), bytes);
    }

    // ==================== Transitions ====================

    /**
     * Claim the next eligible queued task, moving it to in_progress
     */
    public Optional<MigrationTask> claimNext() {
        Instant now = Instant.now(clock);
        List<MigrationTask> candidates = tasks.values().stream()
                .filter(t -> t.getStatus() == MigrationStatus.QUEUED)
                .filter(t -> t.getNotBefore() == null || !t.getNotBefore().isAfter(now))
                .sorted(CLAIM_ORDER)
                .collect(Collectors.toList());
        for (MigrationTask candidate : candidates) {
            Optional<MigrationTask> claimed = transition(candidate.getId(),
                    t -> t.getStatus() == MigrationStatus.QUEUED,
                    t -> t.toBuilder().status(MigrationStatus.IN_PROGRESS).startedAt(Instant.now(clock)).build());
            if (claimed.isPresent()) {
                return claimed;
            }
        }
        return Optional.empty();
    }

    /**
     * Mark an in-progress task completed
     *
     * @return false when the task is no longer in progress (e.g. cancelled meanwhile); nothing changes then
     */
    public boolean complete(String id, long bytesTransferred) {
        return transition(id,
                t -> t.getStatus() == MigrationStatus.IN_PROGRESS,
                t -> t.toBuilder()
                        .status(MigrationStatus.COMPLETED)
                        .completedAt(Instant.now(clock))
                        .bytesTransferred(bytesTransferred)
                        .error(null)
                        .build()).isPresent();
    }

    /**
     * Put an in-progress task back in the queue after a failed attempt
     */
    public boolean retry(String id, String error, Instant notBefore) {
        boolean requeued = transition(id,
                t -> t.getStatus() == MigrationStatus.IN_PROGRESS,
                t -> t.toBuilder()
                        .status(MigrationStatus.QUEUED)
                        .retryCount(t.getRetryCount() + 1)
                        .error(error)
                        .notBefore(notBefore)
                        .startedAt(null)
                        .build()).isPresent();
        if (requeued) {
            notifyQueued();
        }
        return requeued;
    }

    /**
     * Mark a non-terminal task failed
     */
    public boolean fail(String id, String error) {
        return transition(id,
                t -> !t.isTerminal(),
                t -> t.toBuilder()
                        .status(MigrationStatus.FAILED)
                        .completedAt(Instant.now(clock))
                        .error(error)
                        .build()).isPresent();
    }

    /**
     * Cancel a queued or in-progress task
     *
     * @throws InvalidStateException if the task is already terminal
     */
    public MigrationTask cancel(String id) {
        get(id);
        return transition(id,
                t -> !t.isTerminal(),
                t -> t.toBuilder().status(MigrationStatus.CANCELLED).completedAt(Instant.now(clock)).build())
                .orElseThrow(() -> new InvalidStateException("Cannot cancel migration task " + id
                        + " in state " + get(id).getStatus().name().toLowerCase(Locale.ROOT)));
    }

    /**
     * Apply a state change if the current record satisfies the guard
     */
    private Optional<MigrationTask> transition(String id, Predicate<MigrationTask> guard,
            UnaryOperator<MigrationTask> change) {
        return taskLocks.withLock(id, () -> {
            MigrationTask current = tasks.get(id);
            if (current == null || !guard.test(current)) {
                return Optional.<MigrationTask>empty();
            }
            MigrationTask updated = change.apply(current);
            documentStore.put(TASKS, id, updated);
            tasks.put(id, updated);
            if (updated.isTerminal()) {
                activeByKey.remove(updated.taskKey(), id);
            }
            log.debug("Task {}: {} -> {}", id, current.getStatus(), updated.getStatus());
            return Optional.of(updated);
        });
    }

    // ==================== Cleanup ====================

    /**
     * Delete terminal tasks that finished at or before now - days
     *
     * @return number of deleted tasks
     */
    public int cleanup(int days) {
        if (days < 0) {
            throw new ValidationException("days must not be negative: " + days);
        }
        Instant cutoff = Instant.now(clock).minus(days, ChronoUnit.DAYS);
        int removed = 0;
        for (String id : new ArrayList<>(tasks.keySet())) {
            boolean deleted = taskLocks.withLock(id, () -> {
                MigrationTask task = tasks.get(id);
                if (task == null || !task.isTerminal()) {
                    return false;
                }
                Instant finished = task.getCompletedAt() != null ? task.getCompletedAt() : task.getCreatedAt();
                if (finished.isAfter(cutoff)) {
                    return false;
                }
                documentStore.delete(TASKS, id);
                tasks.remove(id);
                return true;
            });
            if (deleted) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} migration tasks finished before {}", removed, cutoff);
        }
        return removed;
    }

    // ==================== Batches ====================

    public static String newBatchId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Record a batch; batches are never modified afterwards
     */
    public MigrationBatch saveBatch(String batchId, String policyName, List<String> taskIds) {
        MigrationBatch batch = MigrationBatch.builder()
                .batchId(batchId)
                .policyName(policyName)
                .createdAt(Instant.now(clock))
                .taskIds(List.copyOf(taskIds))
                .build();
        documentStore.put(BATCHES, batch.getBatchId(), batch);
        batches.put(batch.getBatchId(), batch);
        return batch;
    }

    public MigrationBatch getBatch(String batchId) {
        MigrationBatch batch = batchId != null ? batches.get(batchId) : null;
        if (batch == null) {
            throw TaskNotFoundException.batch(batchId);
        }
        return batch;
    }

    private void notifyQueued() {
        for (Runnable listener : queueListeners) {
            listener.run();
        }
    }
}
