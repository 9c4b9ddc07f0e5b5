package win.ixuni.stratum.server.migration;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.backend.BackendStore;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.model.ContentMetadata;
import win.ixuni.stratum.core.model.MigrationStatus;
import win.ixuni.stratum.core.model.MigrationTask;
import win.ixuni.stratum.core.model.StoredContent;
import win.ixuni.stratum.server.registry.BackendRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Migration executor
 * <p>
 * A fixed pool of workers draining the task store. Each worker runs one task at a time:
 * fetch from the source, check for cancellation, write to the destination, complete, then optionally
 * delete from the source. Failed attempts are requeued with exponential backoff until the retry limit.
 * Idle workers sleep until new work is queued or the poll interval elapses.
 */
@Slf4j
@Component
public class MigrationExecutor {

    private final MigrationTaskStore taskStore;
    private final BackendRegistry backendRegistry;
    private final StratumProperties.MigrationConfig config;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ReentrantLock signalLock = new ReentrantLock();
    private final Condition workAvailable = signalLock.newCondition();

    private ExecutorService workers;

    public MigrationExecutor(MigrationTaskStore taskStore, BackendRegistry backendRegistry,
            StratumProperties properties, Clock clock) {
        this.taskStore = taskStore;
        this.backendRegistry = backendRegistry;
        this.config = properties.getMigration();
        this.clock = clock;
        taskStore.addQueueListener(this::signalWork);
    }

    @PostConstruct
    public void autoStart() {
        if (config.isAutoStart()) {
            start();
        } else {
            log.info("Migration executor auto-start is disabled");
        }
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        int size = Math.max(1, config.getWorkers());
        AtomicInteger counter = new AtomicInteger();
        workers = Executors.newFixedThreadPool(size, r -> {
            Thread thread = new Thread(r, "migration-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < size; i++) {
            workers.submit(this::workLoop);
        }
        log.info("Migration executor started with {} workers", size);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        signalWork();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Migration workers did not finish in time, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Migration executor stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Claim and process one task on the calling thread
     *
     * @return false when no task was eligible
     */
    public boolean runOnce() {
        Optional<MigrationTask> task = taskStore.claimNext();
        task.ifPresent(this::process);
        return task.isPresent();
    }

    private void workLoop() {
        while (running.get()) {
            try {
                if (!runOnce()) {
                    awaitWork();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Unexpected error in migration worker", e);
            }
        }
    }

    private void awaitWork() throws InterruptedException {
        signalLock.lock();
        try {
            if (running.get()) {
                workAvailable.await(config.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
            }
        } finally {
            signalLock.unlock();
        }
    }

    private void signalWork() {
        signalLock.lock();
        try {
            workAvailable.signalAll();
        } finally {
            signalLock.unlock();
        }
    }

    void process(MigrationTask task) {
        Optional<BackendStore> source = backendRegistry.findBackend(task.getSourceBackend());
        Optional<BackendStore> destination = backendRegistry.findBackend(task.getDestinationBackend());
        if (source.isEmpty() || destination.isEmpty()) {
            String missing = source.isEmpty() ? task.getSourceBackend() : task.getDestinationBackend();
            log.error("Migration task {} failed: unknown backend {}", task.getId(), missing);
            taskStore.fail(task.getId(), "Unknown backend: " + missing);
            return;
        }

        Duration timeout = config.getTransferTimeout();
        try {
            StoredContent content = source.get().get(task.getContentId()).block(timeout);
            if (content == null) {
                throw new IllegalStateException("Source returned no content for " + task.getContentId());
            }

            if (isCancelled(task.getId())) {
                log.info("Migration task {} was cancelled, skipping destination write", task.getId());
                return;
            }

            Map<String, String> metadata = new HashMap<>(content.getMetadata());
            metadata.put(ContentMetadata.CONTENT_ID, task.getContentId());
            if (content.getContentType() != null) {
                metadata.put(ContentMetadata.CONTENT_TYPE, content.getContentType());
            }
            metadata.put(ContentMetadata.MIGRATED_FROM, task.getSourceBackend());
            metadata.put(ContentMetadata.MIGRATION_TASK, task.getId());
            metadata.put(ContentMetadata.MIGRATION_TIME, Instant.now(clock).toString());

            destination.get().add(content.getData(), metadata).block(timeout);

            if (!taskStore.complete(task.getId(), content.getData().length)) {
                log.info("Migration task {} is no longer in progress, late completion ignored", task.getId());
                return;
            }
            log.info("Migration task {} completed: {} ({} bytes) {} -> {}", task.getId(), task.getContentId(),
                    content.getData().length, task.getSourceBackend(), task.getDestinationBackend());

            if (task.isDeleteSource()) {
                deleteSource(source.get(), task);
            }
        } catch (RuntimeException e) {
            handleFailure(task, e);
        }
    }

    private boolean isCancelled(String taskId) {
        return taskStore.find(taskId).map(t -> t.getStatus() == MigrationStatus.CANCELLED).orElse(true);
    }

    private void deleteSource(BackendStore source, MigrationTask task) {
        try {
            source.delete(task.getContentId()).block(config.getTransferTimeout());
        } catch (RuntimeException e) {
            log.warn("Migration task {} completed but deleting {} from {} failed: {}",
                    task.getId(), task.getContentId(), task.getSourceBackend(), e.getMessage());
        }
    }

    private void handleFailure(MigrationTask task, RuntimeException e) {
        String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (task.getRetryCount() < config.getMaxRetries()) {
            Duration backoff = config.getBaseDelay().multipliedBy(1L << Math.min(task.getRetryCount(), 30));
            Instant notBefore = Instant.now(clock).plus(backoff);
            if (taskStore.retry(task.getId(), error, notBefore)) {
                log.warn("Migration task {} attempt {} failed, retrying after {}: {}",
                        task.getId(), task.getRetryCount() + 1, backoff, error);
            }
            return;
        }
        if (taskStore.fail(task.getId(), error)) {
            log.error("Migration task {} failed after {} retries: {}", task.getId(), task.getRetryCount(), error, e);
        }
    }
}
