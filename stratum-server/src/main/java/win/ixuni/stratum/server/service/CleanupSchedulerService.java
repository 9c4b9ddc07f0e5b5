package win.ixuni.stratum.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.server.migration.MigrationController;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduled cleanup service
 * <p>
 * 负责清理超过保留期的已结束迁移任务 (completed, failed, cancelled).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CleanupSchedulerService {

    private final MigrationController migrationController;
    private final StratumProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Runs hourly by default; disabled via stratum.migration.cleanup.enabled=false
     */
    @Scheduled(cron = "${stratum.migration.cleanup.cron:0 0 * * * *}")
    public void scheduledCleanup() {
        if (!properties.getMigration().getCleanup().isEnabled()) {
            log.debug("Cleanup is disabled, skipping scheduled cleanup");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous cleanup is still running, skipping this run");
            return;
        }
        try {
            log.info("Starting scheduled cleanup...");
            performCleanup();
        } finally {
            running.set(false);
        }
    }

    /**
     * 手动触发清理
     *
     * @return number of removed tasks, or -1 if a cleanup is already running
     */
    public int triggerCleanup() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Cleanup is already running");
            return -1;
        }
        try {
            log.info("Manual cleanup triggered...");
            return performCleanup();
        } finally {
            running.set(false);
        }
    }

    private int performCleanup() {
        int retentionDays = properties.getMigration().getCleanup().getRetentionDays();
        try {
            int removed = migrationController.cleanupOldMigrations(retentionDays);
            log.info("Cleanup removed {} migration tasks older than {} days", removed, retentionDays);
            return removed;
        } catch (RuntimeException e) {
            log.error("Cleanup failed: {}", e.getMessage(), e);
            throw e;
        }
    }
}
