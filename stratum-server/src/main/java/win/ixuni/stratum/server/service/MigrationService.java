package win.ixuni.stratum.server.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import win.ixuni.stratum.core.config.MigrationPolicyDefinition;
import win.ixuni.stratum.core.model.MigrationBatch;
import win.ixuni.stratum.core.model.MigrationEstimate;
import win.ixuni.stratum.core.model.MigrationPolicy;
import win.ixuni.stratum.core.model.MigrationStatus;
import win.ixuni.stratum.core.model.MigrationSummary;
import win.ixuni.stratum.core.model.MigrationTask;
import win.ixuni.stratum.core.model.Priority;
import win.ixuni.stratum.server.migration.MigrationController;
import win.ixuni.stratum.server.migration.MigrationTaskQuery;
import win.ixuni.stratum.server.migration.PolicyRunResult;

import java.util.List;

/**
 * Migration operations
 * <p>
 * Entry point for migration.* operations; parses raw priority and status strings.
 */
@Service
@RequiredArgsConstructor
public class MigrationService {

    private static final int DEFAULT_LIMIT = 100;

    private final MigrationController controller;

    // ==================== migration.policies ====================

    public List<MigrationPolicy> listPolicies() {
        return controller.listPolicies();
    }

    public MigrationPolicy getPolicy(String name) {
        return controller.getPolicy(name);
    }

    public MigrationPolicy createPolicy(MigrationPolicyDefinition definition) {
        return controller.createPolicy(MigrationController.fromDefinition(definition));
    }

    public MigrationPolicy updatePolicy(String name, MigrationPolicyDefinition definition) {
        return controller.updatePolicy(name, MigrationController.fromDefinition(definition));
    }

    public boolean deletePolicy(String name) {
        return controller.deletePolicy(name);
    }

    // ==================== migration.execute ====================

    public List<String> executePolicy(String name) {
        return controller.executePolicy(name);
    }

    public List<PolicyRunResult> runAllPolicies() {
        return controller.runAllPolicies();
    }

    // ==================== migration tasks ====================

    /**
     * @param priority priority name or value, may be null for normal
     */
    public MigrationTask start(String source, String destination, String contentId, String priority,
            boolean deleteSource) {
        return controller.createTask(source, destination, contentId, parsePriority(priority), deleteSource);
    }

    public List<MigrationTask> batch(String source, String destination, List<String> contentIds, String priority,
            boolean deleteSource) {
        return controller.createBatch(source, destination, contentIds, parsePriority(priority), deleteSource);
    }

    public MigrationTask get(String taskId) {
        return controller.getTask(taskId);
    }

    public MigrationStatus status(String taskId) {
        return controller.getTask(taskId).getStatus();
    }

    /**
     * List tasks, newest first
     *
     * @param status status name, may be null
     * @param limit  page size, null for the default
     * @param offset tasks to skip, null for none
     */
    public List<MigrationTask> list(String status, String source, String destination, String policyName,
            Integer limit, Integer offset) {
        return controller.listTasks(MigrationTaskQuery.builder()
                .status(isBlank(status) ? null : MigrationStatus.parse(status))
                .sourceBackend(blankToNull(source))
                .destinationBackend(blankToNull(destination))
                .policyName(blankToNull(policyName))
                .limit(limit != null ? limit : DEFAULT_LIMIT)
                .offset(offset != null ? offset : 0)
                .build());
    }

    public MigrationTask cancel(String taskId) {
        return controller.cancel(taskId);
    }

    public MigrationSummary summary() {
        return controller.getSummary();
    }

    public int cleanup(int days) {
        return controller.cleanupOldMigrations(days);
    }

    public MigrationEstimate estimate(String source, String destination, String contentId) {
        return controller.estimate(source, destination, contentId);
    }

    public MigrationBatch getBatch(String batchId) {
        return controller.getBatch(batchId);
    }

    private static Priority parsePriority(String priority) {
        return isBlank(priority) ? Priority.NORMAL : Priority.parse(priority);
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
