package win.ixuni.stratum.server.migration;

import lombok.Builder;
import lombok.Value;
import win.ixuni.stratum.core.model.MigrationStatus;
import win.ixuni.stratum.core.model.MigrationTask;

/**
 * Task list filter and page; null fields match everything
 */
@Value
@Builder
public class MigrationTaskQuery {

    MigrationStatus status;

    String sourceBackend;

    String destinationBackend;

    String policyName;

    String batchId;

    @Builder.Default
    int limit = 100;

    @Builder.Default
    int offset = 0;

    public static MigrationTaskQuery all() {
        return MigrationTaskQuery.builder().limit(Integer.MAX_VALUE).build();
    }

    boolean matches(MigrationTask task) {
        return (status == null || status == task.getStatus())
                && (sourceBackend == null || sourceBackend.equals(task.getSourceBackend()))
                && (destinationBackend == null || destinationBackend.equals(task.getDestinationBackend()))
                && (policyName == null || policyName.equals(task.getPolicyName()))
                && (batchId == null || batchId.equals(task.getBatchId()));
    }
}
