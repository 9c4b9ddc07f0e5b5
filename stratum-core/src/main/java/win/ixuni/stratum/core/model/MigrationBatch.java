package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Group of tasks created by one policy execution or one batch request
 */
@Value
@Builder
@Jacksonized
public class MigrationBatch {

    String batchId;

    /**
     * Null for ad-hoc batches
     */
    String policyName;

    Instant createdAt;

    @Builder.Default
    List<String> taskIds = List.of();
}
