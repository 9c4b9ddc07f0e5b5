package win.ixuni.stratum.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Migration task record
 * <p>
 * Immutable; every state change replaces the record in the task store.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MigrationTask {

    String id;

    String sourceBackend;

    String destinationBackend;

    String contentId;

    @Builder.Default
    MigrationStatus status = MigrationStatus.QUEUED;

    @Builder.Default
    Priority priority = Priority.NORMAL;

    String policyName;

    String batchId;

    boolean deleteSource;

    Instant createdAt;

    Instant startedAt;

    Instant completedAt;

    /**
     * Earliest time the task may be claimed again, set by retry backoff
     */
    Instant notBefore;

    String error;

    int retryCount;

    long bytesTransferred;

    /**
     * Key of the idempotency triple
     */
    public String taskKey() {
        return sourceBackend + "|" + destinationBackend + "|" + contentId;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
