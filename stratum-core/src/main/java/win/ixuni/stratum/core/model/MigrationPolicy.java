package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Migration policy
 * <p>
 * Names a source and a destination backend plus the filter selecting which source content to move.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MigrationPolicy {

    String name;

    String description;

    String sourceBackend;

    String destinationBackend;

    @Builder.Default
    ContentFilter contentFilter = ContentFilter.all();

    @Builder.Default
    ScheduleMode scheduleMode = ScheduleMode.MANUAL;

    @Builder.Default
    Priority priority = Priority.NORMAL;

    /**
     * Delete content from the source once it has been copied
     */
    boolean deleteSource;

    @Builder.Default
    boolean enabled = true;

    Instant createdAt;

    Instant lastRunAt;

    long runCount;

    /**
     * Tasks created by this policy over all runs
     */
    long totalMigrations;

    /**
     * Bytes listed for migration over all runs
     */
    long totalBytesMigrated;
}
