package win.ixuni.stratum.core.model;

import lombok.Value;

import java.util.Map;

/**
 * Task counts per status, taken from a single snapshot
 */
@Value
public class MigrationSummary {

    Map<MigrationStatus, Long> counts;

    long total;

    /**
     * Bytes moved by completed tasks
     */
    long totalBytesMigrated;

    public long count(MigrationStatus status) {
        return counts.getOrDefault(status, 0L);
    }
}
