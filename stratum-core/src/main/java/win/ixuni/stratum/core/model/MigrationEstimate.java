package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Projected cost and duration of moving one content item
 */
@Value
@Builder
public class MigrationEstimate {

    String sourceBackend;

    String destinationBackend;

    String contentId;

    long sizeBytes;

    /**
     * Retrieval plus bandwidth cost on the source side
     */
    double transferCost;

    /**
     * Monthly cost of keeping the content on the destination
     */
    double monthlyStorageCost;

    double estimatedSeconds;
}
