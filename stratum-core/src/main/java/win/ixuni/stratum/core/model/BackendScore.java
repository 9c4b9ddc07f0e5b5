package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Score of one candidate backend
 */
@Value
@Builder
public class BackendScore {

    String backend;

    /**
     * Weighted score in [0, 1], higher is better
     */
    double score;

    /**
     * Per-factor credit in [0, 1] before weighting, keyed by factor name
     */
    Map<String, Double> components;

    /**
     * Weights applied to the components
     */
    Map<String, Double> weights;
}
