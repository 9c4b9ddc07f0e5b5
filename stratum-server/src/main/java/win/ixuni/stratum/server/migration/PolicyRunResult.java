package win.ixuni.stratum.server.migration;

import lombok.Value;
import win.ixuni.stratum.server.error.ErrorResponse;

import java.util.List;

/**
 * Outcome of one policy in a run over all policies
 */
@Value
public class PolicyRunResult {

    String policyName;

    /**
     * Task ids, empty when the run failed
     */
    List<String> taskIds;

    /**
     * Failure, null on success
     */
    ErrorResponse error;

    public boolean isSuccess() {
        return error == null;
    }
}
