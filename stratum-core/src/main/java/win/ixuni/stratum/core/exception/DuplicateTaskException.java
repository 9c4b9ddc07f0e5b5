package win.ixuni.stratum.core.exception;

import lombok.Getter;

/**
 * A non-terminal migration task already exists for the same (source, destination, content) triple
 */
@Getter
public class DuplicateTaskException extends StratumException {

    public static final String ERROR_CODE = "DuplicateTask";

    /**
     * Id of the task that is already queued or running
     */
    private final String existingTaskId;

    public DuplicateTaskException(String sourceBackend, String destinationBackend, String contentId,
            String existingTaskId) {
        super(ERROR_CODE, String.format("A migration of '%s' from '%s' to '%s' is already pending: %s",
                contentId, sourceBackend, destinationBackend, existingTaskId), false);
        this.existingTaskId = existingTaskId;
    }
}
