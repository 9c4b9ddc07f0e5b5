package win.ixuni.stratum.core.exception;

import lombok.Getter;

/**
 * A backend store call (add/get/list/delete) failed
 * <p>
 * Retried by the migration executor, surfaced immediately by routing.
 */
@Getter
public class BackendUnavailableException extends StratumException {

    public static final String ERROR_CODE = "BackendUnavailable";

    private final String backendName;

    public BackendUnavailableException(String backendName, String message) {
        super(ERROR_CODE, "Backend '" + backendName + "' unavailable: " + message, true);
        this.backendName = backendName;
    }

    public BackendUnavailableException(String backendName, String message, Throwable cause) {
        super(ERROR_CODE, "Backend '" + backendName + "' unavailable: " + message, true, cause);
        this.backendName = backendName;
    }
}
