package win.ixuni.stratum.core.exception;

/**
 * Operation not allowed in the current state (e.g. cancelling a finished task, running a disabled policy)
 */
public class InvalidStateException extends StratumException {

    public static final String ERROR_CODE = "InvalidState";

    public InvalidStateException(String message) {
        super(ERROR_CODE, message, false);
    }
}
