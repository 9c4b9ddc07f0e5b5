package win.ixuni.stratum.core.exception;

/**
 * Validation exception
 * <p>
 * Malformed rule, policy or metrics, bad enum value, inverted size bounds. Raised before any mutation.
 */
public class ValidationException extends StratumException {

    public static final String ERROR_CODE = "ValidationError";

    public ValidationException(String message) {
        super(ERROR_CODE, message, false);
    }
}
