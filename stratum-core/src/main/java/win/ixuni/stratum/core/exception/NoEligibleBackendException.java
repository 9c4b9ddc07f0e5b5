package win.ixuni.stratum.core.exception;

/**
 * No backend left to score after rule filtering
 * <p>
 * The caller has to broaden the rule or register (and report metrics for) more backends.
 */
public class NoEligibleBackendException extends StratumException {

    public static final String ERROR_CODE = "NoEligibleBackend";

    public NoEligibleBackendException(String message) {
        super(ERROR_CODE, message, false);
    }
}
