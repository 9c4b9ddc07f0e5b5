package win.ixuni.stratum.core.exception;

/**
 * Migration policy not found exception
 */
public class PolicyNotFoundException extends NotFoundException {

    public PolicyNotFoundException(String policyName) {
        super("migration policy", policyName);
    }
}
