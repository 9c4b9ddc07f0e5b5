package win.ixuni.stratum.core.exception;

/**
 * Routing rule not found exception
 */
public class RuleNotFoundException extends NotFoundException {

    public RuleNotFoundException(String ruleId) {
        super("routing rule", ruleId);
    }
}
