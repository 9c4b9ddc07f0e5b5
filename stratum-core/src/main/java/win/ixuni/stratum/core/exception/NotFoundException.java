package win.ixuni.stratum.core.exception;

import lombok.Getter;

/**
 * Resource not found exception
 */
@Getter
public class NotFoundException extends StratumException {

    public static final String ERROR_CODE = "NotFound";

    /**
     * Resource kind, e.g. "backend", "rule"
     */
    private final String resourceType;

    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super(ERROR_CODE, "The specified " + resourceType + " does not exist: " + resourceId, false);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
