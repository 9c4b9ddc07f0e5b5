package win.ixuni.stratum.core.exception;

/**
 * No metrics snapshot has been reported for the backend yet
 */
public class MetricsNotFoundException extends NotFoundException {

    public MetricsNotFoundException(String backendName) {
        super("backend metrics", backendName);
    }
}
