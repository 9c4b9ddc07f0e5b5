package win.ixuni.stratum.core.exception;

/**
 * Backend not found exception
 */
public class BackendNotFoundException extends NotFoundException {

    public BackendNotFoundException(String backendName) {
        super("backend", backendName);
    }
}
