package win.ixuni.stratum.core.exception;

/**
 * Content not found in a backend
 */
public class ContentNotFoundException extends NotFoundException {

    public ContentNotFoundException(String backendName, String contentId) {
        super("content", backendName + "/" + contentId);
    }
}
