package win.ixuni.stratum.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of the backend store call made by {@code route}
 */
@Value
@Builder
public class StoreResult {

    boolean success;

    String backend;

    /**
     * Id returned by the backend, null on failure
     */
    String contentId;

    String errorCode;

    String error;

    public static StoreResult stored(String backend, String contentId) {
        return StoreResult.builder()
                .success(true)
                .backend(backend)
                .contentId(contentId)
                .build();
    }

    public static StoreResult failed(String backend, String errorCode, String error) {
        return StoreResult.builder()
                .success(false)
                .backend(backend)
                .errorCode(errorCode)
                .error(error)
                .build();
    }
}
