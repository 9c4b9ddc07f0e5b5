package win.ixuni.stratum.core.backend;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import win.ixuni.stratum.core.config.BackendConfig;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.ContentMetadata;
import win.ixuni.stratum.core.util.ContentHashes;

import java.util.Map;

/**
 * Abstract base class for backend stores
 * <p>
 * Provides the naming and content id conventions shared by every backend.
 */
@RequiredArgsConstructor
public abstract class AbstractBackendStore implements BackendStore {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    @Getter
    protected final BackendConfig config;

    @Override
    public String getBackendName() {
        return config.getName();
    }

    /**
     * Content id for new content: the caller-chosen {@code content_id} metadata entry, or the SHA-256 of the bytes
     */
    protected String resolveContentId(byte[] content, Map<String, String> metadata) {
        String requested = metadata != null ? metadata.get(ContentMetadata.CONTENT_ID) : null;
        if (requested == null || requested.isBlank()) {
            return ContentHashes.sha256Hex(content);
        }
        if (requested.contains("/") || requested.contains("\\") || requested.contains("..")) {
            throw new ValidationException("Invalid content id: " + requested);
        }
        return requested;
    }

    protected static String contentType(Map<String, String> metadata) {
        String type = metadata != null ? metadata.get(ContentMetadata.CONTENT_TYPE) : null;
        return type != null && !type.isBlank() ? type : DEFAULT_CONTENT_TYPE;
    }
}
