package win.ixuni.stratum.core.backend;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.stratum.core.model.ContentFilter;
import win.ixuni.stratum.core.model.ContentItem;
import win.ixuni.stratum.core.model.StoredContent;

import java.util.Map;

/**
 * Backend store interface
 * <p>
 * A named storage backend the router can place content on and the migration engine can move content
 * between. Implementations signal failures through {@code Mono.error}; an unknown content id is a
 * {@link win.ixuni.stratum.core.exception.ContentNotFoundException}.
 */
public interface BackendStore {

    // ==================== Backend Metadata ====================

    /**
     * Get the backend instance name
     *
     * @return instance name (as specified in configuration)
     */
    String getBackendName();

    /**
     * Get the backend type identifier
     *
     * @return backend type (e.g. "memory", "local")
     */
    String getBackendType();

    // ==================== Content Operations ====================

    /**
     * Store content
     *
     * @param content  content bytes
     * @param metadata content metadata
     * @return id assigned to the content
     */
    Mono<String> add(byte[] content, Map<String, String> metadata);

    /**
     * Fetch content and its metadata
     *
     * @param contentId content id
     * @return stored content
     */
    Mono<StoredContent> get(String contentId);

    /**
     * List content matching a filter
     *
     * @param filter content filter
     * @return matching items
     */
    Flux<ContentItem> list(ContentFilter filter);

    /**
     * Delete content
     *
     * @param contentId content id
     * @return true if something was deleted
     */
    Mono<Boolean> delete(String contentId);

    // ==================== Lifecycle ====================

    /**
     * Initialize the backend
     *
     * @return completion signal
     */
    default Mono<Void> initialize() {
        return Mono.empty();
    }

    /**
     * Shut down the backend and release resources
     *
     * @return completion signal
     */
    default Mono<Void> shutdown() {
        return Mono.empty();
    }
}
