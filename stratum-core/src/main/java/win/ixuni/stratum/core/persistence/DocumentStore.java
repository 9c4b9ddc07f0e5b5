package win.ixuni.stratum.core.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Key/value document store
 * <p>
 * Documents are grouped into collections and addressed by key. Values are stored as JSON, so anything
 * {@link win.ixuni.stratum.core.util.JsonUtils} can round-trip may be persisted.
 */
public interface DocumentStore {

    /**
     * Insert or replace a document
     */
    void put(String collection, String key, Object document);

    <T> Optional<T> get(String collection, String key, Class<T> type);

    /**
     * List every document of a collection, in no particular order
     */
    <T> List<T> list(String collection, Class<T> type);

    /**
     * @return true if a document was removed
     */
    boolean delete(String collection, String key);
}
