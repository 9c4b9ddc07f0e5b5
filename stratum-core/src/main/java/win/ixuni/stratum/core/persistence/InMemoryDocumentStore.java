package win.ixuni.stratum.core.persistence;

import win.ixuni.stratum.core.util.JsonUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-process document store
 * <p>
 * Keeps serialized JSON rather than object references so callers never share mutable state with the store.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Map<String, String>> collections = new ConcurrentHashMap<>();

    @Override
    public void put(String collection, String key, Object document) {
        collections.computeIfAbsent(collection, c -> new ConcurrentHashMap<>())
                .put(key, JsonUtils.toJson(document));
    }

    @Override
    public <T> Optional<T> get(String collection, String key, Class<T> type) {
        Map<String, String> documents = collections.get(collection);
        if (documents == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(key)).map(json -> JsonUtils.fromJson(json, type));
    }

    @Override
    public <T> List<T> list(String collection, Class<T> type) {
        Map<String, String> documents = collections.get(collection);
        if (documents == null) {
            return List.of();
        }
        return documents.values().stream()
                .map(json -> JsonUtils.fromJson(json, type))
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String collection, String key) {
        Map<String, String> documents = collections.get(collection);
        return documents != null && documents.remove(key) != null;
    }
}
