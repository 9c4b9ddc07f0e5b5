package win.ixuni.stratum.backend.memory;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.stratum.core.backend.AbstractBackendStore;
import win.ixuni.stratum.core.config.BackendConfig;
import win.ixuni.stratum.core.exception.ContentNotFoundException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.ContentFilter;
import win.ixuni.stratum.core.model.ContentItem;
import win.ixuni.stratum.core.model.StoredContent;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存存储后端
 * <p>
 * Content-addressed unless the caller supplies a {@code content_id}; storing the same id twice overwrites.
 */
@Slf4j
public class MemoryBackendStore extends AbstractBackendStore {

    /**
     * 内容存储：contentId -> Entry
     */
    private final Map<String, Entry> contents = new ConcurrentHashMap<>();

    public MemoryBackendStore(BackendConfig config) {
        super(config);
    }

    @Override
    public String getBackendType() {
        return MemoryBackendFactory.BACKEND_TYPE;
    }

    @Override
    public Mono<String> add(byte[] content, Map<String, String> metadata) {
        return Mono.fromCallable(() -> {
            if (content == null) {
                throw new ValidationException("content must not be null");
            }
            String contentId = resolveContentId(content, metadata);
            Entry entry = Entry.builder()
                    .data(content.clone())
                    .contentType(contentType(metadata))
                    .metadata(metadata != null ? Collections.unmodifiableMap(new HashMap<>(metadata)) : Map.of())
                    .createdAt(Instant.now())
                    .build();
            contents.put(contentId, entry);
            log.debug("[{}] Stored {} bytes as {}", getBackendName(), content.length, contentId);
            return contentId;
        });
    }

    @Override
    public Mono<StoredContent> get(String contentId) {
        return Mono.defer(() -> {
            Entry entry = contents.get(contentId);
            if (entry == null) {
                return Mono.error(new ContentNotFoundException(getBackendName(), contentId));
            }
            return Mono.just(StoredContent.builder()
                    .id(contentId)
                    .data(entry.getData().clone())
                    .contentType(entry.getContentType())
                    .metadata(entry.getMetadata())
                    .build());
        });
    }

    @Override
    public Flux<ContentItem> list(ContentFilter filter) {
        ContentFilter effective = filter != null ? filter : ContentFilter.all();
        return Flux.defer(() -> Flux.fromIterable(contents.entrySet()))
                .map(e -> ContentItem.builder()
                        .id(e.getKey())
                        .sizeBytes(e.getValue().getData().length)
                        .contentType(e.getValue().getContentType())
                        .createdAt(e.getValue().getCreatedAt())
                        .metadata(e.getValue().getMetadata())
                        .build())
                .filter(effective::matches)
                .sort(Comparator.comparing(ContentItem::getId));
    }

    @Override
    public Mono<Boolean> delete(String contentId) {
        return Mono.fromCallable(() -> contents.remove(contentId) != null);
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down memory backend: {}", getBackendName());
        return Mono.fromRunnable(contents::clear);
    }

    @Getter
    @Builder
    static class Entry {
        private final byte[] data;
        private final String contentType;
        private final Map<String, String> metadata;
        private final Instant createdAt;
    }
}
