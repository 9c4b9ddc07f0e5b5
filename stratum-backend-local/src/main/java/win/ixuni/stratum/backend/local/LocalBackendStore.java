package win.ixuni.stratum.backend.local;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.stratum.core.backend.AbstractBackendStore;
import win.ixuni.stratum.core.config.BackendConfig;
import win.ixuni.stratum.core.exception.BackendUnavailableException;
import win.ixuni.stratum.core.exception.ContentNotFoundException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.ContentFilter;
import win.ixuni.stratum.core.model.ContentItem;
import win.ixuni.stratum.core.model.StoredContent;
import win.ixuni.stratum.core.util.JsonUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 本地文件系统存储后端
 * <p>
 * Content lives in a data directory, its metadata in a sidecar JSON file next to it (see {@link SidecarMetadata}).
 * Blocking file I/O runs on the bounded elastic scheduler.
 */
@Slf4j
public class LocalBackendStore extends AbstractBackendStore {

    @Getter
    private final Path basePath;

    private final Path dataRoot;

    private final Path metaRoot;

    public LocalBackendStore(BackendConfig config) {
        super(config);
        this.basePath = Path.of(config.getString("base-path", "/tmp/stratum")).toAbsolutePath().normalize();
        Path root = basePath.resolve(SidecarMetadata.STRATUM_ROOT);
        this.dataRoot = root.resolve(SidecarMetadata.DATA_DIR);
        this.metaRoot = root.resolve(SidecarMetadata.META_DIR);
    }

    @Override
    public String getBackendType() {
        return LocalBackendFactory.BACKEND_TYPE;
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing local filesystem backend: {} at {}", getBackendName(), basePath);
        return Mono.<Void>fromRunnable(() -> {
            try {
                Files.createDirectories(dataRoot);
                Files.createDirectories(metaRoot);
            } catch (IOException e) {
                throw new BackendUnavailableException(getBackendName(),
                        "Failed to initialize local backend at " + basePath, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<String> add(byte[] content, Map<String, String> metadata) {
        return Mono.fromCallable(() -> {
            if (content == null) {
                throw new ValidationException("content must not be null");
            }
            String contentId = resolveContentId(content, metadata);
            Path dataPath = dataRoot.resolve(contentId);
            try {
                Files.createDirectories(dataRoot);
                writeAtomically(dataPath, content);

                SidecarMetadata sidecar = SidecarMetadata.builder()
                        .contentType(contentType(metadata))
                        .metadata(metadata != null ? metadata : Map.of())
                        .size((long) content.length)
                        .createdAt(Instant.now().toEpochMilli())
                        .build();
                writeSidecar(metaPath(contentId), sidecar);
            } catch (IOException e) {
                throw new BackendUnavailableException(getBackendName(), "Failed to write " + contentId, e);
            }
            log.debug("[{}] Stored {} bytes as {}", getBackendName(), content.length, contentId);
            return contentId;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<StoredContent> get(String contentId) {
        return Mono.fromCallable(() -> {
            Path dataPath = dataPath(contentId);
            if (!Files.isRegularFile(dataPath)) {
                throw new ContentNotFoundException(getBackendName(), contentId);
            }
            try {
                SidecarMetadata sidecar = readSidecar(dataPath, metaPath(contentId));
                return StoredContent.builder()
                        .id(contentId)
                        .data(Files.readAllBytes(dataPath))
                        .contentType(sidecar.getContentType())
                        .metadata(sidecar.getMetadata() != null ? sidecar.getMetadata() : Map.of())
                        .build();
            } catch (IOException e) {
                throw new BackendUnavailableException(getBackendName(), "Failed to read " + contentId, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<ContentItem> list(ContentFilter filter) {
        ContentFilter effective = filter != null ? filter : ContentFilter.all();
        return Mono.fromCallable(this::listAll)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable)
                .filter(effective::matches);
    }

    @Override
    public Mono<Boolean> delete(String contentId) {
        return Mono.fromCallable(() -> {
            try {
                boolean deleted = Files.deleteIfExists(dataPath(contentId));
                Files.deleteIfExists(metaPath(contentId));
                return deleted;
            } catch (IOException e) {
                throw new BackendUnavailableException(getBackendName(), "Failed to delete " + contentId, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down local filesystem backend: {}", getBackendName());
        return Mono.empty();
    }

    private List<ContentItem> listAll() {
        if (!Files.isDirectory(dataRoot)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dataRoot)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().endsWith(".tmp"))
                    .map(this::toItem)
                    .sorted(Comparator.comparing(ContentItem::getId))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new BackendUnavailableException(getBackendName(), "Failed to list " + dataRoot, e);
        }
    }

    private ContentItem toItem(Path dataPath) {
        String contentId = dataPath.getFileName().toString();
        try {
            SidecarMetadata sidecar = readSidecar(dataPath, metaPath(contentId));
            return ContentItem.builder()
                    .id(contentId)
                    .sizeBytes(sidecar.getSize() != null ? sidecar.getSize() : Files.size(dataPath))
                    .contentType(sidecar.getContentType())
                    .createdAt(sidecar.getCreatedAtInstant())
                    .metadata(sidecar.getMetadata() != null ? sidecar.getMetadata() : Map.of())
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Path dataPath(String contentId) {
        return dataRoot.resolve(safeId(contentId));
    }

    private Path metaPath(String contentId) {
        return metaRoot.resolve(safeId(contentId) + SidecarMetadata.SIDECAR_SUFFIX);
    }

    private String safeId(String contentId) {
        if (contentId == null || contentId.isBlank() || contentId.contains("/")
                || contentId.contains("\\") || contentId.contains("..")) {
            throw new ValidationException("Invalid content id: " + contentId);
        }
        return contentId;
    }

    /**
     * 读取 Sidecar 元数据（带 fallback）
     * <p>
     * Falls back to file attributes when the sidecar is missing.
     */
    private static SidecarMetadata readSidecar(Path dataPath, Path metaPath) throws IOException {
        if (Files.exists(metaPath)) {
            return JsonUtils.fromJsonBytes(Files.readAllBytes(metaPath), SidecarMetadata.class);
        }
        BasicFileAttributes attrs = Files.readAttributes(dataPath, BasicFileAttributes.class);
        return SidecarMetadata.builder()
                .size(attrs.size())
                .createdAt(attrs.lastModifiedTime().toMillis())
                .contentType(DEFAULT_CONTENT_TYPE)
                .build();
    }

    private static void writeSidecar(Path metaPath, SidecarMetadata sidecar) throws IOException {
        Files.createDirectories(metaPath.getParent());
        writeAtomically(metaPath, JsonUtils.toJsonBytes(sidecar));
    }

    /**
     * Write through a uniquely named temp file next to the target, then move it into place
     */
    private static void writeAtomically(Path target, byte[] data) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName() + ".", ".tmp");
        try {
            Files.write(tmp, data);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
