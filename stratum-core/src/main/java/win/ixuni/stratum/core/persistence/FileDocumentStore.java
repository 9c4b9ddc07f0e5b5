package win.ixuni.stratum.core.persistence;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.stratum.core.util.JsonUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-based document store
 * <p>
 * Directory layout:
 *
 * <pre>
 *   basePath/
 *     collection/
 *       url-encoded-key.json
 * </pre>
 * <p>
 * Writes go to a temp file first and are moved into place, so a crash never leaves a half-written document.
 */
@Slf4j
public class FileDocumentStore implements DocumentStore {

    private static final String SUFFIX = ".json";
    private static final String TMP_SUFFIX = ".tmp";

    private final Path basePath;

    public FileDocumentStore(String basePath) {
        this(Paths.get(basePath));
    }

    public FileDocumentStore(Path basePath) {
        this.basePath = basePath.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create document store directory " + this.basePath, e);
        }
        log.info("File document store at {}", this.basePath);
    }

    @Override
    public synchronized void put(String collection, String key, Object document) {
        Path target = documentPath(collection, key);
        Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        try {
            Files.createDirectories(target.getParent());
            Files.write(tmp, JsonUtils.toJsonBytes(document));
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write document " + collection + "/" + key, e);
        }
    }

    @Override
    public <T> Optional<T> get(String collection, String key, Class<T> type) {
        Path path = documentPath(collection, key);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(read(path, type));
    }

    @Override
    public <T> List<T> list(String collection, Class<T> type) {
        Path dir = basePath.resolve(encode(collection));
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<T> documents = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .forEach(p -> documents.add(read(p, type)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list collection " + collection, e);
        }
        return documents;
    }

    @Override
    public synchronized boolean delete(String collection, String key) {
        try {
            return Files.deleteIfExists(documentPath(collection, key));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete document " + collection + "/" + key, e);
        }
    }

    private <T> T read(Path path, Class<T> type) {
        try {
            return JsonUtils.fromJsonBytes(Files.readAllBytes(path), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read document " + path, e);
        }
    }

    private Path documentPath(String collection, String key) {
        return basePath.resolve(encode(collection)).resolve(encode(key) + SUFFIX);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
