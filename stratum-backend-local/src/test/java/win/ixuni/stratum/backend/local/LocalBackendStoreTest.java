package win.ixuni.stratum.backend.local;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import win.ixuni.stratum.core.config.BackendConfig;
import win.ixuni.stratum.core.exception.ContentNotFoundException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.ContentFilter;
import win.ixuni.stratum.core.model.ContentItem;
import win.ixuni.stratum.core.model.ContentMetadata;
import win.ixuni.stratum.core.model.StoredContent;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LocalBackendStoreTest {

    @TempDir
    Path tempDir;

    private LocalBackendStore store;

    @BeforeEach
    void setUp() {
        store = newStore();
        store.initialize().block();
    }

    private LocalBackendStore newStore() {
        BackendConfig config = new BackendConfig();
        config.setName("disk");
        config.setType("local");
        config.getProperties().put("base-path", tempDir.toString());
        return new LocalBackendStore(config);
    }

    @Test
    @DisplayName("Content and sidecar survive a new backend instance")
    void testAddAndGetAcrossInstances() {
        byte[] data = "payload".getBytes();
        String id = store.add(data, Map.of(
                ContentMetadata.CONTENT_ID, "doc-1",
                ContentMetadata.CONTENT_TYPE, "application/pdf")).block();

        assertEquals("doc-1", id);
        assertTrue(Files.exists(tempDir.resolve("stratum/meta/doc-1" + SidecarMetadata.SIDECAR_SUFFIX)));

        StoredContent content = newStore().get("doc-1").block();
        assertNotNull(content);
        assertArrayEquals(data, content.getData());
        assertEquals("application/pdf", content.getContentType());
        assertEquals("doc-1", content.getMetadata().get(ContentMetadata.CONTENT_ID));
    }

    @Test
    void testListFilterAndDelete() {
        store.add(new byte[10], Map.of(ContentMetadata.CONTENT_ID, "a", ContentMetadata.CONTENT_TYPE, "image/png")).block();
        store.add(new byte[20], Map.of(ContentMetadata.CONTENT_ID, "b", ContentMetadata.CONTENT_TYPE, "video/mp4")).block();

        List<ContentItem> images = store.list(ContentFilter.builder().type("image/").build()).collectList().block();
        assertEquals(1, images.size());
        assertEquals("a", images.get(0).getId());
        assertEquals(10, images.get(0).getSizeBytes());

        assertTrue(store.delete("a").block());
        assertThrows(ContentNotFoundException.class, () -> store.get("a").block());
        assertEquals(1, store.list(ContentFilter.all()).collectList().block().size());
    }

    @Test
    @DisplayName("路径穿越的 content id 被拒绝")
    void testRejectsPathTraversal() {
        assertThrows(ValidationException.class,
                () -> store.add(new byte[1], Map.of(ContentMetadata.CONTENT_ID, "../escape")).block());
        assertThrows(ValidationException.class, () -> store.get("../escape").block());
    }

    @Test
    @DisplayName("同一内容的并发写入互不干扰")
    void testConcurrentAddsOfSameContent() throws Exception {
        byte[] data = "same bytes".getBytes();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> writes = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                writes.add(() -> store.add(data, Map.of(ContentMetadata.CONTENT_ID, "shared")).block());
            }
            for (Future<String> result : pool.invokeAll(writes)) {
                assertEquals("shared", result.get());
            }
        } finally {
            pool.shutdownNow();
        }

        assertArrayEquals(data, store.get("shared").block().getData());
        assertEquals(1, store.list(ContentFilter.all()).collectList().block().size());
        try (Stream<Path> files = Files.walk(tempDir)) {
            List<Path> leftovers = files.filter(p -> p.getFileName().toString().endsWith(".tmp"))
                    .collect(Collectors.toList());
            assertTrue(leftovers.isEmpty(), "leftover temp files: " + leftovers);
        }
    }
}
