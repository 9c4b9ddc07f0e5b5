package win.ixuni.stratum.backend.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.stratum.core.backend.BackendFactory;
import win.ixuni.stratum.core.backend.BackendFactoryLoader;
import win.ixuni.stratum.core.config.BackendConfig;
import win.ixuni.stratum.core.exception.ContentNotFoundException;
import win.ixuni.stratum.core.model.ContentFilter;
import win.ixuni.stratum.core.model.ContentItem;
import win.ixuni.stratum.core.model.ContentMetadata;
import win.ixuni.stratum.core.model.StoredContent;
import win.ixuni.stratum.core.util.ContentHashes;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryBackendStoreTest {

    private MemoryBackendStore store;

    @BeforeEach
    void setUp() {
        BackendConfig config = new BackendConfig();
        config.setName("mem-1");
        config.setType("memory");
        store = new MemoryBackendStore(config);
    }

    @Test
    @DisplayName("Content is addressed by its SHA-256 unless an id is supplied")
    void testContentIds() {
        byte[] data = "hello".getBytes(StandardCharsets.UTF_8);

        String hashed = store.add(data, Map.of()).block();
        String named = store.add(data, Map.of(ContentMetadata.CONTENT_ID, "p_hello")).block();

        assertEquals(ContentHashes.sha256Hex(data), hashed);
        assertEquals("p_hello", named);
    }

    @Test
    void testGetReturnsDataAndMetadata() {
        byte[] data = {1, 2, 3};
        String id = store.add(data, Map.of(ContentMetadata.CONTENT_TYPE, "image/png", "owner", "ops")).block();

        StoredContent content = store.get(id).block();

        assertNotNull(content);
        assertArrayEquals(data, content.getData());
        assertEquals("image/png", content.getContentType());
        assertEquals("ops", content.getMetadata().get("owner"));
    }

    @Test
    void testListWithFilterAndDelete() {
        store.add(new byte[1], Map.of(ContentMetadata.CONTENT_ID, "i1")).block();
        store.add(new byte[2], Map.of(ContentMetadata.CONTENT_ID, "i2")).block();
        store.add(new byte[3], Map.of(ContentMetadata.CONTENT_ID, "p_i3")).block();

        List<ContentItem> all = store.list(ContentFilter.all()).collectList().block();
        List<ContentItem> prefixed = store.list(ContentFilter.builder().prefix("p_").build()).collectList().block();

        assertEquals(3, all.size());
        assertEquals(1, prefixed.size());
        assertEquals("p_i3", prefixed.get(0).getId());
        assertEquals(3, prefixed.get(0).getSizeBytes());

        assertTrue(store.delete("i1").block());
        assertFalse(store.delete("i1").block());
        assertThrows(ContentNotFoundException.class, () -> store.get("i1").block());
    }

    @Test
    @DisplayName("Factory is discoverable through ServiceLoader")
    void testSpiDiscovery() {
        List<BackendFactory> factories = BackendFactoryLoader.load();

        assertTrue(factories.stream().anyMatch(f -> MemoryBackendFactory.BACKEND_TYPE.equals(f.getBackendType())));
    }
}
