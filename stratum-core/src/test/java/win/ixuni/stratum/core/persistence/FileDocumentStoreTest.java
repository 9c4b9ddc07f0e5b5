package win.ixuni.stratum.core.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import win.ixuni.stratum.core.model.ContentFilter;
import win.ixuni.stratum.core.model.MigrationPolicy;
import win.ixuni.stratum.core.model.MigrationStatus;
import win.ixuni.stratum.core.model.MigrationTask;
import win.ixuni.stratum.core.model.Priority;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileDocumentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Documents survive a new store instance on the same directory")
    void testPersistAcrossInstances() {
        MigrationTask task = MigrationTask.builder()
                .id("task/1")
                .sourceBackend("hot")
                .destinationBackend("cold")
                .contentId("abc")
                .status(MigrationStatus.IN_PROGRESS)
                .priority(Priority.HIGH)
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        new FileDocumentStore(tempDir).put("migration_tasks", task.getId(), task);

        DocumentStore reopened = new FileDocumentStore(tempDir);
        MigrationTask loaded = reopened.get("migration_tasks", "task/1", MigrationTask.class).orElseThrow();
        assertEquals(task, loaded);
        assertEquals(List.of(task), reopened.list("migration_tasks", MigrationTask.class));
    }

    @Test
    void testPolicyWithFilter() {
        DocumentStore store = new FileDocumentStore(tempDir);
        MigrationPolicy policy = MigrationPolicy.builder()
                .name("archive")
                .sourceBackend("hot")
                .destinationBackend("cold")
                .contentFilter(ContentFilter.builder().prefix("p_").maxSizeBytes(1024L).build())
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        store.put("migration_policies", policy.getName(), policy);

        assertEquals(policy, store.get("migration_policies", "archive", MigrationPolicy.class).orElseThrow());
    }

    @Test
    void testDeleteAndMissing() {
        DocumentStore store = new FileDocumentStore(tempDir);
        store.put("c", "k", "value");

        assertTrue(store.delete("c", "k"));
        assertFalse(store.delete("c", "k"));
        assertTrue(store.get("c", "k", String.class).isEmpty());
        assertTrue(store.list("missing", String.class).isEmpty());
    }

    @Test
    void testInMemoryStoreReturnsCopies() {
        DocumentStore store = new InMemoryDocumentStore();
        store.put("c", "k", List.of("a"));

        assertEquals(List.of("a"), store.get("c", "k", List.class).orElseThrow());
        assertEquals(1, store.list("c", List.class).size());
        assertTrue(store.delete("c", "k"));
        assertTrue(store.list("c", List.class).isEmpty());
    }
}
