package win.ixuni.stratum.server.migration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.stratum.backend.memory.MemoryBackendStore;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.exception.ContentNotFoundException;
import win.ixuni.stratum.core.model.ContentMetadata;
import win.ixuni.stratum.core.model.MigrationStatus;
import win.ixuni.stratum.core.model.MigrationTask;
import win.ixuni.stratum.core.model.StoredContent;
import win.ixuni.stratum.core.persistence.InMemoryDocumentStore;
import win.ixuni.stratum.server.registry.BackendRegistry;
import win.ixuni.stratum.server.support.FlakyBackendStore;
import win.ixuni.stratum.server.support.MutableClock;
import win.ixuni.stratum.server.support.TestBackends;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MigrationExecutorTest {

    private MemoryBackendStore hot;
    private MemoryBackendStore cold;
    private BackendRegistry registry;
    private MigrationTaskStore taskStore;
    private StratumProperties properties;
    private MigrationExecutor executor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        properties = new StratumProperties();
        properties.getMigration().setBaseDelay(Duration.ZERO);
        properties.getMigration().setMaxRetries(2);
        properties.getMigration().setPollInterval(Duration.ofMillis(20));
        properties.getMigration().setWorkers(2);

        hot = TestBackends.memory("hot");
        cold = TestBackends.memory("cold");
        registry = TestBackends.emptyRegistry();
        registry.register(hot);
        registry.register(cold);

        taskStore = new MigrationTaskStore(new InMemoryDocumentStore(), clock);
        taskStore.initialize();
        executor = new MigrationExecutor(taskStore, registry, properties, clock);
    }

    @AfterEach
    void tearDown() {
        executor.stop();
    }

    private void put(String id, String text) {
        hot.add(text.getBytes(StandardCharsets.UTF_8), Map.of(
                ContentMetadata.CONTENT_ID, id,
                ContentMetadata.CONTENT_TYPE, "text/plain",
                ContentMetadata.FILENAME, id + ".txt")).block();
    }

    private MigrationTask queue(String id, boolean deleteSource) {
        return taskStore.create(MigrationTask.builder()
                .sourceBackend("hot")
                .destinationBackend("cold")
                .contentId(id)
                .deleteSource(deleteSource)
                .build());
    }

    @Test
    @DisplayName("A successful run copies content and records where it came from")
    void testRunOnceCopiesContent() {
        put("doc1", "hello world");
        MigrationTask task = queue("doc1", false);

        assertTrue(executor.runOnce());

        MigrationTask done = taskStore.get(task.getId());
        assertEquals(MigrationStatus.COMPLETED, done.getStatus());
        assertEquals(11, done.getBytesTransferred());
        assertNotNull(done.getCompletedAt());

        StoredContent copy = cold.get("doc1").block();
        assertEquals("hello world", new String(copy.getData(), StandardCharsets.UTF_8));
        assertEquals("text/plain", copy.getContentType());
        assertEquals("doc1.txt", copy.getMetadata().get(ContentMetadata.FILENAME));
        assertEquals("hot", copy.getMetadata().get(ContentMetadata.MIGRATED_FROM));
        assertEquals(task.getId(), copy.getMetadata().get(ContentMetadata.MIGRATION_TASK));
        assertNotNull(copy.getMetadata().get(ContentMetadata.MIGRATION_TIME));
        assertNotNull(hot.get("doc1").block());
    }

    @Test
    void testRunOnceWithEmptyQueue() {
        assertFalse(executor.runOnce());
    }

    @Test
    @DisplayName("删除源文件选项在完成后移除源内容")
    void testDeleteSourceAfterCompletion() {
        put("doc1", "move me");
        queue("doc1", true);

        executor.runOnce();

        assertNotNull(cold.get("doc1").block());
        assertThrows(ContentNotFoundException.class, () -> hot.get("doc1").block());
    }

    @Test
    @DisplayName("Transient failures are retried, then the task fails")
    void testRetryThenFail() {
        registry.register(new FlakyBackendStore(TestBackends.memory("cold")).failAdds(10));
        put("doc1", "data");
        MigrationTask task = queue("doc1", false);

        executor.runOnce();
        MigrationTask afterFirst = taskStore.get(task.getId());
        assertEquals(MigrationStatus.QUEUED, afterFirst.getStatus());
        assertEquals(1, afterFirst.getRetryCount());
        assertNotNull(afterFirst.getError());

        executor.runOnce();
        assertEquals(2, taskStore.get(task.getId()).getRetryCount());

        executor.runOnce();
        MigrationTask failed = taskStore.get(task.getId());
        assertEquals(MigrationStatus.FAILED, failed.getStatus());
        assertEquals(2, failed.getRetryCount());
        assertNotNull(failed.getCompletedAt());
        assertFalse(executor.runOnce());
    }

    @Test
    void testRecoversAfterOneFailedRead() {
        registry.register(new FlakyBackendStore(hot).failGets(1));
        put("doc1", "data");
        MigrationTask task = queue("doc1", false);

        executor.runOnce();
        executor.runOnce();

        MigrationTask done = taskStore.get(task.getId());
        assertEquals(MigrationStatus.COMPLETED, done.getStatus());
        assertEquals(1, done.getRetryCount());
    }

    @Test
    @DisplayName("A task cancelled while its content is read is never written")
    void testCancelDuringTransferSkipsWrite() {
        put("doc1", "data");
        MigrationTask task = queue("doc1", false);
        FlakyBackendStore destination = new FlakyBackendStore(cold);
        registry.register(destination);
        registry.register(new FlakyBackendStore(hot).beforeGet(() -> taskStore.cancel(task.getId())));

        assertTrue(executor.runOnce());

        MigrationTask cancelled = taskStore.get(task.getId());
        assertEquals(MigrationStatus.CANCELLED, cancelled.getStatus());
        assertEquals(0, cancelled.getRetryCount());
        assertEquals(0, destination.getAddCalls());
        assertThrows(ContentNotFoundException.class, () -> cold.get("doc1").block());
        assertNotNull(hot.get("doc1").block());
    }

    @Test
    @DisplayName("重试间隔按基础延迟翻倍")
    void testRetryBackoffDoubles() {
        Instant start = Instant.parse("2024-05-01T00:00:00Z");
        MutableClock clock = new MutableClock(start);
        properties.getMigration().setBaseDelay(Duration.ofSeconds(10));
        properties.getMigration().setMaxRetries(3);
        MigrationTaskStore store = new MigrationTaskStore(new InMemoryDocumentStore(), clock);
        store.initialize();
        MigrationExecutor timed = new MigrationExecutor(store, registry, properties, clock);
        registry.register(new FlakyBackendStore(TestBackends.memory("cold")).failAdds(10));
        put("doc1", "data");
        MigrationTask task = store.create(MigrationTask.builder()
                .sourceBackend("hot")
                .destinationBackend("cold")
                .contentId("doc1")
                .build());

        assertTrue(timed.runOnce());
        assertEquals(start.plusSeconds(10), store.get(task.getId()).getNotBefore());
        clock.advance(Duration.ofSeconds(9));
        assertFalse(timed.runOnce());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(timed.runOnce());
        assertEquals(start.plusSeconds(10 + 20), store.get(task.getId()).getNotBefore());

        clock.advance(Duration.ofSeconds(20));
        assertTrue(timed.runOnce());
        assertEquals(start.plusSeconds(30 + 40), store.get(task.getId()).getNotBefore());
        assertEquals(3, store.get(task.getId()).getRetryCount());

        clock.advance(Duration.ofSeconds(40));
        assertTrue(timed.runOnce());
        assertEquals(MigrationStatus.FAILED, store.get(task.getId()).getStatus());
    }

    @Test
    void testMissingContentFailsAfterRetries() {
        MigrationTask task = queue("ghost", false);

        for (int i = 0; i < 3; i++) {
            executor.runOnce();
        }

        assertEquals(MigrationStatus.FAILED, taskStore.get(task.getId()).getStatus());
    }

    @Test
    @DisplayName("An unknown backend fails the task without retrying")
    void testUnknownBackendFailsImmediately() {
        MigrationTask task = taskStore.create(MigrationTask.builder()
                .sourceBackend("hot")
                .destinationBackend("mars")
                .contentId("doc1")
                .build());

        executor.runOnce();

        MigrationTask failed = taskStore.get(task.getId());
        assertEquals(MigrationStatus.FAILED, failed.getStatus());
        assertEquals(0, failed.getRetryCount());
        assertTrue(failed.getError().contains("mars"));
    }

    @Test
    void testWorkersDrainQueue() throws InterruptedException {
        for (int i = 0; i < 5; i++) {
            put("doc" + i, "payload " + i);
        }
        executor.start();
        assertTrue(executor.isRunning());
        for (int i = 0; i < 5; i++) {
            queue("doc" + i, false);
        }

        long deadline = System.currentTimeMillis() + 5_000;
        while (taskStore.summary().count(MigrationStatus.COMPLETED) < 5 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertEquals(5, taskStore.summary().count(MigrationStatus.COMPLETED));
        executor.stop();
        assertFalse(executor.isRunning());
    }
}
