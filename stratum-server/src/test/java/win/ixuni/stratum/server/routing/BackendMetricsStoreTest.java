package win.ixuni.stratum.server.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.stratum.core.exception.MetricsNotFoundException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.BackendMetrics;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class BackendMetricsStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final BackendMetricsStore store = new BackendMetricsStore(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void testUpdateReplacesWholeSnapshot() {
        store.update("s3", BackendMetrics.builder().avgLatencyMs(80).region("us-east-1").build());
        BackendMetrics second = store.update("s3", BackendMetrics.builder().avgLatencyMs(20).build());

        assertEquals(NOW, second.getUpdatedAt());
        assertEquals(20, store.get("s3").getAvgLatencyMs());
        assertNull(store.get("s3").getRegion());
    }

    @Test
    void testRejectsOutOfRangeValues() {
        assertThrows(ValidationException.class,
                () -> store.update("s3", BackendMetrics.builder().successRate(1.5).build()));
        assertThrows(ValidationException.class,
                () -> store.update("s3", BackendMetrics.builder().uptimePct(101).build()));
        assertThrows(ValidationException.class,
                () -> store.update("s3", BackendMetrics.builder().avgLatencyMs(-1).build()));
        assertThrows(ValidationException.class,
                () -> store.update(" ", BackendMetrics.builder().build()));

        assertTrue(store.getAll().isEmpty());
    }

    @Test
    @DisplayName("非有限数值被拒绝")
    void testRejectsNonFiniteValues() {
        assertThrows(ValidationException.class,
                () -> store.update("idle", BackendMetrics.builder().successRate(Double.NaN).build()));
        assertThrows(ValidationException.class,
                () -> store.update("idle", BackendMetrics.builder().uptimePct(Double.NaN).build()));
        assertThrows(ValidationException.class, () -> store.update("idle",
                BackendMetrics.builder().storageCostPerGb(Double.POSITIVE_INFINITY).build()));
        assertThrows(ValidationException.class, () -> store.update("idle",
                BackendMetrics.builder().throughputMbps(Double.NaN).build()));

        assertTrue(store.find("idle").isEmpty());
    }

    @Test
    void testUnknownBackend() {
        assertThrows(MetricsNotFoundException.class, () -> store.get("nope"));
        assertTrue(store.find("nope").isEmpty());
        assertFalse(store.remove("nope"));
    }
}
