package win.ixuni.stratum.server.routing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.exception.MetricsNotFoundException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.BackendMetrics;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Latest metrics snapshot per backend
 * <p>
 * Updates replace the whole snapshot; no history is kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackendMetricsStore {

    private final Clock clock;

    private final Map<String, BackendMetrics> metrics = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Replace the metrics of a backend
     *
     * @return the stored snapshot, stamped with its update time
     */
    public BackendMetrics update(String backendName, BackendMetrics snapshot) {
        validate(backendName, snapshot);
        BackendMetrics stamped = snapshot.toBuilder().updatedAt(Instant.now(clock)).build();

        lock.writeLock().lock();
        try {
            metrics.put(backendName, stamped);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Updated metrics for backend {}: {}", backendName, stamped);
        return stamped;
    }

    public BackendMetrics get(String backendName) {
        return find(backendName).orElseThrow(() -> new MetricsNotFoundException(backendName));
    }

    public Optional<BackendMetrics> find(String backendName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(metrics.get(backendName));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot copy of every backend's metrics
     */
    public Map<String, BackendMetrics> getAll() {
        lock.readLock().lock();
        try {
            return Map.copyOf(metrics);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean remove(String backendName) {
        lock.writeLock().lock();
        try {
            return metrics.remove(backendName) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void validate(String backendName, BackendMetrics m) {
        if (backendName == null || backendName.isBlank()) {
            throw new ValidationException("backend name must not be empty");
        }
        if (m == null) {
            throw new ValidationException("metrics must not be null");
        }
        if (!(m.getSuccessRate() >= 0 && m.getSuccessRate() <= 1)) {
            throw new ValidationException("successRate must be within [0, 1]: " + m.getSuccessRate());
        }
        if (!(m.getUptimePct() >= 0 && m.getUptimePct() <= 100)) {
            throw new ValidationException("uptimePct must be within [0, 100]: " + m.getUptimePct());
        }
        requireNonNegative("avgLatencyMs", m.getAvgLatencyMs());
        requireNonNegative("throughputMbps", m.getThroughputMbps());
        requireNonNegative("storageCostPerGb", m.getStorageCostPerGb());
        requireNonNegative("retrievalCostPerGb", m.getRetrievalCostPerGb());
        requireNonNegative("bandwidthCostPerGb", m.getBandwidthCostPerGb());
        requireNonNegative("totalStoredBytes", m.getTotalStoredBytes());
        requireNonNegative("totalRetrievedBytes", m.getTotalRetrievedBytes());
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new ValidationException(field + " must be a finite non-negative number: " + value);
        }
    }
}
