package win.ixuni.stratum.server.metrics;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.exception.InvalidStateException;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.model.BackendMetrics;
import win.ixuni.stratum.server.routing.BackendMetricsStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Metrics collection service
 * <p>
 * Pulls snapshots from every {@link BackendMetricsSource} into the metrics store, at startup, on a fixed
 * delay and on demand. Scheduled runs write a snapshot only when it differs from what its source published
 * last time, so a manual update sticks until the source itself reports a change. On-demand runs write all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsCollectionService {

    private final List<BackendMetricsSource> sources;
    private final BackendMetricsStore metricsStore;
    private final StratumProperties properties;

    /**
     * Last snapshot published per source and backend: "source/backend" -> metrics
     */
    private final Map<String, BackendMetrics> lastPublished = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);

    @PostConstruct
    public void initialCollect() {
        collectIfIdle();
    }

    @Scheduled(fixedDelayString = "${stratum.metrics.collect-interval-ms:60000}",
            initialDelayString = "${stratum.metrics.collect-interval-ms:60000}")
    public void scheduledCollect() {
        if (!properties.getMetrics().isCollectEnabled()) {
            log.debug("Metrics collection is disabled, skipping scheduled run");
            return;
        }
        collectIfIdle();
    }

    /**
     * Collect from every source now, overwriting manual updates
     *
     * @return snapshots written to the store in this run, keyed by backend
     * @throws InvalidStateException if another collection is running
     */
    public Map<String, BackendMetrics> collect() {
        if (!running.compareAndSet(false, true)) {
            throw new InvalidStateException("Metrics collection is already running");
        }
        try {
            return publish(true);
        } finally {
            running.set(false);
        }
    }

    private void collectIfIdle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Metrics collection is already running, skipping this run");
            return;
        }
        try {
            publish(false);
        } finally {
            running.set(false);
        }
    }

    private Map<String, BackendMetrics> publish(boolean force) {
        Map<String, BackendMetrics> written = new LinkedHashMap<>();
        for (BackendMetricsSource source : sources) {
            Map<String, BackendMetrics> snapshots;
            try {
                snapshots = source.collect();
            } catch (RuntimeException e) {
                log.error("Metrics source '{}' failed: {}", source.getName(), e.getMessage(), e);
                continue;
            }
            snapshots.forEach((backend, snapshot) -> {
                String key = source.getName() + "/" + backend;
                if (!force && Objects.equals(lastPublished.get(key), snapshot)) {
                    return;
                }
                try {
                    written.put(backend, metricsStore.update(backend, snapshot));
                    lastPublished.put(key, snapshot);
                } catch (ValidationException e) {
                    log.warn("Rejected metrics for backend '{}' from source '{}': {}",
                            backend, source.getName(), e.getMessage());
                }
            });
        }
        if (!written.isEmpty()) {
            log.info("Collected metrics for {} backends", written.size());
        }
        return written;
    }
}
