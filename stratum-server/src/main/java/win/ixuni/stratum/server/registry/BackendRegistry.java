package win.ixuni.stratum.server.registry;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.stratum.core.backend.BackendFactory;
import win.ixuni.stratum.core.backend.BackendFactoryLoader;
import win.ixuni.stratum.core.backend.BackendStore;
import win.ixuni.stratum.core.config.BackendConfig;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.exception.BackendNotFoundException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 后端注册表
 * <p>
 * Owns the live backend stores, keyed by their configured name. Routing and migration only ever
 * reach a backend through here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackendRegistry {

    private final StratumProperties properties;
    private final List<BackendFactory> backendFactories;

    private final Map<String, BackendStore> backends = new ConcurrentHashMap<>();

    @PostConstruct
    public void initialize() {
        Map<String, BackendFactory> factories = resolveFactories();
        for (BackendConfig config : properties.getBackends()) {
            if (!config.isEnabled()) {
                log.info("Backend '{}' disabled in configuration", config.getName());
                continue;
            }
            BackendFactory factory = factories.get(config.getType());
            if (factory == null) {
                log.error("Backend '{}' has type '{}', known types are {}",
                        config.getName(), config.getType(), new TreeSet<>(factories.keySet()));
                continue;
            }
            open(factory, config);
        }
        log.info("{} backends ready: {}", backends.size(), getBackendNames());
    }

    /**
     * Spring-provided factories win; ServiceLoader fills in types no bean covers
     */
    private Map<String, BackendFactory> resolveFactories() {
        Map<String, BackendFactory> factories = new HashMap<>();
        backendFactories.forEach(f -> factories.put(f.getBackendType(), f));
        BackendFactoryLoader.load().forEach(f -> factories.putIfAbsent(f.getBackendType(), f));
        return factories;
    }

    private void open(BackendFactory factory, BackendConfig config) {
        try {
            BackendStore backend = factory.createBackend(config);
            backend.initialize().block();
            backends.put(config.getName(), backend);
            log.info("Opened {} backend '{}'", config.getType(), config.getName());
        } catch (RuntimeException e) {
            log.error("Could not open backend '{}': {}", config.getName(), e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        Flux.fromIterable(backends.values())
                .flatMap(backend -> backend.shutdown()
                        .onErrorResume(e -> {
                            log.error("Backend '{}' did not close cleanly: {}",
                                    backend.getBackendName(), e.getMessage());
                            return Mono.empty();
                        }))
                .blockLast();
        log.info("Closed {} backends", backends.size());
    }

    /**
     * Add or replace a backend under its own name; the caller has already initialized it
     */
    public void register(BackendStore backend) {
        backends.put(backend.getBackendName(), backend);
        log.debug("Registered backend '{}' ({})", backend.getBackendName(), backend.getBackendType());
    }

    /**
     * @throws BackendNotFoundException if no backend has this name
     */
    public BackendStore getBackend(String name) {
        return findBackend(name).orElseThrow(() -> new BackendNotFoundException(name));
    }

    public Optional<BackendStore> findBackend(String name) {
        return name != null ? Optional.ofNullable(backends.get(name)) : Optional.empty();
    }

    /**
     * Sorted backend names
     */
    public Set<String> getBackendNames() {
        return new TreeSet<>(backends.keySet());
    }

    public boolean hasBackend(String name) {
        return name != null && backends.containsKey(name);
    }
}
