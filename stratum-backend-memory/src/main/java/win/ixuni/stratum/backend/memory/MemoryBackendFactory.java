package win.ixuni.stratum.backend.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.backend.BackendFactory;
import win.ixuni.stratum.core.backend.BackendStore;
import win.ixuni.stratum.core.config.BackendConfig;

/**
 * In-memory backend factory
 */
@Slf4j
@Component
public class MemoryBackendFactory implements BackendFactory {

    public static final String BACKEND_TYPE = "memory";

    @Override
    public String getBackendType() {
        return BACKEND_TYPE;
    }

    @Override
    public BackendStore createBackend(BackendConfig config) {
        log.info("Creating memory backend instance: {}", config.getName());
        return new MemoryBackendStore(config);
    }

    @Override
    public String getDescription() {
        return "In-memory backend store for development and testing";
    }
}
