package win.ixuni.stratum.backend.local;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.stratum.core.backend.BackendFactory;
import win.ixuni.stratum.core.backend.BackendStore;
import win.ixuni.stratum.core.config.BackendConfig;

/**
 * 本地文件系统后端工厂
 */
@Slf4j
@Component
public class LocalBackendFactory implements BackendFactory {

    public static final String BACKEND_TYPE = "local";

    @Override
    public String getBackendType() {
        return BACKEND_TYPE;
    }

    @Override
    public BackendStore createBackend(BackendConfig config) {
        log.info("Creating local filesystem backend instance: {}", config.getName());
        return new LocalBackendStore(config);
    }

    @Override
    public String getDescription() {
        return "Local filesystem backend store";
    }
}
