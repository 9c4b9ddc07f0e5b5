package win.ixuni.stratum.core.backend;

import win.ixuni.stratum.core.config.BackendConfig;

/**
 * Backend factory interface
 * <p>
 * Each backend type provides a factory implementation to create backend instances from configuration.
 * Several instances of the same type may coexist under different names.
 */
public interface BackendFactory {

    /**
     * Get the backend type supported by this factory
     *
     * @return backend type identifier (e.g. "memory", "local")
     */
    String getBackendType();

    /**
     * Create a backend instance from configuration
     *
     * @param config backend configuration
     * @return backend instance
     */
    BackendStore createBackend(BackendConfig config);

    default String getDescription() {
        return getBackendType() + " backend store";
    }
}
