package win.ixuni.stratum.core.backend;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Backend factory loader
 * <p>
 * Uses Java SPI (ServiceLoader) to discover BackendFactory implementations on the classpath.
 * A backend module only needs to declare its factory in META-INF/services.
 */
@Slf4j
public final class BackendFactoryLoader {

    private BackendFactoryLoader() {
    }

    public static List<BackendFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static List<BackendFactory> load(ClassLoader classLoader) {
        ServiceLoader<BackendFactory> loader = ServiceLoader.load(BackendFactory.class, classLoader);
        List<BackendFactory> factories = new ArrayList<>();

        for (BackendFactory factory : loader) {
            factories.add(factory);
            log.info("Discovered backend factory via SPI: {} - {}",
                    factory.getBackendType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No BackendFactory implementations found via SPI");
        }

        return Collections.unmodifiableList(factories);
    }
}
