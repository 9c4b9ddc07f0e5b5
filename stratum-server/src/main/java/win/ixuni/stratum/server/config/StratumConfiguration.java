package win.ixuni.stratum.server.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import win.ixuni.stratum.core.config.StratumProperties;
import win.ixuni.stratum.core.exception.ValidationException;
import win.ixuni.stratum.core.persistence.DocumentStore;
import win.ixuni.stratum.core.persistence.FileDocumentStore;
import win.ixuni.stratum.core.persistence.InMemoryDocumentStore;

import java.time.Clock;

/**
 * Infrastructure beans
 */
@Slf4j
@Configuration
public class StratumConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DocumentStore documentStore(StratumProperties properties) {
        StratumProperties.PersistenceConfig persistence = properties.getPersistence();
        switch (persistence.getType()) {
            case "memory":
                log.info("Using in-memory document store, state is lost on restart");
                return new InMemoryDocumentStore();
            case "file":
                return new FileDocumentStore(persistence.getPath());
            default:
                throw new ValidationException("Unknown persistence type: " + persistence.getType());
        }
    }
}
