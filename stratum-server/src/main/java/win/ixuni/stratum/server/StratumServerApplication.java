package win.ixuni.stratum.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import win.ixuni.stratum.core.config.StratumProperties;

/**
 * Stratum 服务启动类
 * <p>
 * Scans every module under win.ixuni.stratum so backend factories are picked up as beans.
 */
@SpringBootApplication(scanBasePackages = "win.ixuni.stratum")
@EnableConfigurationProperties(StratumProperties.class)
@EnableScheduling
public class StratumServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StratumServerApplication.class, args);
    }
}
