package io.github.drompincen.simgate.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Deployment-level settings, bound from {@code simgate.*}.
 *
 * @param maxSessions       most sessions kept alive at once
 * @param sessionTimeout    idle time after which a session expires
 * @param casesDir          directory searched by the case catalog
 * @param defaultTdsEndTime end time used when a time-domain run does not name one
 * @param maxResultPoints   default bound on samples returned per time-domain query
 */
@ConfigurationProperties(prefix = "simgate")
public record SimulationProperties(
        @DefaultValue("simgate") String name,
        @DefaultValue("0.1.0") String version,
        @DefaultValue("100") int maxSessions,
        @DefaultValue("PT1H") Duration sessionTimeout,
        @DefaultValue("cases") Path casesDir,
        @DefaultValue("20.0") double defaultTdsEndTime,
        @DefaultValue("10000") int maxResultPoints
) {
    public SimulationProperties {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("simgate.max-sessions must be >= 1");
        }
        if (maxResultPoints < 1) {
            throw new IllegalArgumentException("simgate.max-result-points must be >= 1");
        }
    }

    public static SimulationProperties defaults() {
        return new SimulationProperties("simgate", "0.1.0", 100, Duration.ofHours(1),
                Path.of("cases"), 20.0, 10_000);
    }
}
