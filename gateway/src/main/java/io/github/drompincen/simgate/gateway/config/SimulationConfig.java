package io.github.drompincen.simgate.gateway.config;

import io.github.drompincen.simgate.runtime.cases.CaseCatalog;
import io.github.drompincen.simgate.runtime.config.SimulationProperties;
import io.github.drompincen.simgate.runtime.engine.SimulationEngine;
import io.github.drompincen.simgate.runtime.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Wires the simulation core. The session manager is owned by the application context and
 * releases every remaining model on shutdown.
 */
@Configuration
public class SimulationConfig {

    private static final Logger log = LoggerFactory.getLogger(SimulationConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    SessionManager sessionManager(SimulationProperties properties, Clock clock) {
        log.info("Session manager: capacity {}, timeout {}", properties.maxSessions(), properties.sessionTimeout());
        return new SessionManager(properties.maxSessions(), properties.sessionTimeout(), clock);
    }

    @Bean
    CaseCatalog caseCatalog(SimulationProperties properties) {
        return new CaseCatalog(properties.casesDir());
    }

    @Bean
    SimulationEngine simulationEngine() {
        return loadEngine(ServiceLoader.load(SimulationEngine.class).iterator());
    }

    static SimulationEngine loadEngine(Iterator<SimulationEngine> candidates) {
        if (!candidates.hasNext()) {
            throw new IllegalStateException("No " + SimulationEngine.class.getName()
                    + " implementation found on the class path");
        }
        SimulationEngine engine = candidates.next();
        if (candidates.hasNext()) {
            throw new IllegalStateException("More than one " + SimulationEngine.class.getName()
                    + " implementation found on the class path");
        }
        log.info("Using simulation engine {}", engine.getClass().getName());
        return engine;
    }
}
