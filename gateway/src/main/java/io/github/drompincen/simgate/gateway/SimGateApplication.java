package io.github.drompincen.simgate.gateway;

import io.github.drompincen.simgate.runtime.config.SimulationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.simgate")
@EnableConfigurationProperties(SimulationProperties.class)
public class SimGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(SimGateApplication.class, args);
    }
}
