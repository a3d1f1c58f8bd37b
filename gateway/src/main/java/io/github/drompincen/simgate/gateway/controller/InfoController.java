package io.github.drompincen.simgate.gateway.controller;

import io.github.drompincen.simgate.protocol.api.ServerInfoDto;
import io.github.drompincen.simgate.runtime.cases.CaseCatalog;
import io.github.drompincen.simgate.runtime.config.SimulationProperties;
import io.github.drompincen.simgate.runtime.tools.ToolRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/info")
public class InfoController {

    private final SimulationProperties properties;
    private final CaseCatalog caseCatalog;
    private final ToolRegistry toolRegistry;

    public InfoController(SimulationProperties properties, CaseCatalog caseCatalog, ToolRegistry toolRegistry) {
        this.properties = properties;
        this.caseCatalog = caseCatalog;
        this.toolRegistry = toolRegistry;
    }

    @GetMapping
    public ServerInfoDto info() {
        return new ServerInfoDto(
                properties.name(),
                properties.version(),
                properties.maxSessions(),
                properties.sessionTimeout().toSeconds(),
                caseCatalog.root().toString(),
                toolRegistry.names());
    }
}
