package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ErrorKind;
import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.cases.CaseCatalog;
import io.github.drompincen.simgate.runtime.engine.EngineException;
import io.github.drompincen.simgate.runtime.engine.LoadOptions;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import io.github.drompincen.simgate.runtime.engine.SimulationEngine;
import io.github.drompincen.simgate.runtime.result.ResultSerializer;
import io.github.drompincen.simgate.runtime.session.SessionManager;
import io.github.drompincen.simgate.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

public class LoadCaseTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Logger log = LoggerFactory.getLogger(LoadCaseTool.class);

    private SimulationEngine simulationEngine;
    private CaseCatalog caseCatalog;
    private SessionManager sessionManager;
    private ResultSerializer resultSerializer = new ResultSerializer();

    @Override public String name() { return "load_case"; }

    @Override public String description() {
        return "Load a case file and open a new simulation session. 'casePath' is either relative to the " +
               "built-in cases directory (see list_available_cases) or a path on the server. Returns the " +
               "sessionId to pass to every other tool.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("casePath").put("type", "string").put("description", "Case file, e.g. ieee14/ieee14.xlsx");
        props.putObject("setup").put("type", "boolean").put("description", "Set the system up after loading (default true)");
        props.putObject("noOutput").put("type", "boolean").put("description", "Suppress output files (default true)");
        schema.putArray("required").add("casePath");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "object"); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.SESSION_LIFECYCLE); }

    public void setSimulationEngine(SimulationEngine simulationEngine) {
        this.simulationEngine = simulationEngine;
    }

    public void setCaseCatalog(CaseCatalog caseCatalog) {
        this.caseCatalog = caseCatalog;
    }

    public void setSessionManager(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    public void setResultSerializer(ResultSerializer resultSerializer) {
        this.resultSerializer = resultSerializer;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (simulationEngine == null || caseCatalog == null || sessionManager == null) {
            return ToolResult.failure("Simulation engine not available");
        }
        String casePath;
        boolean setup;
        boolean noOutput;
        try {
            casePath = ToolInputs.requiredText(input, "casePath");
            setup = ToolInputs.optionalBoolean(input, "setup", true);
            noOutput = ToolInputs.optionalBoolean(input, "noOutput", true);
        } catch (InvalidToolInputException e) {
            return ToolResult.failure(ErrorKind.INVALID_INPUT, e.getMessage());
        }

        Optional<Path> resolved = caseCatalog.resolve(casePath);
        if (resolved.isEmpty()) {
            return ToolResult.failure(ErrorKind.NOT_FOUND, "Case file not found: " + casePath);
        }

        stream.progress(10, "Loading " + casePath);
        ModelHandle model;
        try {
            model = simulationEngine.load(resolved.get(), new LoadOptions(setup, noOutput));
        } catch (EngineException | RuntimeException e) {
            log.warn("Failed to load case {} (caller {}): {}", casePath, ctx.callerId(), e.getMessage(), e);
            return ToolResult.failure("Error loading case: " + e.getMessage());
        }
        if (model == null) {
            return ToolResult.failure("Failed to load case: " + casePath
                    + ". The file may be corrupted or in an unsupported format.");
        }

        // Summarise before registering so a failure here never leaves a session behind.
        ObjectNode systemInfo;
        try {
            systemInfo = resultSerializer.systemInfo(model);
        } catch (RuntimeException e) {
            log.warn("Failed to summarise case {} (caller {}): {}", casePath, ctx.callerId(), e.getMessage(), e);
            model.close();
            return ToolResult.failure("Error loading case: " + e.getMessage());
        }

        String sessionId;
        try {
            sessionId = sessionManager.create(model, casePath);
        } catch (IllegalStateException e) {
            log.warn("Rejected session for case {} (caller {}): {}", casePath, ctx.callerId(), e.getMessage());
            model.close();
            return ToolResult.failure("Error loading case: " + e.getMessage());
        }
        stream.progress(100, "Session " + sessionId + " ready");

        ObjectNode result = MAPPER.createObjectNode();
        result.put("sessionId", sessionId);
        result.put("casePath", casePath);
        result.set("systemInfo", systemInfo);
        return ToolResult.success(result);
    }
}
