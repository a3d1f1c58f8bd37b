package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.config.SimulationProperties;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import io.github.drompincen.simgate.runtime.tools.ToolResult;
import io.github.drompincen.simgate.runtime.tools.ToolStream;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Set;

public class GetTdsResultsTool extends SessionTool {

    private SimulationProperties properties = SimulationProperties.defaults();

    @Override public String name() { return "get_tds_results"; }

    @Override public String description() {
        return "Get time-domain simulation results: the time axis and the requested variable series. " +
               "Without 'variables' all state variables are returned. Series longer than 'maxPoints' are " +
               "downsampled with one shared stride; point i of the result is sample i * downsampleFactor.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = sessionSchema();
        ObjectNode props = properties(schema);
        ObjectNode vars = props.putObject("variables");
        vars.put("type", "array");
        vars.putObject("items").put("type", "string");
        vars.put("description", "State or algebraic variable names; unknown names are skipped");
        props.putObject("maxPoints").put("type", "integer").put("minimum", 1)
                .put("description", "Maximum number of points per series");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    public void setSimulationProperties(SimulationProperties properties) {
        this.properties = properties;
    }

    @Override protected String failureContext() { return "Error retrieving TDS results"; }

    @Override
    protected ToolResult run(ModelHandle model, JsonNode input, ToolStream stream) {
        List<String> variables = ToolInputs.optionalTextList(input, "variables");
        Integer maxPoints = ToolInputs.optionalInt(input, "maxPoints");
        if (maxPoints != null && maxPoints < 1) {
            throw new InvalidToolInputException("'maxPoints' must be >= 1");
        }
        return resultSerializer.timeDomain(model, variables,
                maxPoints != null ? maxPoints : properties.maxResultPoints());
    }
}
