package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.engine.EngineException;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import io.github.drompincen.simgate.runtime.engine.PowerFlowParams;
import io.github.drompincen.simgate.runtime.tools.ToolResult;
import io.github.drompincen.simgate.runtime.tools.ToolStream;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

public class RunPowerFlowTool extends SessionTool {

    @Override public String name() { return "run_power_flow"; }

    @Override public String description() {
        return "Run a power flow on a loaded system. Returns convergence status, iteration count, " +
               "bus voltage magnitudes and angles, and generator P/Q outputs.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = sessionSchema();
        ObjectNode props = properties(schema);
        props.putObject("tol").put("type", "number").put("description", "Convergence tolerance");
        props.putObject("maxIter").put("type", "integer").put("description", "Maximum iterations");
        props.putObject("method").put("type", "string").put("description", "Solution method, e.g. NR, dishonest, NK");
        return schema;
    }

    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.MODEL_MUTATION); }

    @Override protected String failureContext() { return "Error running power flow"; }

    @Override
    protected ToolResult run(ModelHandle model, JsonNode input, ToolStream stream) throws EngineException {
        PowerFlowParams params = new PowerFlowParams(
                ToolInputs.optionalDouble(input, "tol"),
                ToolInputs.optionalInt(input, "maxIter"),
                ToolInputs.optionalText(input, "method"));
        model.runPowerFlow(params);
        ObjectNode result = resultSerializer.powerFlow(model);
        stream.progress(100, result.path("converged").asBoolean() ? "Power flow converged" : "Power flow did not converge");
        return ToolResult.success(result);
    }
}
