package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ErrorKind;
import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.engine.DaeState;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import io.github.drompincen.simgate.runtime.tools.ToolResult;
import io.github.drompincen.simgate.runtime.tools.ToolStream;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

public class ListTdsVariablesTool extends SessionTool {

    @Override public String name() { return "list_tds_variables"; }
    @Override public String description() { return "List the state and algebraic variable names available after a time-domain run"; }
    @Override public JsonNode inputSchema() { return sessionSchema(); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }
    @Override protected String failureContext() { return "Error listing variables"; }

    @Override
    protected ToolResult run(ModelHandle model, JsonNode input, ToolStream stream) {
        if (!model.timeDomain().initialized()) {
            return ToolResult.failure(ErrorKind.PRECONDITION_FAILED, "Time-domain simulation not initialized");
        }
        DaeState dae = model.dae();
        ObjectNode result = MAPPER.createObjectNode();
        ArrayNode states = result.putArray("stateVariables");
        dae.stateNames().forEach(states::add);
        ArrayNode algebraic = result.putArray("algebraicVariables");
        dae.algebraicNames().forEach(algebraic::add);
        result.put("nStates", dae.stateCount());
        result.put("nAlgebraic", dae.algebraicCount());
        return ToolResult.success(result);
    }
}
