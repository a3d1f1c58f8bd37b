package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import io.github.drompincen.simgate.runtime.tools.ToolResult;
import io.github.drompincen.simgate.runtime.tools.ToolStream;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

public class GetPflowResultsTool extends SessionTool {

    @Override public String name() { return "get_pflow_results"; }
    @Override public String description() { return "Get the results of the last power flow run on a session"; }
    @Override public JsonNode inputSchema() { return sessionSchema(); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }
    @Override protected String failureContext() { return "Error retrieving power flow results"; }

    @Override
    protected ToolResult run(ModelHandle model, JsonNode input, ToolStream stream) {
        return ToolResult.success(resultSerializer.powerFlow(model));
    }
}
