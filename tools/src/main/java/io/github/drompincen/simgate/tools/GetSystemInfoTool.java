package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import io.github.drompincen.simgate.runtime.tools.ToolResult;
import io.github.drompincen.simgate.runtime.tools.ToolStream;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

public class GetSystemInfoTool extends SessionTool {

    @Override public String name() { return "get_system_info"; }

    @Override public String description() {
        return "Get a summary of a loaded system: name, component counts, DAE dimensions and base configuration";
    }

    @Override public JsonNode inputSchema() { return sessionSchema(); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }
    @Override protected String failureContext() { return "Error getting system info"; }

    @Override
    protected ToolResult run(ModelHandle model, JsonNode input, ToolStream stream) {
        ObjectNode result = MAPPER.createObjectNode();
        result.put("sessionId", input.path("sessionId").asText());
        result.setAll(resultSerializer.systemInfo(model));
        return ToolResult.success(result);
    }
}
