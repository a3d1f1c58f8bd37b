package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.SessionSummaryDto;
import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.session.SessionManager;
import io.github.drompincen.simgate.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Set;

public class ListSessionsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private SessionManager sessionManager;

    @Override public String name() { return "list_sessions"; }
    @Override public String description() { return "List the active simulation sessions with their case and access times"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "object"); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    public void setSessionManager(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (sessionManager == null) {
            return ToolResult.failure("Session manager not available");
        }
        List<SessionSummaryDto> sessions = sessionManager.list();
        ObjectNode result = MAPPER.createObjectNode();
        ArrayNode arr = result.putArray("sessions");
        for (SessionSummaryDto s : sessions) {
            ObjectNode item = arr.addObject();
            item.put("sessionId", s.sessionId());
            item.put("casePath", s.casePath());
            item.put("createdAt", s.createdAt().toString());
            item.put("lastAccessedAt", s.lastAccessedAt().toString());
        }
        result.put("count", sessions.size());
        return ToolResult.success(result);
    }
}
