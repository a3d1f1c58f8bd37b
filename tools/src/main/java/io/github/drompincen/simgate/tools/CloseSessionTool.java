package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ErrorKind;
import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import io.github.drompincen.simgate.runtime.session.SessionManager;
import io.github.drompincen.simgate.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

public class CloseSessionTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private SessionManager sessionManager;

    @Override public String name() { return "close_session"; }

    @Override public String description() {
        return "Close a simulation session and release its model. A run already in progress on the " +
               "session finishes first; the session id stops resolving immediately.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").putObject("sessionId").put("type", "string")
                .put("description", "Session identifier to close");
        schema.putArray("required").add("sessionId");
        return schema;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "object"); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.SESSION_LIFECYCLE); }

    public void setSessionManager(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (sessionManager == null) {
            return ToolResult.failure("Session manager not available");
        }
        String sessionId;
        try {
            sessionId = ToolInputs.requiredText(input, "sessionId");
        } catch (InvalidToolInputException e) {
            return ToolResult.failure(ErrorKind.INVALID_INPUT, e.getMessage());
        }
        if (!sessionManager.close(sessionId)) {
            return ToolResult.sessionNotFound(sessionId);
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.put("closed", true);
        result.put("message", "Session " + sessionId + " closed successfully");
        return ToolResult.success(result);
    }
}
