package io.github.drompincen.simgate.tools;

import io.github.drompincen.simgate.protocol.api.ErrorKind;
import io.github.drompincen.simgate.runtime.engine.EngineException;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;
import io.github.drompincen.simgate.runtime.result.ResultSerializer;
import io.github.drompincen.simgate.runtime.session.Session;
import io.github.drompincen.simgate.runtime.session.SessionManager;
import io.github.drompincen.simgate.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Base for tools that act on one loaded session. Resolves {@code sessionId}, runs the work while
 * holding the session's lock and turns engine failures into structured results.
 */
public abstract class SessionTool implements Tool {

    protected static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Logger log = LoggerFactory.getLogger(SessionTool.class);

    protected SessionManager sessionManager;
    protected ResultSerializer resultSerializer = new ResultSerializer();

    public void setSessionManager(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    public void setResultSerializer(ResultSerializer resultSerializer) {
        this.resultSerializer = resultSerializer;
    }

    @Override public JsonNode outputSchema() { return MAPPER.createObjectNode().put("type", "object"); }

    /** Message prefix used when the engine fails, e.g. "Error running power flow". */
    protected abstract String failureContext();

    protected abstract ToolResult run(ModelHandle model, JsonNode input, ToolStream stream) throws EngineException;

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
        Optional<Session> session = sessionManager.get(sessionId);
        if (session.isEmpty()) {
            return ToolResult.sessionNotFound(sessionId);
        }
        try {
            return session.get()
                    .exclusive(model -> run(model, input, stream))
                    .orElseGet(() -> ToolResult.sessionNotFound(sessionId));
        } catch (InvalidToolInputException e) {
            return ToolResult.failure(ErrorKind.INVALID_INPUT, e.getMessage());
        } catch (EngineException | RuntimeException e) {
            log.warn("{} failed for session {} (caller {}): {}", name(), sessionId, ctx.callerId(), e.getMessage(), e);
            return ToolResult.failure(failureContext() + ": " + e.getMessage());
        }
    }

    protected static ObjectNode sessionSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("sessionId").put("type", "string").put("description", "Session identifier returned by load_case");
        schema.putArray("required").add("sessionId");
        return schema;
    }

    protected static ObjectNode properties(ObjectNode schema) {
        return (ObjectNode) schema.get("properties");
    }
}
