package io.github.drompincen.simgate.runtime.tools;

import io.github.drompincen.simgate.protocol.api.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;

public record ToolResult(
        boolean success,
        JsonNode output,
        String error,
        ErrorKind errorKind
) {
    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, ErrorKind.ENGINE_FAILURE);
    }

    public static ToolResult failure(ErrorKind kind, String error) {
        return new ToolResult(false, null, error, kind);
    }

    public static ToolResult sessionNotFound(String sessionId) {
        return failure(ErrorKind.NOT_FOUND, "Session not found: " + sessionId);
    }
}
