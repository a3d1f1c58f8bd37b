package io.github.drompincen.simgate.runtime.tools;

import io.github.drompincen.simgate.protocol.api.ToolRiskProfile;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * A named operation callers can invoke against the simulation server. Implementations are listed
 * in {@code META-INF/services} and receive their collaborators through public setters, see
 * {@link ToolRegistry}.
 * <p>
 * {@link #execute} reports every outcome, including bad arguments, unknown sessions and engine
 * failures, as a {@link ToolResult}; it never lets an exception reach the dispatch layer.
 */
public interface Tool {

    /** Unique snake_case name, e.g. {@code run_power_flow}. */
    String name();

    String description();

    /** JSON schema of the arguments object. */
    JsonNode inputSchema();

    JsonNode outputSchema();

    Set<ToolRiskProfile> riskProfiles();

    /**
     * @param input  arguments object, never {@code null}; an empty object when the caller sent none
     * @param stream receives progress updates for long engine runs
     */
    ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream);
}
