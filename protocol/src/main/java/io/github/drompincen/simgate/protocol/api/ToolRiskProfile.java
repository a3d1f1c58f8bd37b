package io.github.drompincen.simgate.protocol.api;

/**
 * What a tool does to server-side state when it runs.
 */
public enum ToolRiskProfile {
    READ_ONLY,
    /** Creates or releases sessions. */
    SESSION_LIFECYCLE,
    /** Runs a solver and mutates the model held by a session. */
    MODEL_MUTATION
}
