package io.github.drompincen.simgate.runtime.engine;

/**
 * Per-call power-flow overrides. A {@code null} component keeps the engine's current setting.
 */
public record PowerFlowParams(Double tol, Integer maxIter, String method) {

    public static PowerFlowParams defaults() {
        return new PowerFlowParams(null, null, null);
    }
}
