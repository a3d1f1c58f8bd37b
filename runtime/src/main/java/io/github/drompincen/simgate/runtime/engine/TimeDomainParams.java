package io.github.drompincen.simgate.runtime.engine;

/**
 * Per-call time-domain overrides. A {@code null} component keeps the engine's current setting.
 *
 * @param tf     simulation end time in seconds
 * @param tstep  integration step in seconds
 * @param tol    convergence tolerance
 * @param method integration method name
 */
public record TimeDomainParams(Double tf, Double tstep, Double tol, String method) {}
