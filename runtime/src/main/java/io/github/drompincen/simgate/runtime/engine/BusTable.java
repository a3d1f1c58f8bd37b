package io.github.drompincen.simgate.runtime.engine;

/**
 * Per-bus power-flow solution, index aligned.
 *
 * @param idx     bus identifiers as the engine stores them (numbers or strings)
 * @param names   bus names
 * @param voltage voltage magnitudes
 * @param angle   voltage angles
 */
public record BusTable(Object idx, Object names, Object voltage, Object angle) {}
