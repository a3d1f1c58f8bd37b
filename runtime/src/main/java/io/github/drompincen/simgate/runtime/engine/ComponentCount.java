package io.github.drompincen.simgate.runtime.engine;

/**
 * Number of instances of one component type and the group it belongs to.
 */
public record ComponentCount(int count, String group) {}
