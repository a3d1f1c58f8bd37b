package io.github.drompincen.simgate.runtime.engine;

/**
 * Active and reactive injections of the devices of one component type, index aligned.
 */
public record InjectionTable(Object idx, Object p, Object q) {}
