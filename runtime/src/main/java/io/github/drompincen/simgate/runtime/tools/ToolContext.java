package io.github.drompincen.simgate.runtime.tools;

/**
 * @param callerId identifies who invoked the tool; tools put it in their failure logs
 */
public record ToolContext(String callerId) {}
