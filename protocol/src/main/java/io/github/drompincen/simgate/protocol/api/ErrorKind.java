package io.github.drompincen.simgate.protocol.api;

/**
 * Category of a failed tool call.
 */
public enum ErrorKind {
    /** Session id is unknown, expired or already closed. */
    NOT_FOUND,
    /** The analysis the caller depends on has not run, converged or initialized. */
    PRECONDITION_FAILED,
    /** The simulation engine raised while loading or analysing. */
    ENGINE_FAILURE,
    /** A tool argument is malformed or out of range. */
    INVALID_INPUT
}
