package io.github.drompincen.simgate.runtime.engine;

/**
 * Raised by an engine adapter when loading or an analysis fails inside the engine.
 */
public class EngineException extends Exception {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
