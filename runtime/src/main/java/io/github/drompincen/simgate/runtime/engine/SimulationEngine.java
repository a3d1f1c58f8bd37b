package io.github.drompincen.simgate.runtime.engine;

import java.nio.file.Path;

/**
 * Entry point of a simulation engine adapter. Implementations are discovered through
 * {@link java.util.ServiceLoader}.
 */
public interface SimulationEngine {

    /**
     * Parses a case file into a new model instance.
     * <p>
     * Implementations must release any partially constructed model before throwing, so a caller
     * either owns a fully usable handle or nothing.
     *
     * @throws EngineException when the file cannot be parsed or set up
     */
    ModelHandle load(Path casePath, LoadOptions options) throws EngineException;
}
