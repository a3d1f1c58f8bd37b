package io.github.drompincen.simgate.runtime.engine;

import java.util.Map;

/**
 * One loaded engine model. Not safe for concurrent use: callers must serialize every call on a
 * handle, which {@link io.github.drompincen.simgate.runtime.session.Session} does.
 * <p>
 * Numeric accessors return whatever container the engine uses natively (primitive arrays, boxed
 * lists, nested arrays); {@link io.github.drompincen.simgate.runtime.result.NumericConversion}
 * turns them into JSON.
 */
public interface ModelHandle extends AutoCloseable {

    String name();

    String casePath();

    boolean isSetup();

    /** Component types in the engine's declaration order, including empty ones. */
    Map<String, ComponentCount> componentCounts();

    DaeState dae();

    double frequency();

    double powerBase();

    boolean runPowerFlow(PowerFlowParams params) throws EngineException;

    PowerFlowState powerFlow();

    /**
     * @return whether the run reported success; the same value is kept afterwards as
     *         {@link TimeDomainState#succeeded()}
     */
    boolean runTimeDomain(TimeDomainParams params) throws EngineException;

    TimeDomainState timeDomain();

    boolean runEigen() throws EngineException;

    EigenState eigen();

    /** Tears down engine-side resources. Idempotent. */
    @Override
    void close();
}
