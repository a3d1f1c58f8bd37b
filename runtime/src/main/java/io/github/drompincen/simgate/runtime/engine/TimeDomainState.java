package io.github.drompincen.simgate.runtime.engine;

public interface TimeDomainState {

    boolean initialized();

    /** What the last {@link ModelHandle#runTimeDomain} returned; {@code false} before any run. */
    boolean succeeded();

    /** Set by the engine when the integration hit an internal failure. */
    boolean busted();

    double execTime();

    double startTime();

    double endTime();

    /** Stored time axis, one entry per sample. */
    Object time();

    /** Samples of the state variable at the given position of {@link DaeState#stateNames()}. */
    Object stateSeries(int index);

    /** Samples of the algebraic variable at the given position of {@link DaeState#algebraicNames()}. */
    Object algebraicSeries(int index);
}
