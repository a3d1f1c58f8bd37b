package io.github.drompincen.simgate.runtime.engine;

import java.util.Optional;

public interface PowerFlowState {

    boolean converged();

    int iterations();

    double execTime();

    /** Empty when the model has no buses. */
    Optional<BusTable> buses();

    /** Injections of the given component type; empty when the model has no instance of it. */
    Optional<InjectionTable> injections(String componentType);
}
