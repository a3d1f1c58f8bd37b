package io.github.drompincen.simgate.runtime.engine;

import java.util.List;

/**
 * Shape of the differential-algebraic system held by a model.
 */
public interface DaeState {

    List<String> stateNames();

    List<String> algebraicNames();

    /** Current simulation time. */
    double time();

    default int stateCount() {
        return stateNames().size();
    }

    default int algebraicCount() {
        return algebraicNames().size();
    }
}
