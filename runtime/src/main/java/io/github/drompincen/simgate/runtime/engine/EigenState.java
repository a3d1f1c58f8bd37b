package io.github.drompincen.simgate.runtime.engine;

import java.util.List;
import java.util.Optional;

public interface EigenState {

    /** {@code true} once eigenvalues have been computed. */
    boolean computed();

    Object realParts();

    Object imagParts();

    int positiveCount();

    int zeroCount();

    int negativeCount();

    Optional<Object> participationFactors();

    List<String> stateNames();

    double execTime();
}
