package io.github.drompincen.simgate.runtime.session;

import io.github.drompincen.simgate.runtime.engine.EngineException;
import io.github.drompincen.simgate.runtime.engine.ModelHandle;

@FunctionalInterface
public interface ModelCall<T> {

    T call(ModelHandle model) throws EngineException;
}
