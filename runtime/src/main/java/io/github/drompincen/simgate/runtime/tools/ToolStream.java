package io.github.drompincen.simgate.runtime.tools;

public interface ToolStream {

    void progress(int percent, String message);

    static ToolStream noop() {
        return (percent, message) -> {};
    }
}
