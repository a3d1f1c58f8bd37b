package io.github.drompincen.simgate.runtime.engine;

/**
 * @param setup    run the engine's setup pass right after parsing
 * @param noOutput suppress report and output files
 */
public record LoadOptions(boolean setup, boolean noOutput) {

    public static LoadOptions defaults() {
        return new LoadOptions(true, true);
    }
}
