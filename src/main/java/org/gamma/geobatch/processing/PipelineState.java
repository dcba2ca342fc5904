package org.gamma.geobatch.processing;

/**
 * Lifecycle of one batch run. A run ends in exactly one of {@link #COMPLETED} or {@link #FAILED}.
 */
public enum PipelineState {
    INIT,
    PREFLIGHTING,
    RUNNING,
    DRAINING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
