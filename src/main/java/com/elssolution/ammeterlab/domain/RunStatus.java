package com.elssolution.ammeterlab.domain;

public enum RunStatus {
    /** Scheduler still owns the run. */
    RUNNING,
    /** Stop condition reached, every sample valid. */
    COMPLETED,
    /** Stop condition reached with some invalid samples, threshold never hit. */
    DEGRADED,
    /** Consecutive failure threshold reached. */
    ABORTED,
    /** Operator cancelled the campaign. */
    INTERRUPTED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
