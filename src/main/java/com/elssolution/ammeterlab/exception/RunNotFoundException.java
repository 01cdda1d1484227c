package com.elssolution.ammeterlab.exception;

public class RunNotFoundException extends AmmeterLabException {
    private final String runId;

    public RunNotFoundException(String runId) {
        super(ErrorKind.NOT_FOUND, "run not found: " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
