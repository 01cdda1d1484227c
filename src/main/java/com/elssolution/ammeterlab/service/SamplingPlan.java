package com.elssolution.ammeterlab.service;

import com.elssolution.ammeterlab.domain.SamplingConfig;
import com.elssolution.ammeterlab.domain.TestRun;

import java.util.List;

/** Validated campaign ready to execute: one recorder (and run id) per endpoint. */
public final class SamplingPlan {

    private final SamplingConfig config;
    private final List<RunRecorder> recorders;

    SamplingPlan(SamplingConfig config, List<RunRecorder> recorders) {
        this.config = config;
        this.recorders = List.copyOf(recorders);
    }

    public SamplingConfig getConfig() {
        return config;
    }

    public List<String> runIds() {
        return recorders.stream().map(RunRecorder::runId).toList();
    }

    /** Live view: RUNNING snapshots for unfinished runs, final runs otherwise. */
    public List<TestRun> snapshots() {
        return recorders.stream().map(RunRecorder::snapshot).toList();
    }

    List<RunRecorder> recorders() {
        return recorders;
    }
}
