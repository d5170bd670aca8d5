package com.gridintel.generation.model;

/**
 * Result of one pipeline invocation: the run record plus the state to carry
 * into the next run. On failure or skip {@code nextState} is the state that
 * was passed in.
 */
public record PipelineOutcome(PipelineRun run, RunState nextState) {

    public boolean succeeded() {
        return PipelineRun.SUCCESS.equals(run.getStatus());
    }
}
