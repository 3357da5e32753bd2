package com.patentflow.orchestrator.engine;

public enum CommitOutcome {
    /** Result written, task DONE. */
    COMMITTED,
    /** Task was no longer running this step (cancelled, reaped, superseded); nothing written. */
    DISCARDED
}
