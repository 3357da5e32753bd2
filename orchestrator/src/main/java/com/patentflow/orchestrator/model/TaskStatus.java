package com.patentflow.orchestrator.model;

/**
 * Execution state of one pipeline stage on one workflow record.
 *
 * Transitions:
 *   IDLE / DONE / FAILED → RUNNING  (admission only)
 *   RUNNING → DONE                  (result committed)
 *   RUNNING → FAILED                (remote failure, user cancel, reaper, submission failure)
 */
public enum TaskStatus {
    IDLE,
    RUNNING,
    DONE,
    FAILED
}
