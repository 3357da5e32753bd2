package com.patentflow.orchestrator.engine;

/**
 * The worker thread was interrupted mid-run, typically by the job queue's
 * wall-clock limit or by shutdown.
 */
public class TaskInterruptedException extends RuntimeException {

    public TaskInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
