package com.patentflow.orchestrator.queue;

/**
 * Thrown when the job queue refuses a job (full, shut down, unreachable).
 */
public class JobSubmissionException extends RuntimeException {

    public JobSubmissionException(String message) {
        super(message);
    }

    public JobSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
