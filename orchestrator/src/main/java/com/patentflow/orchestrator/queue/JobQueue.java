package com.patentflow.orchestrator.queue;

import java.time.Duration;

/**
 * Runs named jobs later, on a worker, under a wall-clock ceiling.
 *
 * A job that outlives its timeout is interrupted. Exceptions thrown by a job
 * are recorded by the queue; nobody is waiting for them synchronously.
 */
public interface JobQueue {

    /**
     * @throws JobSubmissionException if the job cannot be accepted
     */
    JobHandle submit(String jobName, Runnable job, Duration timeout);
}
