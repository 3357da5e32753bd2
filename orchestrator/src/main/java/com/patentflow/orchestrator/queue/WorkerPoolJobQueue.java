package com.patentflow.orchestrator.queue;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process job queue: a fixed pool of worker threads in front of a bounded backlog.
 *
 * One task occupies one worker for its whole duration, so the pool size caps
 * how many remote stage calls run at once. A full backlog rejects the job
 * instead of blocking the caller.
 *
 * A single watchdog thread enforces each job's wall-clock ceiling by
 * interrupting the worker; the job then fails through its own error path.
 * A job that finishes in time cancels its watchdog timer, which is removed
 * from the watchdog queue right away.
 *
 * Metrics: patentflow.queue.jobs{outcome="succeeded|failed|timed_out|rejected"}
 */
@Component
public class WorkerPoolJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolJobQueue.class);

    private final ThreadPoolExecutor       workers;
    private final ScheduledThreadPoolExecutor watchdog;
    private final MeterRegistry            meterRegistry;

    public WorkerPoolJobQueue(@Value("${patentflow.queue.workers:4}") int workerCount,
                              @Value("${patentflow.queue.capacity:100}") int capacity,
                              MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.workers = new ThreadPoolExecutor(
                workerCount, workerCount,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity),
                namedThreads("stage-worker-", false),
                new ThreadPoolExecutor.AbortPolicy());
        this.watchdog = new ScheduledThreadPoolExecutor(1, namedThreads("job-watchdog-", true));
        this.watchdog.setRemoveOnCancelPolicy(true);
        log.info("Job queue started: {} workers, backlog capacity {}", workerCount, capacity);
    }

    @Override
    public JobHandle submit(String jobName, Runnable job, Duration timeout) {
        String jobId = UUID.randomUUID().toString();
        JobHandle handle = new JobHandle(jobId, jobName, Instant.now(), timeout);

        Deadline deadline = new Deadline();
        Future<?> future;
        try {
            future = workers.submit(() -> runJob(handle, job, deadline));
        } catch (RejectedExecutionException e) {
            meterRegistry.counter("patentflow.queue.jobs", "outcome", "rejected").increment();
            throw new JobSubmissionException("Job queue rejected '" + jobName + "': "
                    + (workers.isShutdown() ? "queue is shut down" : "backlog is full"), e);
        }

        deadline.arm(watchdog.schedule(() -> {
            if (!future.isDone()) {
                log.error("Job {} ('{}') exceeded its wall-clock limit of {}, interrupting",
                        jobId, jobName, timeout);
                meterRegistry.counter("patentflow.queue.jobs", "outcome", "timed_out").increment();
                future.cancel(true);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS));

        log.info("Enqueued job {} ('{}'), timeout {}", jobId, jobName, timeout);
        return handle;
    }

    /** Number of jobs waiting for a worker. */
    public int backlog() {
        return workers.getQueue().size();
    }

    /** Number of watchdog timers still pending. */
    public int pendingDeadlines() {
        return watchdog.getQueue().size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down job queue ({} jobs waiting)", backlog());
        watchdog.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void runJob(JobHandle handle, Runnable job, Deadline deadline) {
        log.info("Job {} ('{}') started", handle.jobId(), handle.jobName());
        try {
            job.run();
            meterRegistry.counter("patentflow.queue.jobs", "outcome", "succeeded").increment();
            log.info("Job {} ('{}') finished", handle.jobId(), handle.jobName());
        } catch (Exception e) {
            meterRegistry.counter("patentflow.queue.jobs", "outcome", "failed").increment();
            log.error("Job {} ('{}') failed: {}", handle.jobId(), handle.jobName(), e.getMessage(), e);
        } finally {
            deadline.release();
        }
    }

    /** Watchdog timer of one job; whichever of arm and release comes second cancels it. */
    private static final class Deadline {
        private volatile ScheduledFuture<?> timer;
        private volatile boolean finished;

        void arm(ScheduledFuture<?> scheduled) {
            timer = scheduled;
            if (finished) {
                scheduled.cancel(false);
            }
        }

        void release() {
            finished = true;
            ScheduledFuture<?> scheduled = timer;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(daemon);
            return t;
        };
    }
}
