package com.patentflow.orchestrator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a long call and a heartbeat loop side by side, as siblings of one scope.
 *
 * Whichever finishes first decides the outcome:
 *   work first      → heartbeat cancelled (it writes one last beat), work's result/exception returned
 *   heartbeat first → work cancelled, {@link SupervisorException}
 *
 * Both threads are stopped before {@link #supervise} returns. The caller's MDC
 * is copied into both so their log lines carry the task's context.
 */
@Component
public class HeartbeatSupervisor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatSupervisor.class);

    private static final long JOIN_TIMEOUT_SECONDS = 10;

    private final AtomicInteger scopes = new AtomicInteger();

    public <T> T supervise(Callable<T> work, Runnable beat, Duration interval) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        ExecutorService scope = Executors.newFixedThreadPool(2, scopeThreads());
        CompletionService<T> race = new ExecutorCompletionService<>(scope);

        Future<T> primary   = race.submit(withMdc(mdc, work));
        Future<T> heartbeat = race.submit(withMdc(mdc, () -> {
            heartbeatLoop(beat, interval);
            return null;
        }));

        try {
            Future<T> first = race.take();
            if (first == primary) {
                heartbeat.cancel(true);
                return unwrap(primary);
            }
            primary.cancel(true);
            log.error("Heartbeat loop ended before the remote call; cancelling the call");
            throw new SupervisorException("Heartbeat supervisor terminated unexpectedly");
        } catch (InterruptedException e) {
            primary.cancel(true);
            heartbeat.cancel(true);
            Thread.currentThread().interrupt();
            throw new TaskInterruptedException("Task interrupted while waiting for the remote call", e);
        } finally {
            join(scope);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** Beats every interval until interrupted, then beats once more. */
    private static void heartbeatLoop(Runnable beat, Duration interval) {
        while (true) {
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                beatQuietly(beat);
                return;
            }
            beatQuietly(beat);
        }
    }

    private static void beatQuietly(Runnable beat) {
        try {
            beat.run();
        } catch (RuntimeException e) {
            log.warn("Heartbeat write failed: {}", e.getMessage());
        }
    }

    private static <T> T unwrap(Future<T> done) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new SupervisorException("Supervised call failed: " + cause.getMessage(), cause);
        }
    }

    /** Waits for both threads even when the caller was interrupted; the flag is restored afterwards. */
    private static void join(ExecutorService scope) {
        scope.shutdown();
        boolean interrupted = Thread.interrupted();
        try {
            if (!scope.awaitTermination(JOIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Supervised threads did not stop within {}s, forcing", JOIN_TIMEOUT_SECONDS);
                scope.shutdownNow();
            }
        } catch (InterruptedException e) {
            scope.shutdownNow();
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static <V> Callable<V> withMdc(Map<String, String> mdc, Callable<V> task) {
        return () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private ThreadFactory scopeThreads() {
        String prefix = "task-scope-" + scopes.incrementAndGet() + "-";
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
