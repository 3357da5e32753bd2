package com.patentflow.orchestrator.engine;

import com.patentflow.orchestrator.compute.TransientRemoteException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for HeartbeatSupervisor using real threads and short intervals.
 */
class HeartbeatSupervisorTest {

    HeartbeatSupervisor supervisor = new HeartbeatSupervisor();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void supervise_workFinishesFirst_returnsResultAfterOneFinalBeat() {
        AtomicInteger beats = new AtomicInteger();

        String result = supervisor.supervise(() -> "ok", beats::incrementAndGet, Duration.ofSeconds(30));

        assertThat(result).isEqualTo("ok");
        // The interval never elapsed; only the beat written on cancellation happened.
        assertThat(beats.get()).isEqualTo(1);
    }

    @Test
    void supervise_longWork_beatsPeriodically() {
        AtomicInteger beats = new AtomicInteger();

        Integer result = supervisor.supervise(() -> {
            Thread.sleep(300);
            return 42;
        }, beats::incrementAndGet, Duration.ofMillis(20));

        assertThat(result).isEqualTo(42);
        assertThat(beats.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void supervise_workThrows_sameExceptionPropagates() {
        TransientRemoteException failure = new TransientRemoteException("HTTP 503", 503);

        assertThatThrownBy(() -> supervisor.supervise(() -> { throw failure; }, () -> {}, Duration.ofSeconds(30)))
                .isSameAs(failure);
    }

    @Test
    void supervise_heartbeatWritesFail_workStillCompletes() {
        AtomicInteger attempts = new AtomicInteger();

        String result = supervisor.supervise(() -> {
            Thread.sleep(100);
            return "done";
        }, () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("database unavailable");
        }, Duration.ofMillis(10));

        assertThat(result).isEqualTo("done");
        assertThat(attempts.get()).isGreaterThan(1);
    }

    @Test
    void supervise_heartbeatLoopDies_workCancelledAndSupervisorErrorRaised() throws Exception {
        CountDownLatch workInterrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> supervisor.supervise(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                workInterrupted.countDown();
                throw e;
            }
            return "never";
        }, () -> {
            throw new AssertionError("heartbeat thread crashed");
        }, Duration.ofMillis(10)))
                .isInstanceOf(SupervisorException.class)
                .hasMessage("Heartbeat supervisor terminated unexpectedly");

        assertThat(workInterrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void supervise_callerInterrupted_stopsBothAndRaisesTaskInterrupted() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean workStopped = new AtomicBoolean();
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean interruptFlagKept = new AtomicBoolean();

        Thread worker = new Thread(() -> {
            try {
                supervisor.supervise(() -> {
                    started.countDown();
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        workStopped.set(true);
                        throw e;
                    }
                    return "never";
                }, () -> {}, Duration.ofSeconds(30));
            } catch (Throwable t) {
                thrown.set(t);
                interruptFlagKept.set(Thread.currentThread().isInterrupted());
            }
        });
        worker.start();
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

        worker.interrupt();
        worker.join(5_000);

        assertThat(worker.isAlive()).isFalse();
        assertThat(thrown.get()).isInstanceOf(TaskInterruptedException.class);
        assertThat(interruptFlagKept.get()).isTrue();
        assertThat(workStopped.get()).isTrue();
    }

    @Test
    void supervise_callerMdc_visibleInWorkThread() {
        MDC.put("stepId", "PAT-1-S2T-3");

        String seen = supervisor.supervise(() -> MDC.get("stepId"), () -> {}, Duration.ofSeconds(30));

        assertThat(seen).isEqualTo("PAT-1-S2T-3");
    }
}
