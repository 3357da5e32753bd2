package com.patentflow.orchestrator.service;

import com.patentflow.orchestrator.event.TaskEvent;
import com.patentflow.orchestrator.event.TaskEventBus;
import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.TaskStatus;
import com.patentflow.orchestrator.repository.TaskStateRepository;
import com.patentflow.orchestrator.stage.StageDefinition;
import com.patentflow.orchestrator.stage.StageRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fails RUNNING tasks whose worker has gone silent.
 *
 * A task is lapsed when the newest of started_at and last_heartbeat is older
 * than its stage's timeout. Every stage timeout is shorter than the job queue's
 * ceiling (checked by {@link StageRegistry}), so a hung worker is always caught
 * here before the queue kills it.
 *
 * Each candidate is re-checked under the row lock: a heartbeat, commit or
 * cancel that landed after the scan wins. One failing row never stops the sweep.
 *
 * Metrics: patentflow.reaper.reaped{stage}
 */
@Component
@EnableScheduling
public class StuckTaskReaper {

    private static final Logger log = LoggerFactory.getLogger(StuckTaskReaper.class);

    private final StageRegistry       stages;
    private final TaskStateRepository stateRepo;
    private final TaskEventBus        events;
    private final MeterRegistry       meterRegistry;
    private final TransactionTemplate tx;

    public StuckTaskReaper(StageRegistry stages,
                           TaskStateRepository stateRepo,
                           TaskEventBus events,
                           MeterRegistry meterRegistry,
                           PlatformTransactionManager txManager) {
        this.stages        = stages;
        this.stateRepo     = stateRepo;
        this.events        = events;
        this.meterRegistry = meterRegistry;
        this.tx            = new TransactionTemplate(txManager);
    }

    @Scheduled(fixedDelayString = "${patentflow.reaper.interval-ms:60000}",
               initialDelayString = "${patentflow.reaper.initial-delay-ms:60000}")
    public void tick() {
        int reaped = sweep();
        if (reaped > 0) {
            log.warn("Reaper failed {} stuck task(s)", reaped);
        }
    }

    /** @return number of tasks moved to FAILED */
    public int sweep() {
        Instant now = Instant.now();
        int reaped = 0;
        for (StageDefinition stage : stages.all()) {
            List<TaskState> running;
            try {
                running = stateRepo.findByStageKeyAndStatus(stage.key(), TaskStatus.RUNNING);
            } catch (RuntimeException e) {
                log.error("Reaper could not scan stage '{}': {}", stage.key(), e.getMessage(), e);
                continue;
            }
            for (TaskState candidate : running) {
                try {
                    if (reap(stage, candidate, now)) {
                        reaped++;
                    }
                } catch (RuntimeException e) {
                    log.error("Reaper could not process record {} stage '{}': {}",
                            candidate.getRecordId(), stage.key(), e.getMessage(), e);
                }
            }
        }
        log.debug("Reaper sweep finished: {} reaped", reaped);
        return reaped;
    }

    /**
     * Why the task counts as lapsed, or empty if it does not.
     *
     * Tasks that never ran (run_count == 0) or carry no timestamp at all are
     * never reaped.
     */
    static Optional<String> lapseCause(TaskState state, Duration timeout, Instant now) {
        if (!state.isRunning() || state.getRunCount() == 0) {
            return Optional.empty();
        }
        Instant started = state.getStartedAt();
        Instant beat    = state.getLastHeartbeat();
        if (started == null && beat == null) {
            return Optional.empty();
        }

        boolean beatSeen = beat != null && (started == null || beat.isAfter(started));
        Instant lastSign = beatSeen ? beat : started;
        Duration silent  = Duration.between(lastSign, now);
        if (silent.compareTo(timeout) <= 0) {
            return Optional.empty();
        }
        return Optional.of(String.format("%s (%ds > %ds)",
                beatSeen ? "heartbeat timeout" : "startup timeout",
                silent.getSeconds(), timeout.getSeconds()));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private boolean reap(StageDefinition stage, TaskState candidate, Instant scannedAt) {
        if (lapseCause(candidate, stage.timeout(), scannedAt).isEmpty()) {
            return false;
        }

        String cause = tx.execute(status -> stateRepo.findForUpdate(candidate.getRecordId(), stage.key())
                .flatMap(locked -> {
                    Instant now = Instant.now();
                    Optional<String> lapse = lapseCause(locked, stage.timeout(), now);
                    lapse.ifPresent(c -> {
                        locked.fail(c, now);
                        stateRepo.save(locked);
                    });
                    return lapse;
                })
                .orElse(null));

        if (cause == null) {
            log.info("Record {} stage '{}' recovered before it could be reaped", candidate.getRecordId(), stage.key());
            return false;
        }
        log.warn("Reaped record {} stage '{}' step {}: {}",
                candidate.getRecordId(), stage.key(), candidate.getStepId(), cause);
        meterRegistry.counter("patentflow.reaper.reaped", "stage", stage.key()).increment();
        events.publish(TaskEvent.failed(stage, candidate.getRecordId(), cause));
        return true;
    }
}
