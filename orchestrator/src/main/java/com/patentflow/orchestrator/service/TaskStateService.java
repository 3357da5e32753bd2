package com.patentflow.orchestrator.service;

import com.patentflow.orchestrator.event.TaskEvent;
import com.patentflow.orchestrator.event.TaskEventBus;
import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.WorkflowRecord;
import com.patentflow.orchestrator.repository.TaskStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Shared TaskState operations used by admission, the engine, manual control and the reaper.
 *
 * Every transition runs in its own short transaction around a locked re-read,
 * and any event is published after that transaction has committed.
 */
@Service
public class TaskStateService {

    private static final Logger log = LoggerFactory.getLogger(TaskStateService.class);

    private final TaskStateRepository stateRepo;
    private final TaskEventBus        events;
    private final TransactionTemplate tx;

    public TaskStateService(TaskStateRepository stateRepo,
                            TaskEventBus events,
                            PlatformTransactionManager txManager) {
        this.stateRepo = stateRepo;
        this.events    = events;
        this.tx        = new TransactionTemplate(txManager);
    }

    /**
     * Create the (record, stage) row if it does not exist yet.
     *
     * Runs in its own transaction so the later locked read always finds a row.
     * Two callers racing on the first admission both end up here; the loser hits
     * the unique constraint, which is expected and ignored.
     */
    public void ensureExists(WorkflowRecord record, String stageKey) {
        if (stateRepo.findByRecordAndStage(record.getId(), stageKey).isPresent()) {
            return;
        }
        try {
            tx.executeWithoutResult(status -> stateRepo.saveAndFlush(new TaskState(record, stageKey)));
            log.debug("Created task state for record {} stage '{}'", record.getId(), stageKey);
        } catch (DataIntegrityViolationException e) {
            log.debug("Task state for record {} stage '{}' was created concurrently", record.getId(), stageKey);
        }
    }

    /**
     * RUNNING → FAILED, then publish "&lt;stage&gt;_failed".
     *
     * @param expectedStepId when non-null, only the run with this step id is failed;
     *                       a newer run admitted in the meantime is left alone
     * @return true if this call made the transition
     */
    public boolean failRunning(UUID recordId, String stageKey, String expectedStepId, String error) {
        Boolean failed = tx.execute(status -> stateRepo.findForUpdate(recordId, stageKey)
                .filter(TaskState::isRunning)
                .filter(state -> expectedStepId == null || expectedStepId.equals(state.getStepId()))
                .map(state -> {
                    state.fail(error, Instant.now());
                    stateRepo.save(state);
                    return true;
                })
                .orElse(false));

        if (Boolean.TRUE.equals(failed)) {
            log.warn("Record {} stage '{}' → FAILED: {}", recordId, stageKey, error);
            events.publish(TaskEvent.failed(stageKey, recordId, error));
            return true;
        }
        log.info("Record {} stage '{}' not failed: no matching running task", recordId, stageKey);
        return false;
    }

    /**
     * Unlocked liveness write.
     *
     * @return false if the task is not running (nothing was written)
     */
    public boolean heartbeat(UUID recordId, String stageKey) {
        return stateRepo.touchHeartbeat(recordId, stageKey, Instant.now()) > 0;
    }

    /**
     * Liveness write for one specific run.
     *
     * A beat from a run that has since been replaced by a newer step id writes nothing.
     *
     * @return false if that run is no longer the running one
     */
    public boolean heartbeat(UUID recordId, String stageKey, String stepId) {
        return stateRepo.touchRunHeartbeat(recordId, stageKey, stepId, Instant.now()) > 0;
    }

    public Optional<TaskState> find(UUID recordId, String stageKey) {
        return stateRepo.findByRecordAndStage(recordId, stageKey);
    }
}
