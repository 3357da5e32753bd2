package com.patentflow.orchestrator.service;

import com.patentflow.orchestrator.engine.ArtifactStore;
import com.patentflow.orchestrator.event.TaskEvent;
import com.patentflow.orchestrator.event.TaskEventBus;
import com.patentflow.orchestrator.model.Artifact;
import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.WorkflowRecord;
import com.patentflow.orchestrator.repository.TaskStateRepository;
import com.patentflow.orchestrator.repository.WorkflowRecordRepository;
import com.patentflow.orchestrator.stage.StageDefinition;
import com.patentflow.orchestrator.stage.StageRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * User-facing control over individual stage runs: cancel, reset, manual heartbeat,
 * and the read views behind the status endpoints.
 *
 * Cancelling only flips the row to FAILED. The worker keeps running until its
 * remote call returns; the committer then sees a non-running row and discards
 * the result.
 */
@Service
public class TaskControlService {

    private static final Logger log = LoggerFactory.getLogger(TaskControlService.class);

    public static final String CANCELLED_BY_USER = "cancelled by user";
    public static final String RESET_BY_USER     = "reset by user";

    private final StageRegistry            stages;
    private final WorkflowRecordRepository recordRepo;
    private final TaskStateRepository      stateRepo;
    private final TaskStateService         stateService;
    private final ArtifactStore            artifactStore;
    private final TaskEventBus             events;
    private final TransactionTemplate      tx;

    public TaskControlService(StageRegistry stages,
                              WorkflowRecordRepository recordRepo,
                              TaskStateRepository stateRepo,
                              TaskStateService stateService,
                              ArtifactStore artifactStore,
                              TaskEventBus events,
                              PlatformTransactionManager txManager) {
        this.stages        = stages;
        this.recordRepo    = recordRepo;
        this.stateRepo     = stateRepo;
        this.stateService  = stateService;
        this.artifactStore = artifactStore;
        this.events        = events;
        this.tx            = new TransactionTemplate(txManager);
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    public ControlResult cancel(UUID recordId, String stageKey) {
        stages.get(stageKey);
        if (stateService.failRunning(recordId, stageKey, null, CANCELLED_BY_USER)) {
            log.info("Record {} stage '{}' cancelled by user", recordId, stageKey);
            return ControlResult.ok("Task cancelled");
        }
        return ControlResult.refused("Task is not running");
    }

    /**
     * Force the stage to FAILED whatever its current status. Used to recover a
     * stage whose UI shows it stuck. The failure event is only published when
     * a running task was actually interrupted.
     */
    public ControlResult reset(UUID recordId, String stageKey) {
        StageDefinition stage = stages.get(stageKey);
        Optional<WorkflowRecord> record = recordRepo.findById(recordId);
        if (record.isEmpty()) {
            return ControlResult.refused("Record not found: " + recordId);
        }
        stateService.ensureExists(record.get(), stageKey);

        Boolean wasRunning = tx.execute(status -> {
            TaskState state = stateRepo.findForUpdate(recordId, stageKey)
                    .orElseThrow(() -> new IllegalStateException(
                            "Task state missing for record " + recordId + " stage " + stageKey));
            boolean running = state.isRunning();
            state.fail(RESET_BY_USER, Instant.now());
            stateRepo.save(state);
            return running;
        });

        log.info("Record {} stage '{}' reset by user (was running: {})", recordId, stageKey, wasRunning);
        if (Boolean.TRUE.equals(wasRunning)) {
            events.publish(TaskEvent.failed(stage, recordId, RESET_BY_USER));
        }
        return ControlResult.ok("Task reset");
    }

    public ControlResult heartbeat(UUID recordId, String stageKey) {
        stages.get(stageKey);
        return stateService.heartbeat(recordId, stageKey)
                ? ControlResult.ok("Heartbeat recorded")
                : ControlResult.refused("Task is not running");
    }

    // ------------------------------------------------------------------
    // Read views
    // ------------------------------------------------------------------

    public boolean recordExists(UUID recordId) {
        return recordRepo.existsById(recordId);
    }

    public Optional<TaskState> status(UUID recordId, String stageKey) {
        return stateService.find(recordId, stageKey);
    }

    public List<TaskState> statuses(UUID recordId) {
        return stateRepo.findByRecord(recordId);
    }

    public List<Artifact> artifacts(UUID recordId, String stageKey) {
        return artifactStore.list(recordId, stageKey);
    }

    public Optional<Artifact> artifact(UUID recordId, UUID artifactId) {
        return artifactStore.find(recordId, artifactId);
    }
}
