package com.patentflow.orchestrator.service;

import com.patentflow.orchestrator.engine.StageExecutionEngine;
import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.TaskStatus;
import com.patentflow.orchestrator.model.WorkflowRecord;
import com.patentflow.orchestrator.queue.JobHandle;
import com.patentflow.orchestrator.queue.JobQueue;
import com.patentflow.orchestrator.repository.TaskStateRepository;
import com.patentflow.orchestrator.repository.WorkflowRecordRepository;
import com.patentflow.orchestrator.service.AdmissionResult.Kind;
import com.patentflow.orchestrator.stage.StageDefinition;
import com.patentflow.orchestrator.stage.StageRegistry;
import com.patentflow.orchestrator.stage.StepIds;
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
 * Admits a stage run exactly once per (record, stage).
 *
 * Steps:
 *  1. Resolve the stage and the record; check the required input fields
 *  2. Lock the task row, re-read its status, and flip it to RUNNING with a
 *     fresh step id. Commit, releasing the lock
 *  3. Hand the run to the job queue. If the queue refuses it, fail the run
 *     that step 2 just started
 *
 * Two concurrent calls for the same pair serialize on the row lock in step 2;
 * the second one reads RUNNING and is rejected.
 */
@Service
public class TaskAdmissionService {

    private static final Logger log = LoggerFactory.getLogger(TaskAdmissionService.class);

    static final String ALREADY_RUNNING = "Task is already running";
    static final String ALREADY_DONE    = "Task already completed; pass force=true to run it again";

    private final StageRegistry            stages;
    private final WorkflowRecordRepository recordRepo;
    private final TaskStateRepository      stateRepo;
    private final TaskStateService         stateService;
    private final JobQueue                 jobQueue;
    private final StageExecutionEngine     engine;
    private final TransactionTemplate      tx;

    public TaskAdmissionService(StageRegistry stages,
                                WorkflowRecordRepository recordRepo,
                                TaskStateRepository stateRepo,
                                TaskStateService stateService,
                                JobQueue jobQueue,
                                StageExecutionEngine engine,
                                PlatformTransactionManager txManager) {
        this.stages       = stages;
        this.recordRepo   = recordRepo;
        this.stateRepo    = stateRepo;
        this.stateService = stateService;
        this.jobQueue     = jobQueue;
        this.engine       = engine;
        this.tx           = new TransactionTemplate(txManager);
    }

    public AdmissionResult start(UUID recordId, String stageKey, boolean force) {
        Optional<StageDefinition> found = stages.find(stageKey);
        if (found.isEmpty()) {
            return AdmissionResult.rejected(Kind.NOT_FOUND, "Unknown stage: " + stageKey);
        }
        StageDefinition stage = found.get();

        Optional<WorkflowRecord> recordOpt = recordRepo.findById(recordId);
        if (recordOpt.isEmpty()) {
            return AdmissionResult.rejected(Kind.NOT_FOUND, "Record not found: " + recordId);
        }
        WorkflowRecord record = recordOpt.get();

        List<String> missing = stage.missingInputs(record::hasText);
        if (!missing.isEmpty()) {
            log.info("Rejected '{}' for record {}: missing {}", stageKey, recordId, missing);
            return AdmissionResult.rejected(Kind.VALIDATION,
                    "Missing required fields: " + String.join(", ", missing));
        }

        // ── Locked status transition ──────────────────────────────────────
        stateService.ensureExists(record, stageKey);
        AdmissionResult admitted = tx.execute(status -> admit(record, stage, force));
        if (admitted == null || !admitted.accepted()) {
            return admitted;
        }
        String stepId = admitted.stepId();

        // ── Queue submission (no lock held) ───────────────────────────────
        try {
            JobHandle handle = jobQueue.submit(stepId,
                    () -> engine.execute(recordId, stageKey, force),
                    stages.jobTimeout());
            log.info("Admitted '{}' for record {} as {} (job={})", stageKey, recordId, stepId, handle.jobId());
            return AdmissionResult.accepted(stepId, handle);
        } catch (RuntimeException e) {
            String error = "Job submission failed: " + e.getMessage();
            log.error("Could not enqueue {} for record {}: {}", stepId, recordId, e.getMessage(), e);
            try {
                stateService.failRunning(recordId, stage.key(), stepId, error);
            } catch (RuntimeException cleanup) {
                log.error("Could not mark {} failed after submission error: {}", stepId, cleanup.getMessage(), cleanup);
            }
            return AdmissionResult.submissionFailed(stepId, error);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Runs inside the admission transaction, with the row locked. */
    private AdmissionResult admit(WorkflowRecord record, StageDefinition stage, boolean force) {
        TaskState state = stateRepo.findForUpdate(record.getId(), stage.key())
                .orElseThrow(() -> new IllegalStateException(
                        "Task state missing for record " + record.getId() + " stage " + stage.key()));

        if (state.getStatus() == TaskStatus.RUNNING) {
            log.info("Rejected '{}' for record {}: already running as {}",
                    stage.key(), record.getId(), state.getStepId());
            return AdmissionResult.rejected(Kind.CONFLICT, ALREADY_RUNNING);
        }
        if (state.getStatus() == TaskStatus.DONE && !force) {
            return AdmissionResult.rejected(Kind.CONFLICT, ALREADY_DONE);
        }

        String stepId = StepIds.mint(record.getReference(), stage.stepIdPrefix(), state.getRunCount() + 1);
        state.begin(stepId, Instant.now());
        stateRepo.save(state);
        return AdmissionResult.accepted(stepId, null);
    }
}
