package com.patentflow.orchestrator.engine;

import com.patentflow.orchestrator.codec.PayloadCodec;
import com.patentflow.orchestrator.compute.RemoteCallResult;
import com.patentflow.orchestrator.compute.RetryingComputeCaller;
import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.WorkflowRecord;
import com.patentflow.orchestrator.repository.WorkflowRecordRepository;
import com.patentflow.orchestrator.service.TaskStateService;
import com.patentflow.orchestrator.stage.StageDefinition;
import com.patentflow.orchestrator.stage.StageInputs;
import com.patentflow.orchestrator.stage.StageRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Executes one admitted stage run on a job-queue worker.
 *
 * Flow per run:
 *  1. Read the current step id (skip if the task is no longer RUNNING)
 *  2. Resolve the stage and snapshot the record
 *  3. Build the payload with the stage's {@link com.patentflow.orchestrator.stage.PayloadBuilder}
 *  4. Call the remote endpoint with retries while the heartbeat loop keeps this run alive
 *  5. Hand the envelope to the {@link ResultCommitter}
 *
 * Any exception in steps 2-5 fails the run (if it is still the running one),
 * publishes "&lt;stage&gt;_failed", and is rethrown for the queue's own accounting.
 */
@Service
public class StageExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(StageExecutionEngine.class);

    static final String MDC_RECORD = "recordId";
    static final String MDC_STAGE  = "stage";
    static final String MDC_STEP   = "stepId";

    private final StageRegistry            stages;
    private final WorkflowRecordRepository recordRepo;
    private final TaskStateService         stateService;
    private final PayloadCodec             codec;
    private final RetryingComputeCaller    caller;
    private final HeartbeatSupervisor      supervisor;
    private final ResultCommitter          committer;
    private final TransactionTemplate      readTx;
    private final Path                     workDir;

    public StageExecutionEngine(StageRegistry stages,
                                WorkflowRecordRepository recordRepo,
                                TaskStateService stateService,
                                PayloadCodec codec,
                                RetryingComputeCaller caller,
                                HeartbeatSupervisor supervisor,
                                ResultCommitter committer,
                                PlatformTransactionManager txManager,
                                @Value("${patentflow.compute.work-dir:/tmp/patentflow}") String workDir) {
        this.stages       = stages;
        this.recordRepo   = recordRepo;
        this.stateService = stateService;
        this.codec        = codec;
        this.caller       = caller;
        this.supervisor   = supervisor;
        this.committer    = committer;
        this.workDir      = Path.of(workDir);
        this.readTx       = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
    }

    /**
     * Entry point for the job queue.
     *
     * @param force carried through from admission; the engine itself does not
     *              re-check it, admission already decided
     */
    public void execute(UUID recordId, String stageKey, boolean force) {
        Optional<TaskState> running = stateService.find(recordId, stageKey).filter(TaskState::isRunning);
        if (running.isEmpty()) {
            log.info("Record {} stage '{}' is no longer running; skipping execution", recordId, stageKey);
            return;
        }
        String stepId = running.get().getStepId();

        MDC.put(MDC_RECORD, recordId.toString());
        MDC.put(MDC_STAGE, stageKey);
        MDC.put(MDC_STEP, stepId);
        try {
            log.info("Executing {} (force={})", stepId, force);
            StageDefinition stage = stages.get(stageKey);
            StageInputs inputs = readTx.execute(status -> snapshot(recordId, stepId));
            CommitOutcome outcome = run(stage, inputs);
            log.info("Run {} finished: {}", stepId, outcome);
        } catch (RuntimeException e) {
            String error = describe(e);
            log.error("Run {} failed: {}", stepId, error, e);
            try {
                stateService.failRunning(recordId, stageKey, stepId, error);
            } catch (RuntimeException failure) {
                log.error("Could not record failure of {}: {}", stepId, failure.getMessage(), failure);
            }
            throw e;
        } finally {
            MDC.remove(MDC_RECORD);
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_STEP);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CommitOutcome run(StageDefinition stage, StageInputs inputs) {
        Map<String, Object> input = new LinkedHashMap<>(stage.payloadBuilder().build(inputs, codec));
        input.put("tmp_folder", inputs.scratchDir());
        Map<String, Object> payload = Map.of("input", input);

        RemoteCallResult result = supervisor.supervise(
                () -> caller.call(stage, payload),
                () -> stateService.heartbeat(inputs.recordId(), stage.key(), inputs.stepId()),
                stage.heartbeatInterval());
        log.info("Remote call for {} succeeded after {} attempt(s)", inputs.stepId(), result.attempts());

        return committer.commit(inputs.recordId(), stage, inputs.stepId(), result.envelope(), Map.of());
    }

    private StageInputs snapshot(UUID recordId, String stepId) {
        WorkflowRecord record = recordRepo.findById(recordId)
                .orElseThrow(() -> new IllegalStateException("Record not found: " + recordId));
        return new StageInputs(recordId, record.getReference(), stepId,
                workDir.resolve(stepId).toString(), record.getFields());
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
