package com.patentflow.orchestrator.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patentflow.orchestrator.codec.PayloadCodec;
import com.patentflow.orchestrator.codec.PayloadCodecException;
import com.patentflow.orchestrator.compute.ProtocolException;
import com.patentflow.orchestrator.compute.RemoteEnvelope;
import com.patentflow.orchestrator.event.TaskEvent;
import com.patentflow.orchestrator.event.TaskEventBus;
import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.WorkflowRecord;
import com.patentflow.orchestrator.repository.TaskStateRepository;
import com.patentflow.orchestrator.repository.WorkflowRecordRepository;
import com.patentflow.orchestrator.stage.ArtifactOutput;
import com.patentflow.orchestrator.stage.StageDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes a finished run's result back to the record, or throws it away.
 *
 * Under the row lock the task must still be RUNNING with the same step id that
 * produced the result. Otherwise it was cancelled, reaped or superseded while
 * the remote call was in flight and the result is DISCARDED untouched.
 *
 * The "&lt;stage&gt;_done" event goes out after the transaction commits.
 */
@Component
public class ResultCommitter {

    private static final Logger log = LoggerFactory.getLogger(ResultCommitter.class);

    private final WorkflowRecordRepository recordRepo;
    private final TaskStateRepository      stateRepo;
    private final ArtifactStore            artifactStore;
    private final PayloadCodec             codec;
    private final ObjectMapper             objectMapper;
    private final TaskEventBus             events;
    private final TransactionTemplate      tx;

    public ResultCommitter(WorkflowRecordRepository recordRepo,
                           TaskStateRepository stateRepo,
                           ArtifactStore artifactStore,
                           PayloadCodec codec,
                           ObjectMapper objectMapper,
                           TaskEventBus events,
                           PlatformTransactionManager txManager) {
        this.recordRepo    = recordRepo;
        this.stateRepo     = stateRepo;
        this.artifactStore = artifactStore;
        this.codec         = codec;
        this.objectMapper  = objectMapper;
        this.events        = events;
        this.tx            = new TransactionTemplate(txManager);
    }

    /**
     * @param extraFields additional record fields written with the result, may be empty
     */
    public CommitOutcome commit(UUID recordId, StageDefinition stage, String stepId,
                                RemoteEnvelope envelope, Map<String, String> extraFields) {
        CommitOutcome outcome = tx.execute(status -> {
            TaskState state = stateRepo.findForUpdate(recordId, stage.key()).orElse(null);
            if (state == null || !state.isRunning() || !stepId.equals(state.getStepId())) {
                return CommitOutcome.DISCARDED;
            }

            Map<String, Object> result = decode(envelope.res());
            WorkflowRecord record = recordRepo.findById(recordId)
                    .orElseThrow(() -> new IllegalStateException("Record disappeared: " + recordId));

            int written = applyFields(record, stage, result);
            Map<ArtifactOutput, byte[]> files = collectArtifacts(stage, result);
            if (!files.isEmpty()) {
                artifactStore.replace(recordId, stage.key(), stepId, files);
            }
            extraFields.forEach(record::setField);
            recordRepo.save(record);

            state.complete(envelope.cost(), envelope.timeSeconds(), Instant.now());
            stateRepo.save(state);
            log.info("Committed {}: {} field(s), {} artifact(s), cost={}, time={}s",
                    stepId, written, files.size(), envelope.cost(), envelope.timeSeconds());
            return CommitOutcome.COMMITTED;
        });

        if (outcome == CommitOutcome.COMMITTED) {
            events.publish(TaskEvent.done(stage, recordId));
        } else {
            log.warn("Discarded result of {} for record {}: task is no longer running this step",
                    stepId, recordId);
        }
        return outcome;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Map<String, Object> decode(String res) {
        try {
            return codec.decompressJsonObject(res);
        } catch (PayloadCodecException e) {
            throw new ProtocolException("Result could not be decoded: " + e.getMessage(), e);
        }
    }

    /** Null or missing values leave the field as it was. */
    private int applyFields(WorkflowRecord record, StageDefinition stage, Map<String, Object> result) {
        int written = 0;
        for (Map.Entry<String, String> mapping : stage.fieldMapping().entrySet()) {
            String field     = mapping.getKey();
            String resultKey = mapping.getValue();
            Object value = result.get(resultKey);
            if (value == null) continue;
            if (value instanceof byte[]) {
                log.warn("Result key '{}' holds binary data; not written to field '{}'", resultKey, field);
                continue;
            }
            record.setField(field, asText(value));
            written++;
        }
        return written;
    }

    private Map<ArtifactOutput, byte[]> collectArtifacts(StageDefinition stage, Map<String, Object> result) {
        Map<ArtifactOutput, byte[]> files = new LinkedHashMap<>();
        stage.artifactOutputs().forEach((key, output) -> {
            Object value = result.get(key);
            if (value instanceof byte[] bytes && bytes.length > 0) {
                files.put(output, bytes);
            } else if (value instanceof String text && !text.isBlank()) {
                files.put(output, PayloadCodec.decodeBase64(text));
            } else if (value != null) {
                log.warn("Result key '{}' is not binary ({}); artifact skipped",
                        key, value.getClass().getSimpleName());
            }
        });
        return files;
    }

    private String asText(Object value) {
        if (value instanceof String s) return s;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Result value could not be stored as JSON", e);
        }
    }
}
