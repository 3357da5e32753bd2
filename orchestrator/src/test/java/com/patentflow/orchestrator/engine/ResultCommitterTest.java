package com.patentflow.orchestrator.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patentflow.orchestrator.codec.PayloadCodec;
import com.patentflow.orchestrator.compute.ProtocolException;
import com.patentflow.orchestrator.compute.RemoteEnvelope;
import com.patentflow.orchestrator.event.TaskEvent;
import com.patentflow.orchestrator.event.TaskEventBus;
import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.TaskStatus;
import com.patentflow.orchestrator.model.WorkflowRecord;
import com.patentflow.orchestrator.repository.TaskStateRepository;
import com.patentflow.orchestrator.repository.WorkflowRecordRepository;
import com.patentflow.orchestrator.stage.ArtifactOutput;
import com.patentflow.orchestrator.stage.StageDefinition;
import com.patentflow.orchestrator.support.Fixtures;
import com.patentflow.orchestrator.support.LockingTransactionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResultCommitterTest {

    static final String STAGE  = "review2revise";
    static final String STEP_1 = "PAT-3-R2R-1";

    @Mock WorkflowRecordRepository recordRepo;
    @Mock TaskStateRepository      stateRepo;
    @Mock ArtifactStore            artifactStore;
    @Mock TaskEventBus             events;

    LockingTransactionManager txManager = new LockingTransactionManager();
    PayloadCodec codec = new PayloadCodec(new ObjectMapper());
    ResultCommitter committer;

    WorkflowRecord record = Fixtures.record("PAT-3");
    StageDefinition stage = StageDefinition.builder(STAGE)
            .stepIdPrefix("R2R")
            .payload((in, c) -> Map.of())
            .mapsTo("reply_review_txt", "reply_review")
            .mapsTo("revised_application_txt", "revised_application")
            .maps("review_meta")
            .artifact("reply_review_docx_bytes", ArtifactOutput.docx("reply"))
            .artifact("revised_application_docx_bytes", ArtifactOutput.docx("revised"))
            .build();

    @BeforeEach
    void setUp() {
        committer = new ResultCommitter(recordRepo, stateRepo, artifactStore, codec,
                new ObjectMapper(), events, txManager);
    }

    // ------------------------------------------------------------------
    // Committed
    // ------------------------------------------------------------------

    @Test
    void commit_runningTask_writesFieldsArtifactsAndBookkeeping() {
        TaskState state = givenRunning(STEP_1);
        when(recordRepo.findById(record.getId())).thenReturn(Optional.of(record));

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("reply_review_txt", "Reply to the examiner");
        res.put("revised_application_txt", "Revised claims");
        res.put("review_meta", Map.of("round", 2));
        res.put("reply_review_docx_bytes", new byte[]{1, 2, 3});
        res.put("revised_application_docx_bytes", new byte[]{4, 5});

        CommitOutcome outcome = committer.commit(record.getId(), stage, STEP_1,
                new RemoteEnvelope(codec.compressJson(res), 12.5, 0.75), Map.of("reviewed_by", "pipeline"));

        assertThat(outcome).isEqualTo(CommitOutcome.COMMITTED);
        assertThat(record.getField("reply_review")).isEqualTo("Reply to the examiner");
        assertThat(record.getField("revised_application")).isEqualTo("Revised claims");
        // Structured values are stored as JSON text
        assertThat(record.getField("review_meta")).isEqualTo("{\"round\":2}");
        assertThat(record.getField("reviewed_by")).isEqualTo("pipeline");

        assertThat(state.getStatus()).isEqualTo(TaskStatus.DONE);
        assertThat(state.getLastError()).isEqualTo(TaskState.SUCCESS_MARKER);
        assertThat(state.getSuccessCount()).isEqualTo(1);
        assertThat(state.getLastCost()).isEqualTo(0.75);
        assertThat(state.getAccumulatedTimeSeconds()).isEqualTo(12.5);
        assertThat(state.getFinishedAt()).isNotNull();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<ArtifactOutput, byte[]>> files = ArgumentCaptor.forClass(Map.class);
        verify(artifactStore).replace(eq(record.getId()), eq(STAGE), eq(STEP_1), files.capture());
        assertThat(files.getValue()).containsOnlyKeys(ArtifactOutput.docx("reply"), ArtifactOutput.docx("revised"));
        assertThat(files.getValue().get(ArtifactOutput.docx("reply"))).containsExactly(1, 2, 3);

        verify(events).publish(new TaskEvent("review2revise_done", record.getId(), STAGE, null));
        assertThat(txManager.commits.get()).isEqualTo(1);
    }

    @Test
    void commit_base64StringArtifact_decoded() {
        givenRunning(STEP_1);
        when(recordRepo.findById(record.getId())).thenReturn(Optional.of(record));
        String res = codec.compressJson(Map.of("reply_review_docx_bytes", "AQID"));

        committer.commit(record.getId(), stage, STEP_1, new RemoteEnvelope(res, 1, 0), Map.of());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<ArtifactOutput, byte[]>> files = ArgumentCaptor.forClass(Map.class);
        verify(artifactStore).replace(any(), any(), any(), files.capture());
        assertThat(files.getValue().get(ArtifactOutput.docx("reply"))).containsExactly(1, 2, 3);
    }

    @Test
    void commit_missingOrNullValues_leaveFieldsUntouched() {
        givenRunning(STEP_1);
        record.setField("reply_review", "previous reply");
        when(recordRepo.findById(record.getId())).thenReturn(Optional.of(record));
        Map<String, Object> res = new HashMap<>();
        res.put("reply_review_txt", null);

        CommitOutcome outcome = committer.commit(record.getId(), stage, STEP_1,
                new RemoteEnvelope(codec.compressJson(res), 1, 0), Map.of());

        assertThat(outcome).isEqualTo(CommitOutcome.COMMITTED);
        assertThat(record.getField("reply_review")).isEqualTo("previous reply");
        assertThat(record.getFields()).doesNotContainKey("revised_application");
        // No artifact in the result: earlier generations are kept
        verifyNoInteractions(artifactStore);
    }

    @Test
    void commit_negativeOrNonFiniteReports_countAsZero() {
        TaskState state = givenRunning(STEP_1);
        when(recordRepo.findById(record.getId())).thenReturn(Optional.of(record));

        committer.commit(record.getId(), stage, STEP_1,
                new RemoteEnvelope(codec.compressJson(Map.of()), Double.NaN, -3.0), Map.of());

        assertThat(state.getAccumulatedCost()).isZero();
        assertThat(state.getAccumulatedTimeSeconds()).isZero();
        assertThat(state.getSuccessCount()).isEqualTo(1);
    }

    @Test
    void commit_blankResult_committedWithoutFieldChanges() {
        TaskState state = givenRunning(STEP_1);
        when(recordRepo.findById(record.getId())).thenReturn(Optional.of(record));

        CommitOutcome outcome = committer.commit(record.getId(), stage, STEP_1,
                new RemoteEnvelope("", 1, 0), Map.of());

        assertThat(outcome).isEqualTo(CommitOutcome.COMMITTED);
        assertThat(state.getStatus()).isEqualTo(TaskStatus.DONE);
    }

    // ------------------------------------------------------------------
    // Discarded
    // ------------------------------------------------------------------

    @Test
    void commit_cancelledWhileInFlight_discardedAndNothingWritten() {
        TaskState state = Fixtures.running(record, STAGE, STEP_1, Instant.now());
        state.fail("cancelled by user", Instant.now());
        when(stateRepo.findForUpdate(record.getId(), STAGE)).thenReturn(Optional.of(state));

        CommitOutcome outcome = committer.commit(record.getId(), stage, STEP_1,
                new RemoteEnvelope(codec.compressJson(Map.of("reply_review_txt", "late")), 5, 1.0), Map.of());

        assertThat(outcome).isEqualTo(CommitOutcome.DISCARDED);
        assertThat(state.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(state.getLastError()).isEqualTo("cancelled by user");
        assertThat(state.getAccumulatedCost()).isZero();
        verifyNoInteractions(recordRepo, artifactStore, events);
    }

    @Test
    void commit_supersededByNewerRun_discarded() {
        givenRunning("PAT-3-R2R-2");

        CommitOutcome outcome = committer.commit(record.getId(), stage, STEP_1,
                new RemoteEnvelope(codec.compressJson(Map.of()), 5, 1.0), Map.of());

        assertThat(outcome).isEqualTo(CommitOutcome.DISCARDED);
        verifyNoInteractions(recordRepo, artifactStore, events);
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    @Test
    void commit_undecodableResult_protocolErrorAndRolledBack() {
        TaskState state = givenRunning(STEP_1);

        assertThatThrownBy(() -> committer.commit(record.getId(), stage, STEP_1,
                new RemoteEnvelope("this is not gzip", 1, 0), Map.of()))
                .isInstanceOf(ProtocolException.class);

        assertThat(state.getStatus()).isEqualTo(TaskStatus.RUNNING);
        assertThat(txManager.rollbacks.get()).isEqualTo(1);
        verify(artifactStore, never()).replace(any(), any(), any(), anyMap());
        verifyNoInteractions(events);
    }

    @Test
    void commit_resultNotAnObject_protocolError() {
        givenRunning(STEP_1);

        assertThatThrownBy(() -> committer.commit(record.getId(), stage, STEP_1,
                new RemoteEnvelope(codec.compressJson(List.of("a", "b")), 1, 0), Map.of()))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("JSON object");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TaskState givenRunning(String stepId) {
        TaskState state = Fixtures.running(record, STAGE, stepId, Instant.now().minusSeconds(30));
        when(stateRepo.findForUpdate(record.getId(), STAGE)).thenReturn(Optional.of(state));
        return state;
    }
}
