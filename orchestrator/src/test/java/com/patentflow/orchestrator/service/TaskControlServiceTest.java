package com.patentflow.orchestrator.service;

import com.patentflow.orchestrator.engine.ArtifactStore;
import com.patentflow.orchestrator.event.TaskEvent;
import com.patentflow.orchestrator.event.TaskEventBus;
import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.TaskStatus;
import com.patentflow.orchestrator.model.WorkflowRecord;
import com.patentflow.orchestrator.repository.TaskStateRepository;
import com.patentflow.orchestrator.repository.WorkflowRecordRepository;
import com.patentflow.orchestrator.stage.StageRegistry;
import com.patentflow.orchestrator.stage.UnknownStageException;
import com.patentflow.orchestrator.support.Fixtures;
import com.patentflow.orchestrator.support.LockingTransactionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskControlServiceTest {

    static final String STAGE = "review2revise";

    @Mock WorkflowRecordRepository recordRepo;
    @Mock TaskStateRepository      stateRepo;
    @Mock ArtifactStore            artifactStore;
    @Mock TaskEventBus             events;

    LockingTransactionManager txManager = new LockingTransactionManager();
    TaskControlService service;
    WorkflowRecord record = Fixtures.record("PAT-9");

    @BeforeEach
    void setUp() {
        StageRegistry stages = new StageRegistry(List.of(Fixtures.simpleStage(STAGE)), Duration.ofMinutes(70));
        TaskStateService stateService = new TaskStateService(stateRepo, events, txManager);
        service = new TaskControlService(stages, recordRepo, stateRepo, stateService, artifactStore, events, txManager);
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_runningTask_failsItAndPublishes() {
        TaskState state = Fixtures.running(record, STAGE, "PAT-9-TST-1", Instant.now());
        when(stateRepo.findForUpdate(record.getId(), STAGE)).thenReturn(Optional.of(state));

        ControlResult result = service.cancel(record.getId(), STAGE);

        assertThat(result.ok()).isTrue();
        assertThat(state.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(state.getLastError()).isEqualTo(TaskControlService.CANCELLED_BY_USER);
        verify(events).publish(new TaskEvent("review2revise_failed", record.getId(), STAGE, "cancelled by user"));
    }

    @Test
    void cancel_notRunning_refusedWithoutEvent() {
        TaskState state = Fixtures.running(record, STAGE, "PAT-9-TST-1", Instant.now());
        state.complete(1.0, 2.0, Instant.now());
        when(stateRepo.findForUpdate(record.getId(), STAGE)).thenReturn(Optional.of(state));

        ControlResult result = service.cancel(record.getId(), STAGE);

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).isEqualTo("Task is not running");
        assertThat(state.getStatus()).isEqualTo(TaskStatus.DONE);
        verifyNoInteractions(events);
    }

    @Test
    void cancel_neverStarted_refused() {
        when(stateRepo.findForUpdate(record.getId(), STAGE)).thenReturn(Optional.empty());

        assertThat(service.cancel(record.getId(), STAGE).ok()).isFalse();
    }

    @Test
    void cancel_unknownStage_throws() {
        assertThatThrownBy(() -> service.cancel(record.getId(), "nope"))
                .isInstanceOf(UnknownStageException.class);
    }

    // ------------------------------------------------------------------
    // reset()
    // ------------------------------------------------------------------

    @Test
    void reset_runningTask_failsAndPublishes() {
        TaskState state = Fixtures.running(record, STAGE, "PAT-9-TST-1", Instant.now());
        givenRecordWithState(state);

        ControlResult result = service.reset(record.getId(), STAGE);

        assertThat(result.ok()).isTrue();
        assertThat(state.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(state.getLastError()).isEqualTo(TaskControlService.RESET_BY_USER);
        verify(events).publish(any(TaskEvent.class));
    }

    @Test
    void reset_doneTask_failsWithoutEvent() {
        TaskState state = Fixtures.running(record, STAGE, "PAT-9-TST-1", Instant.now());
        state.complete(1.0, 2.0, Instant.now());
        givenRecordWithState(state);

        ControlResult result = service.reset(record.getId(), STAGE);

        assertThat(result.ok()).isTrue();
        assertThat(state.getStatus()).isEqualTo(TaskStatus.FAILED);
        // Accumulators survive a reset
        assertThat(state.getAccumulatedCost()).isEqualTo(1.0);
        verifyNoInteractions(events);
    }

    // ------------------------------------------------------------------
    // heartbeat()
    // ------------------------------------------------------------------

    @Test
    void heartbeat_runningTask_recorded() {
        when(stateRepo.touchHeartbeat(eq(record.getId()), eq(STAGE), any(Instant.class))).thenReturn(1);

        ControlResult result = service.heartbeat(record.getId(), STAGE);

        assertThat(result.ok()).isTrue();
    }

    @Test
    void heartbeat_idleTask_refused() {
        when(stateRepo.touchHeartbeat(eq(record.getId()), eq(STAGE), any(Instant.class))).thenReturn(0);

        ControlResult result = service.heartbeat(record.getId(), STAGE);

        assertThat(result.ok()).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void givenRecordWithState(TaskState state) {
        when(recordRepo.findById(record.getId())).thenReturn(Optional.of(record));
        when(stateRepo.findByRecordAndStage(record.getId(), STAGE)).thenReturn(Optional.of(state));
        when(stateRepo.findForUpdate(record.getId(), STAGE)).thenReturn(Optional.of(state));
    }
}
