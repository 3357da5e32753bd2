package com.patentflow.orchestrator.service;

import com.patentflow.orchestrator.event.TaskEventBus;
import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.TaskStatus;
import com.patentflow.orchestrator.model.WorkflowRecord;
import com.patentflow.orchestrator.repository.TaskStateRepository;
import com.patentflow.orchestrator.support.Fixtures;
import com.patentflow.orchestrator.support.LockingTransactionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskStateServiceTest {

    static final String STAGE = "title2scene";

    @Mock TaskStateRepository stateRepo;
    @Mock TaskEventBus        events;

    LockingTransactionManager txManager = new LockingTransactionManager();
    TaskStateService service;
    WorkflowRecord record = Fixtures.record("PAT-1");

    @BeforeEach
    void setUp() {
        service = new TaskStateService(stateRepo, events, txManager);
    }

    @Test
    void ensureExists_rowPresent_doesNotInsert() {
        when(stateRepo.findByRecordAndStage(record.getId(), STAGE))
                .thenReturn(Optional.of(Fixtures.idle(record, STAGE)));

        service.ensureExists(record, STAGE);

        verify(stateRepo, never()).saveAndFlush(any());
    }

    @Test
    void ensureExists_lostCreationRace_constraintViolationIgnored() {
        when(stateRepo.findByRecordAndStage(record.getId(), STAGE)).thenReturn(Optional.empty());
        when(stateRepo.saveAndFlush(any(TaskState.class)))
                .thenThrow(new DataIntegrityViolationException("uq_task_states_record_stage"));

        assertThatCode(() -> service.ensureExists(record, STAGE)).doesNotThrowAnyException();
        assertThat(txManager.rollbacks.get()).isEqualTo(1);
    }

    @Test
    void failRunning_matchingRun_failsAndPublishes() {
        TaskState state = Fixtures.running(record, STAGE, "PAT-1-TST-1", Instant.now());
        when(stateRepo.findForUpdate(record.getId(), STAGE)).thenReturn(Optional.of(state));

        boolean failed = service.failRunning(record.getId(), STAGE, "PAT-1-TST-1", "boom");

        assertThat(failed).isTrue();
        assertThat(state.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(state.getLastError()).isEqualTo("boom");
        assertThat(state.getFinishedAt()).isNotNull();
        verify(events).publish(argThat(e -> e.topic().equals("title2scene_failed") && "boom".equals(e.error())));
    }

    @Test
    void failRunning_newerRunAdmittedMeanwhile_leavesItAlone() {
        TaskState state = Fixtures.running(record, STAGE, "PAT-1-TST-2", Instant.now());
        when(stateRepo.findForUpdate(record.getId(), STAGE)).thenReturn(Optional.of(state));

        boolean failed = service.failRunning(record.getId(), STAGE, "PAT-1-TST-1", "late failure of run 1");

        assertThat(failed).isFalse();
        assertThat(state.getStatus()).isEqualTo(TaskStatus.RUNNING);
        verifyNoInteractions(events);
    }

    @Test
    void failRunning_alreadyTerminal_noTransitionNoEvent() {
        TaskState state = Fixtures.running(record, STAGE, "PAT-1-TST-1", Instant.now());
        state.fail("cancelled by user", Instant.now());
        when(stateRepo.findForUpdate(record.getId(), STAGE)).thenReturn(Optional.of(state));

        boolean failed = service.failRunning(record.getId(), STAGE, null, "boom");

        assertThat(failed).isFalse();
        assertThat(state.getLastError()).isEqualTo("cancelled by user");
        verifyNoInteractions(events);
    }

    @Test
    void heartbeat_staleRunAfterReadmission_writesNothing() {
        // run 1 is still beating while run 2 already owns the row
        when(stateRepo.touchRunHeartbeat(eq(record.getId()), eq(STAGE), eq("PAT-1-TST-1"), any(Instant.class)))
                .thenReturn(0);

        assertThat(service.heartbeat(record.getId(), STAGE, "PAT-1-TST-1")).isFalse();
        verify(stateRepo, never()).touchHeartbeat(any(), any(), any(Instant.class));
    }

    @Test
    void heartbeat_currentRun_touchesItsRow() {
        when(stateRepo.touchRunHeartbeat(eq(record.getId()), eq(STAGE), eq("PAT-1-TST-2"), any(Instant.class)))
                .thenReturn(1);

        assertThat(service.heartbeat(record.getId(), STAGE, "PAT-1-TST-2")).isTrue();
    }

    @Test
    void heartbeat_notRunning_reportsFalse() {
        when(stateRepo.touchHeartbeat(eq(record.getId()), eq(STAGE), any(Instant.class))).thenReturn(0);

        assertThat(service.heartbeat(record.getId(), STAGE)).isFalse();
    }
}
