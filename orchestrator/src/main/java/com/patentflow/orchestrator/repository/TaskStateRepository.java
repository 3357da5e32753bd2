package com.patentflow.orchestrator.repository;

import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.TaskStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queries over task_states, including the row lock every state transition uses.
 */
public interface TaskStateRepository extends JpaRepository<TaskState, UUID> {

    /**
     * Lock the (record, stage) row for the rest of the current transaction.
     *
     * SELECT ... FOR UPDATE: a concurrent admission, commit, cancel or reaper pass
     * on the same row blocks here until this transaction commits, then re-reads
     * the committed status. Must run inside a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT s FROM TaskState s
            WHERE s.recordId = :recordId AND s.stageKey = :stageKey
            """)
    Optional<TaskState> findForUpdate(@Param("recordId") UUID recordId,
                                      @Param("stageKey") String stageKey);

    /** Unlocked read; callers must tolerate a value that is stale by the time they act on it. */
    @Query("""
            SELECT s FROM TaskState s
            WHERE s.recordId = :recordId AND s.stageKey = :stageKey
            """)
    Optional<TaskState> findByRecordAndStage(@Param("recordId") UUID recordId,
                                             @Param("stageKey") String stageKey);

    @Query("SELECT s FROM TaskState s WHERE s.recordId = :recordId ORDER BY s.stageKey ASC")
    List<TaskState> findByRecord(@Param("recordId") UUID recordId);

    /** Candidates for the stuck-task reaper. */
    List<TaskState> findByStageKeyAndStatus(String stageKey, TaskStatus status);

    /**
     * Best-effort liveness write. No row lock: a single UPDATE in its own short
     * transaction. The timestamp only moves forward and only while RUNNING.
     *
     * @return number of rows touched (0 if the task is no longer running)
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE TaskState s SET s.lastHeartbeat = :now
            WHERE s.recordId = :recordId AND s.stageKey = :stageKey
              AND s.status = :running
              AND (s.lastHeartbeat IS NULL OR s.lastHeartbeat < :now)
            """)
    int touchHeartbeat(@Param("recordId") UUID recordId,
                       @Param("stageKey") String stageKey,
                       @Param("running") TaskStatus running,
                       @Param("now") Instant now);

    default int touchHeartbeat(UUID recordId, String stageKey, Instant now) {
        return touchHeartbeat(recordId, stageKey, TaskStatus.RUNNING, now);
    }

    @Transactional
    @Modifying
    @Query("""
            UPDATE TaskState s SET s.lastHeartbeat = :now
            WHERE s.recordId = :recordId AND s.stageKey = :stageKey
              AND s.stepId = :stepId AND s.status = :running
              AND (s.lastHeartbeat IS NULL OR s.lastHeartbeat < :now)
            """)
    int touchRunHeartbeat(@Param("recordId") UUID recordId,
                          @Param("stageKey") String stageKey,
                          @Param("stepId") String stepId,
                          @Param("running") TaskStatus running,
                          @Param("now") Instant now);

    /** Same as {@link #touchHeartbeat(UUID, String, Instant)}, limited to the run with this step id. */
    default int touchRunHeartbeat(UUID recordId, String stageKey, String stepId, Instant now) {
        return touchRunHeartbeat(recordId, stageKey, stepId, TaskStatus.RUNNING, now);
    }
}
