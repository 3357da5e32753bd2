package com.patentflow.orchestrator.api.dto;

import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of one stage on one record.
 *
 * A stage that was never started has no row; it is reported as IDLE with zero counters.
 */
public record TaskStateResponse(
        UUID       recordId,
        String     stageKey,
        TaskStatus status,
        String     stepId,
        Instant    startedAt,
        Instant    lastHeartbeat,
        Instant    finishedAt,
        int        runCount,
        int        successCount,
        String     lastError,
        double     lastCost,
        double     lastTimeSeconds,
        double     accumulatedCost,
        double     accumulatedTimeSeconds
) {
    public static TaskStateResponse from(TaskState s) {
        return new TaskStateResponse(
                s.getRecordId(),
                s.getStageKey(),
                s.getStatus(),
                s.getStepId(),
                s.getStartedAt(),
                s.getLastHeartbeat(),
                s.getFinishedAt(),
                s.getRunCount(),
                s.getSuccessCount(),
                s.getLastError(),
                s.getLastCost(),
                s.getLastTimeSeconds(),
                s.getAccumulatedCost(),
                s.getAccumulatedTimeSeconds()
        );
    }

    public static TaskStateResponse idle(UUID recordId, String stageKey) {
        return new TaskStateResponse(recordId, stageKey, TaskStatus.IDLE,
                null, null, null, null, 0, 0, null, 0.0, 0.0, 0.0, 0.0);
    }
}
