package com.patentflow.orchestrator.event;

import com.patentflow.orchestrator.stage.StageDefinition;

import java.util.UUID;

/**
 * Terminal notification for one run of a stage.
 *
 * topic is "<stage>_done" or "<stage>_failed"; error is null on success.
 */
public record TaskEvent(String topic, UUID recordId, String stageKey, String error) {

    public static TaskEvent done(StageDefinition stage, UUID recordId) {
        return new TaskEvent(stage.doneTopic(), recordId, stage.key(), null);
    }

    public static TaskEvent failed(StageDefinition stage, UUID recordId, String error) {
        return new TaskEvent(stage.failedTopic(), recordId, stage.key(), error);
    }

    /** For a run whose stage definition can no longer be resolved. */
    public static TaskEvent failed(String stageKey, UUID recordId, String error) {
        return new TaskEvent(stageKey + "_failed", recordId, stageKey, error);
    }

    public boolean isFailure() {
        return error != null;
    }
}
