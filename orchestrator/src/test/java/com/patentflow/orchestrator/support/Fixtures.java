package com.patentflow.orchestrator.support;

import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.model.TaskStatus;
import com.patentflow.orchestrator.model.WorkflowRecord;
import com.patentflow.orchestrator.stage.StageDefinition;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Test object factories shared by the unit tests.
 *
 * Ids and a few fields are normally written by JPA, so they are set reflectively.
 */
public final class Fixtures {

    private Fixtures() {}

    public static WorkflowRecord record(String reference) {
        WorkflowRecord record = new WorkflowRecord(reference);
        setField(record, "id", UUID.randomUUID());
        return record;
    }

    public static TaskState idle(WorkflowRecord record, String stageKey) {
        TaskState state = new TaskState(record, stageKey);
        setField(state, "id", UUID.randomUUID());
        return state;
    }

    /** A state that has been admitted once and is RUNNING since the given instant. */
    public static TaskState running(WorkflowRecord record, String stageKey, String stepId, Instant since) {
        TaskState state = idle(record, stageKey);
        state.begin(stepId, since);
        return state;
    }

    public static void setStatus(TaskState state, TaskStatus status) {
        setField(state, "status", status);
    }

    /** title2scene-like stage: one required field, one mapped output. */
    public static StageDefinition simpleStage(String key) {
        return StageDefinition.builder(key)
                .stepIdPrefix("TST")
                .timeout(Duration.ofMinutes(30))
                .requires("patent_title")
                .payload((in, codec) -> Map.of("patent_title", in.text("patent_title")))
                .maps("scene")
                .build();
    }

    public static void setField(Object target, String name, Object value) {
        try {
            var f = target.getClass().getDeclaredField(name);
            f.setAccessible(true);
            f.set(target, value);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
