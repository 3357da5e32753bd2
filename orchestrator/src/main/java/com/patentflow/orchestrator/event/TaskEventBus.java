package com.patentflow.orchestrator.event;

/**
 * Outbound channel for task completion and failure events.
 *
 * Delivery is fire-and-forget: callers publish only after the matching state
 * change has committed, and a publishing failure never undoes that change.
 */
public interface TaskEventBus {

    void publish(TaskEvent event);
}
