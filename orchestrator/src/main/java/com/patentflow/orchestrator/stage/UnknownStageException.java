package com.patentflow.orchestrator.stage;

/**
 * Thrown when a stage key is not registered.
 */
public class UnknownStageException extends RuntimeException {

    public UnknownStageException(String stageKey) {
        super("Unknown stage: '" + stageKey + "'");
    }
}
