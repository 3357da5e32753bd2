package com.patentflow.orchestrator.engine;

/**
 * The heartbeat loop stopped while the remote call was still running, or the
 * supervised work failed with a checked exception.
 */
public class SupervisorException extends RuntimeException {

    public SupervisorException(String message) {
        super(message);
    }

    public SupervisorException(String message, Throwable cause) {
        super(message, cause);
    }
}
