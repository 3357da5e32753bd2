package com.patentflow.orchestrator.service;

/**
 * Outcome of a manual control action such as cancel or reset.
 */
public record ControlResult(boolean ok, String message) {

    static ControlResult ok(String message)       { return new ControlResult(true, message); }
    static ControlResult refused(String message)  { return new ControlResult(false, message); }
}
