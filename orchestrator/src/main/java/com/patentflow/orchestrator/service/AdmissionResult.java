package com.patentflow.orchestrator.service;

import com.patentflow.orchestrator.queue.JobHandle;

/**
 * Outcome of {@link TaskAdmissionService#start}.
 *
 * Rejections are values, not exceptions: the caller maps {@link Kind} to its
 * own error surface.
 */
public record AdmissionResult(Kind kind, String stepId, JobHandle jobHandle, String reason) {

    public enum Kind { ACCEPTED, VALIDATION, CONFLICT, NOT_FOUND, SUBMISSION }

    public boolean accepted() {
        return kind == Kind.ACCEPTED;
    }

    static AdmissionResult accepted(String stepId, JobHandle handle) {
        return new AdmissionResult(Kind.ACCEPTED, stepId, handle, null);
    }

    static AdmissionResult rejected(Kind kind, String reason) {
        return new AdmissionResult(kind, null, null, reason);
    }

    static AdmissionResult submissionFailed(String stepId, String reason) {
        return new AdmissionResult(Kind.SUBMISSION, stepId, null, reason);
    }
}
