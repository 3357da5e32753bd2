package com.patentflow.orchestrator.api.dto;

import com.patentflow.orchestrator.service.AdmissionResult;

import java.time.Instant;

/**
 * Response body for POST /records/{recordId}/stages/{stageKey}/start.
 *
 * On rejection only accepted, kind and reason are set.
 */
public record AdmissionResponse(
        boolean accepted,
        String  kind,
        String  stepId,
        String  jobId,
        Instant enqueuedAt,
        String  reason
) {
    public static AdmissionResponse from(AdmissionResult r) {
        return new AdmissionResponse(
                r.accepted(),
                r.kind().name(),
                r.stepId(),
                r.jobHandle() == null ? null : r.jobHandle().jobId(),
                r.jobHandle() == null ? null : r.jobHandle().enqueuedAt(),
                r.reason()
        );
    }
}
