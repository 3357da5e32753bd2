package com.patentflow.orchestrator.api.dto;

import com.patentflow.orchestrator.service.ControlResult;

/** Response body for cancel, reset and heartbeat. */
public record ControlResponse(boolean ok, String message) {

    public static ControlResponse from(ControlResult r) {
        return new ControlResponse(r.ok(), r.message());
    }
}
