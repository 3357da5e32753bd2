package com.patentflow.orchestrator.api.dto;

import com.patentflow.orchestrator.stage.StageDefinition;

import java.util.List;

/** One entry of GET /stages. Durations are in seconds. */
public record StageResponse(
        String       key,
        String       label,
        String       endpoint,
        String       stepIdPrefix,
        long         timeoutSeconds,
        long         heartbeatIntervalSeconds,
        List<String> requiredFields,
        List<String> outputFields,
        List<String> artifactRoles
) {
    public static StageResponse from(StageDefinition d) {
        return new StageResponse(
                d.key(),
                d.label(),
                d.endpointName(),
                d.stepIdPrefix(),
                d.timeout().toSeconds(),
                d.heartbeatInterval().toSeconds(),
                d.requiredFields(),
                List.copyOf(d.fieldMapping().keySet()),
                d.artifactOutputs().values().stream().map(o -> o.fileRole()).toList()
        );
    }
}
