package com.patentflow.orchestrator.api.dto;

import com.patentflow.orchestrator.model.Artifact;

import java.time.Instant;
import java.util.UUID;

/** Artifact metadata; the content itself is served by the download endpoint. */
public record ArtifactResponse(
        UUID    id,
        String  stageKey,
        String  fileRole,
        String  fileName,
        String  contentType,
        long    sizeBytes,
        Instant createdAt
) {
    public static ArtifactResponse from(Artifact a) {
        return new ArtifactResponse(
                a.getId(),
                a.getStageKey(),
                a.getFileRole(),
                a.getFileName(),
                a.getContentType(),
                a.getSizeBytes(),
                a.getCreatedAt()
        );
    }
}
