package com.patentflow.orchestrator.engine;

import com.patentflow.orchestrator.model.Artifact;
import com.patentflow.orchestrator.repository.ArtifactRepository;
import com.patentflow.orchestrator.stage.ArtifactOutput;
import com.patentflow.orchestrator.stage.StepIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Binary files produced by stage runs.
 *
 * Only the latest generation of a stage's files is kept. Every file name starts
 * with the step id that produced it, and all runs of one stage on one record
 * share the step-id prefix, so a new generation deletes everything under that
 * prefix before storing its own files.
 */
@Component
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final ArtifactRepository artifactRepo;

    public ArtifactStore(ArtifactRepository artifactRepo) {
        this.artifactRepo = artifactRepo;
    }

    /**
     * Replace the stage's previous files with the given ones.
     * Must run inside the caller's commit transaction.
     */
    public List<Artifact> replace(UUID recordId, String stageKey, String stepId,
                                  Map<ArtifactOutput, byte[]> files) {
        String generation = StepIds.prefixOf(stepId) + "-";
        List<Artifact> stale = artifactRepo.findByRecordIdAndFileNameStartingWith(recordId, generation);
        if (!stale.isEmpty()) {
            artifactRepo.deleteAll(stale);
            log.info("Deleted {} previous artifact(s) under '{}' for record {}",
                    stale.size(), generation, recordId);
        }

        List<Artifact> stored = new ArrayList<>();
        files.forEach((output, content) -> {
            Artifact artifact = new Artifact(recordId, stageKey, output.fileRole(),
                    output.fileNameFor(stepId), output.contentType(), content);
            stored.add(artifactRepo.save(artifact));
            log.info("Stored artifact {} ({} bytes) for record {}",
                    artifact.getFileName(), content.length, recordId);
        });
        return stored;
    }

    public List<Artifact> list(UUID recordId, String stageKey) {
        return artifactRepo.findByRecordIdAndStageKeyOrderByFileRoleAsc(recordId, stageKey);
    }

    /** The artifact, if it exists and belongs to the record. */
    public Optional<Artifact> find(UUID recordId, UUID artifactId) {
        return artifactRepo.findById(artifactId).filter(a -> recordId.equals(a.getRecordId()));
    }
}
