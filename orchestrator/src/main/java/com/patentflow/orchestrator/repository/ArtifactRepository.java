package com.patentflow.orchestrator.repository;

import com.patentflow.orchestrator.model.Artifact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Binary artifacts attached to workflow records.
 */
public interface ArtifactRepository extends JpaRepository<Artifact, UUID> {

    /** Artifacts of one record whose file name starts with the given step id prefix. */
    List<Artifact> findByRecordIdAndFileNameStartingWith(UUID recordId, String prefix);

    List<Artifact> findByRecordIdAndStageKeyOrderByFileRoleAsc(UUID recordId, String stageKey);
}
