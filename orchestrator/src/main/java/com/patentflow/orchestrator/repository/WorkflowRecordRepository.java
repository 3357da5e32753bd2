package com.patentflow.orchestrator.repository;

import com.patentflow.orchestrator.model.WorkflowRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD access to workflow records.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface WorkflowRecordRepository extends JpaRepository<WorkflowRecord, UUID> {

    Optional<WorkflowRecord> findByReference(String reference);
}
