package com.patentflow.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One pipeline instance, e.g. one patent draft.
 *
 * The record itself is owned by the surrounding application. The orchestrator
 * only reads stage inputs from, and writes stage outputs to, its named fields.
 *
 * DB tables: workflow_records, record_fields  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_records")
public class WorkflowRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Human-readable id such as "PAT-2024-0001"; namespaces every step id.
    @Column(nullable = false, unique = true)
    private String reference;

    // Loaded eagerly: workers read the fields outside of any open session.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "record_fields", joinColumns = @JoinColumn(name = "record_id"))
    @MapKeyColumn(name = "field_name")
    @Column(name = "field_value", columnDefinition = "TEXT")
    private Map<String, String> fields = new HashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkflowRecord() {}   // required by JPA

    public WorkflowRecord(String reference) {
        this.reference = reference;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                getId()        { return id; }
    public String              getReference() { return reference; }
    public Map<String, String> getFields()    { return fields; }
    public Instant             getCreatedAt() { return createdAt; }
    public Instant             getUpdatedAt() { return updatedAt; }

    public String getField(String name)               { return fields.get(name); }
    public void   setField(String name, String value) { fields.put(name, value); }

    /** True when the field exists and holds more than whitespace. */
    public boolean hasText(String name) {
        String value = fields.get(name);
        return value != null && !value.isBlank();
    }
}
