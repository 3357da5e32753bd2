package com.patentflow.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A binary file produced by a stage, e.g. a generated DOCX.
 *
 * file_name is "<step_id>_<file_role>.<ext>", so the generation that produced
 * an artifact can be recognised from its name alone.
 *
 * DB table: artifacts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "artifacts")
public class Artifact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "record_id", nullable = false)
    private UUID recordId;

    @Column(name = "stage_key", nullable = false)
    private String stageKey;

    @Column(name = "file_role", nullable = false)
    private String fileRole;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "content_type", nullable = false)
    private String contentType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Basic(fetch = FetchType.LAZY)
    @Column(nullable = false)
    private byte[] content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Artifact() {}   // required by JPA

    public Artifact(UUID recordId, String stageKey, String fileRole,
                    String fileName, String contentType, byte[] content) {
        this.recordId    = recordId;
        this.stageKey    = stageKey;
        this.fileRole    = fileRole;
        this.fileName    = fileName;
        this.contentType = contentType;
        this.content     = content;
        this.sizeBytes   = content.length;
    }

    public UUID    getId()          { return id; }
    public UUID    getRecordId()    { return recordId; }
    public String  getStageKey()    { return stageKey; }
    public String  getFileRole()    { return fileRole; }
    public String  getFileName()    { return fileName; }
    public String  getContentType() { return contentType; }
    public long    getSizeBytes()   { return sizeBytes; }
    public byte[]  getContent()     { return content; }
    public Instant getCreatedAt()   { return createdAt; }
}
