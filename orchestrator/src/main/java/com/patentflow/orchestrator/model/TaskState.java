package com.patentflow.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Mutable status and bookkeeping of one stage on one workflow record.
 *
 * Exactly one row exists per (record, stage_key). The row is created lazily on
 * first admission; a missing row reads as IDLE with zero counters.
 *
 * All transitions go through {@link #begin}, {@link #complete} and {@link #fail},
 * which are only called while the row is locked (SELECT ... FOR UPDATE).
 *
 * DB table: task_states  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "task_states",
       uniqueConstraints = @UniqueConstraint(columnNames = {"record_id", "stage_key"}))
public class TaskState {

    /** Recorded in last_error when a run commits successfully. */
    public static final String SUCCESS_MARKER = "success";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "record_id", nullable = false)
    private WorkflowRecord record;

    // Read-only view of the FK so queries and callers never touch the lazy proxy.
    @Column(name = "record_id", insertable = false, updatable = false)
    private UUID recordId;

    @Column(name = "stage_key", nullable = false)
    private String stageKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.IDLE;

    // Minted fresh on every admitted run, e.g. "PAT-7-R2R-3".
    @Column(name = "step_id")
    private String stepId;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "last_heartbeat")
    private Instant lastHeartbeat;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "run_count", nullable = false)
    private int runCount = 0;

    @Column(name = "success_count", nullable = false)
    private int successCount = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "last_cost", nullable = false)
    private double lastCost = 0.0;

    @Column(name = "last_time_seconds", nullable = false)
    private double lastTimeSeconds = 0.0;

    @Column(name = "accumulated_cost", nullable = false)
    private double accumulatedCost = 0.0;

    @Column(name = "accumulated_time_seconds", nullable = false)
    private double accumulatedTimeSeconds = 0.0;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected TaskState() {}   // required by JPA

    public TaskState(WorkflowRecord record, String stageKey) {
        this.record   = record;
        this.recordId = record.getId();
        this.stageKey = stageKey;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** IDLE / DONE / FAILED → RUNNING. Counts the run even if it later fails. */
    public void begin(String newStepId, Instant now) {
        this.status        = TaskStatus.RUNNING;
        this.stepId        = newStepId;
        this.startedAt     = now;
        this.lastHeartbeat = now;
        this.finishedAt    = null;
        this.lastError     = null;
        this.runCount++;
    }

    /**
     * RUNNING → DONE. Adds the reported cost and elapsed time to the accumulators;
     * negative or non-finite reports count as zero so the sums never decrease.
     */
    public void complete(double cost, double timeSeconds, Instant now) {
        double safeCost = nonNegative(cost);
        double safeTime = nonNegative(timeSeconds);
        this.status                  = TaskStatus.DONE;
        this.lastError               = SUCCESS_MARKER;
        this.successCount++;
        this.lastCost                = safeCost;
        this.lastTimeSeconds         = safeTime;
        this.accumulatedCost        += safeCost;
        this.accumulatedTimeSeconds += safeTime;
        this.finishedAt              = now;
        touchHeartbeat(now);
    }

    /** → FAILED with a human-readable cause. Accumulators are left untouched. */
    public void fail(String error, Instant now) {
        this.status     = TaskStatus.FAILED;
        this.lastError  = error;
        this.finishedAt = now;
    }

    /** Moves last_heartbeat forward; an older timestamp is ignored. */
    public void touchHeartbeat(Instant now) {
        if (lastHeartbeat == null || now.isAfter(lastHeartbeat)) {
            this.lastHeartbeat = now;
        }
    }

    public boolean isRunning() {
        return status == TaskStatus.RUNNING;
    }

    private static double nonNegative(double value) {
        return Double.isFinite(value) && value > 0 ? value : 0.0;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID       getId()                     { return id; }
    public UUID       getRecordId()               { return recordId; }
    public String     getStageKey()               { return stageKey; }
    public TaskStatus getStatus()                 { return status; }
    public String     getStepId()                 { return stepId; }
    public Instant    getStartedAt()              { return startedAt; }
    public Instant    getLastHeartbeat()          { return lastHeartbeat; }
    public Instant    getFinishedAt()             { return finishedAt; }
    public int        getRunCount()               { return runCount; }
    public int        getSuccessCount()           { return successCount; }
    public String     getLastError()              { return lastError; }
    public double     getLastCost()               { return lastCost; }
    public double     getLastTimeSeconds()        { return lastTimeSeconds; }
    public double     getAccumulatedCost()        { return accumulatedCost; }
    public double     getAccumulatedTimeSeconds() { return accumulatedTimeSeconds; }

    // Used by the reaper tests and by data fix-ups; normal flow goes through begin().
    public void setStartedAt(Instant t)     { this.startedAt = t; }
    public void setLastHeartbeat(Instant t) { this.lastHeartbeat = t; }
}
