package com.runwarden.orchestrator.model;

import jakarta.persistence.*;
import java.util.UUID;

/**
 * Result of one validation stage within a pipeline.
 *
 * Rows are created up front, one per {@link StageName}, all PENDING; the
 * orchestrator walks them in {@code position} order.
 *
 * DB table: validation_stages  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "validation_stages")
public class StageResult {

    @Id
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "pipeline_id", nullable = false)
    private ValidationPipeline pipeline;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage_name", nullable = false)
    private StageName stageName;

    @Column(nullable = false)
    private int position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageStatus status = StageStatus.PENDING;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(columnDefinition = "TEXT")
    private String error;

    // Number of times the executor has been asked to run this stage.
    @Column(nullable = false)
    private int attempts = 0;

    // Set once a remediation run fixed an earlier failure of this stage.
    @Column(nullable = false)
    private boolean remediated = false;

    protected StageResult() {}   // required by JPA

    StageResult(ValidationPipeline pipeline, StageName stageName) {
        this.id        = UUID.randomUUID();
        this.pipeline  = pipeline;
        this.stageName = stageName;
        this.position  = stageName.ordinal();
    }

    public void markRunning() {
        this.status = StageStatus.RUNNING;
        this.error  = null;
        this.attempts++;
    }

    public void markSucceeded(long durationMs) {
        this.status     = StageStatus.SUCCESS;
        this.durationMs = durationMs;
        this.error      = null;
    }

    public void markFailed(long durationMs, String error) {
        this.status     = StageStatus.FAILURE;
        this.durationMs = durationMs;
        this.error      = error;
    }

    /** A remediation run finished successfully: queue this stage to run again. */
    public void markRemediated() {
        this.status     = StageStatus.PENDING;
        this.remediated = true;
    }

    public UUID        getId()         { return id; }
    public StageName   getStageName()  { return stageName; }
    public int         getPosition()   { return position; }
    public StageStatus getStatus()     { return status; }
    public Long        getDurationMs() { return durationMs; }
    public String      getError()      { return error; }
    public int         getAttempts()   { return attempts; }
    public boolean     isRemediated()  { return remediated; }
}
