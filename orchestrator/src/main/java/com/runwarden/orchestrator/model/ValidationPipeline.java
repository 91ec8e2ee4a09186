package com.runwarden.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One validation of a pull request: the five stages in {@link StageName}
 * order plus the remediation bookkeeping.
 *
 * {@code linkedAgentRunId} is the remediation lock. While it is set the
 * pipeline stays RUNNING but no stage starts; the webhook correlator (or
 * the poller's recovery pass) clears it when the linked run ends.
 *
 * DB table: validation_pipelines  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "validation_pipelines")
public class ValidationPipeline {

    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(name = "pull_request_id")
    private Integer pullRequestId;

    @Column(name = "pull_request_url", nullable = false)
    private String pullRequestUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineStatus status = PipelineStatus.PENDING;

    @Column(name = "current_step")
    private String currentStep;

    @Column(name = "progress_percentage", nullable = false)
    private int progressPercentage = 0;

    @Column(name = "deployment_url")
    private String deploymentUrl;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Remediation runs dispatched so far; compared against the configured ceiling.
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "linked_agent_run_id")
    private UUID linkedAgentRunId;

    @Enumerated(EnumType.STRING)
    @Column(name = "merge_status", nullable = false)
    private MergeStatus mergeStatus = MergeStatus.NOT_REQUESTED;

    @Column(name = "merge_sha")
    private String mergeSha;

    @Column(name = "merge_error", columnDefinition = "TEXT")
    private String mergeError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Always needed together with the pipeline, and read from worker threads
    // outside any transaction, so load eagerly.
    @OneToMany(mappedBy = "pipeline", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("position ASC")
    private List<StageResult> stages = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ValidationPipeline() {}   // required by JPA

    public ValidationPipeline(String organizationId, String projectId,
                              String pullRequestUrl, Integer pullRequestId, Instant createdAt) {
        this.id             = UUID.randomUUID();
        this.createdAt      = createdAt;
        this.updatedAt      = createdAt;
        this.organizationId = organizationId;
        this.projectId      = projectId;
        this.pullRequestUrl = pullRequestUrl;
        this.pullRequestId  = pullRequestId;
        for (StageName name : StageName.ORDER) {
            stages.add(new StageResult(this, name));
        }
    }

    // ------------------------------------------------------------------
    // Stage navigation
    // ------------------------------------------------------------------

    /**
     * The first stage that has not succeeded yet, in fixed stage order.
     * Empty once every stage succeeded.
     */
    public Optional<StageResult> firstUnfinishedStage() {
        return stages.stream()
                .filter(s -> s.getStatus() != StageStatus.SUCCESS)
                .findFirst();
    }

    public Optional<StageResult> failedStage() {
        return stages.stream()
                .filter(s -> s.getStatus() == StageStatus.FAILURE)
                .findFirst();
    }

    public StageResult stage(StageName name) {
        return stages.stream()
                .filter(s -> s.getStageName() == name)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Pipeline " + id + " has no stage " + name));
    }

    public boolean isLastStage(StageResult stage) {
        return stage.getPosition() == StageName.ORDER.size() - 1;
    }

    /** Share of stages that succeeded, 0–100. */
    public void recomputeProgress() {
        long done = stages.stream().filter(s -> s.getStatus() == StageStatus.SUCCESS).count();
        this.progressPercentage = (int) (done * 100 / StageName.ORDER.size());
    }

    public boolean isAwaitingRemediation() {
        return linkedAgentRunId != null;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID              getId()                 { return id; }
    public String            getOrganizationId()     { return organizationId; }
    public String            getProjectId()          { return projectId; }
    public Integer           getPullRequestId()      { return pullRequestId; }
    public String            getPullRequestUrl()     { return pullRequestUrl; }
    public PipelineStatus    getStatus()             { return status; }
    public String            getCurrentStep()        { return currentStep; }
    public int               getProgressPercentage() { return progressPercentage; }
    public String            getDeploymentUrl()      { return deploymentUrl; }
    public String            getErrorMessage()       { return errorMessage; }
    public int               getRetryCount()         { return retryCount; }
    public UUID              getLinkedAgentRunId()   { return linkedAgentRunId; }
    public MergeStatus       getMergeStatus()        { return mergeStatus; }
    public String            getMergeSha()           { return mergeSha; }
    public String            getMergeError()         { return mergeError; }
    public Instant           getCreatedAt()          { return createdAt; }
    public Instant           getUpdatedAt()          { return updatedAt; }
    public Instant           getCompletedAt()        { return completedAt; }
    public List<StageResult> getStages()             { return stages; }

    public void setStatus(PipelineStatus status)          { this.status = status; }
    public void setCurrentStep(String currentStep)        { this.currentStep = currentStep; }
    public void setDeploymentUrl(String deploymentUrl)    { this.deploymentUrl = deploymentUrl; }
    public void setErrorMessage(String errorMessage)      { this.errorMessage = errorMessage; }
    public void setLinkedAgentRunId(UUID runId)           { this.linkedAgentRunId = runId; }
    public void incrementRetryCount()                     { this.retryCount++; }
    public void setCompletedAt(Instant completedAt)       { this.completedAt = completedAt; }

    /** Stamp the modification time; called on every save. */
    public void touch(Instant at) { this.updatedAt = at; }

    public void recordMerge(MergeStatus status, String sha, String error) {
        this.mergeStatus = status;
        this.mergeSha    = sha;
        this.mergeError  = error;
    }
}
