package com.runwarden.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Local view of one run of the remote code-generation agent.
 *
 * The local id is assigned here, before the remote API has accepted the
 * run, so the record can be written optimistically. The external id is
 * filled in once the remote side answers and is never changed afterwards.
 *
 * All observed state flows through {@link #merge(RunUpdate)}, which
 * enforces last-writer-wins by timestamp and the terminal-state rules of
 * {@link AgentRunStatus}.
 *
 * DB table: agent_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "agent_runs")
public class AgentRun {

    @Id
    private UUID id;

    @Version
    private Long version;

    @Column(name = "external_id", unique = true)
    private String externalId;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String prompt;

    @Enumerated(EnumType.STRING)
    @Column(name = "response_type", nullable = false)
    private ResponseType responseType = ResponseType.PULL_REQUEST;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AgentRunStatus status = AgentRunStatus.PENDING;

    @Column(name = "progress_percentage", nullable = false)
    private int progressPercentage = 0;

    @Column(name = "current_step")
    private String currentStep;

    // Opaque JSON handed back by the remote agent once the run is terminal.
    @Column(name = "result_payload", columnDefinition = "TEXT")
    private String resultPayload;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "web_url")
    private String webUrl;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected AgentRun() {}   // required by JPA

    public AgentRun(String organizationId, String prompt, ResponseType responseType, Instant createdAt) {
        this.id             = UUID.randomUUID();
        this.organizationId = organizationId;
        this.prompt         = prompt;
        this.responseType   = responseType != null ? responseType : ResponseType.PULL_REQUEST;
        this.createdAt      = createdAt;
        this.lastUpdatedAt  = createdAt;
    }

    // ------------------------------------------------------------------
    // Merge
    // ------------------------------------------------------------------

    /**
     * Apply a timestamped observation.
     *
     * Rules, in order:
     * <ol>
     *   <li>An update older than {@code lastUpdatedAt} is STALE and ignored entirely.</li>
     *   <li>A different external id than the one already recorded is REJECTED.</li>
     *   <li>A terminal record refuses any status other than its own.</li>
     *   <li>Otherwise every non-null field overwrites the stored one.</li>
     * </ol>
     * {@code lastUpdatedAt} moves to any newer observation, including one that
     * only confirms the stored values (reported as UNCHANGED), so an older
     * update arriving afterwards is still STALE. Replaying the same
     * observation leaves the record equal.
     */
    public MergeResult merge(RunUpdate update) {
        Instant at = update.observedAt();
        if (at != null && lastUpdatedAt != null && at.isBefore(lastUpdatedAt)) {
            return MergeResult.STALE;
        }
        if (update.externalId() != null && externalId != null
                && !externalId.equals(update.externalId())) {
            return MergeResult.REJECTED;
        }
        if (status.isTerminal() && update.status() != null && update.status() != status) {
            return MergeResult.REJECTED;
        }

        boolean changed = false;
        if (update.externalId() != null && externalId == null) {
            externalId = update.externalId();
            changed = true;
        }
        if (update.status() != null && update.status() != status) {
            status = update.status();
            changed = true;
            if (status == AgentRunStatus.COMPLETED && update.progressPercentage() == null
                    && progressPercentage != 100) {
                progressPercentage = 100;
            }
        }
        if (update.progressPercentage() != null) {
            int clamped = Math.max(0, Math.min(100, update.progressPercentage()));
            if (clamped != progressPercentage) {
                progressPercentage = clamped;
                changed = true;
            }
        }
        changed |= !Objects.equals(currentStep, coalesce(update.currentStep(), currentStep));
        currentStep = coalesce(update.currentStep(), currentStep);
        changed |= !Objects.equals(resultPayload, coalesce(update.resultPayload(), resultPayload));
        resultPayload = coalesce(update.resultPayload(), resultPayload);
        changed |= !Objects.equals(errorMessage, coalesce(update.errorMessage(), errorMessage));
        errorMessage = coalesce(update.errorMessage(), errorMessage);
        changed |= !Objects.equals(webUrl, coalesce(update.webUrl(), webUrl));
        webUrl = coalesce(update.webUrl(), webUrl);

        if (at != null && (lastUpdatedAt == null || at.isAfter(lastUpdatedAt))) {
            lastUpdatedAt = at;
        }
        return changed ? MergeResult.APPLIED : MergeResult.UNCHANGED;
    }

    private static String coalesce(String incoming, String current) {
        return incoming != null ? incoming : current;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()                 { return id; }
    public String         getExternalId()         { return externalId; }
    public String         getOrganizationId()     { return organizationId; }
    public String         getPrompt()             { return prompt; }
    public ResponseType   getResponseType()       { return responseType; }
    public AgentRunStatus getStatus()             { return status; }
    public int            getProgressPercentage() { return progressPercentage; }
    public String         getCurrentStep()        { return currentStep; }
    public String         getResultPayload()      { return resultPayload; }
    public String         getErrorMessage()       { return errorMessage; }
    public String         getWebUrl()             { return webUrl; }
    public int            getRetryCount()         { return retryCount; }
    public Instant        getCreatedAt()          { return createdAt; }
    public Instant        getLastUpdatedAt()      { return lastUpdatedAt; }

    public void setRetryCount(int retryCount)     { this.retryCount = retryCount; }
}
