package com.runwarden.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Per-project settings the orchestrator needs: which organization owns
 * the project, and whether a validated pull request is merged automatically.
 *
 * DB table: projects  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "projects")
public class Project {

    @Id
    private String id;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(name = "repository_url")
    private String repositoryUrl;

    @Column(name = "auto_merge_enabled", nullable = false)
    private boolean autoMergeEnabled = false;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Project() {}   // required by JPA

    public Project(String id, String organizationId) {
        this.id             = id;
        this.organizationId = organizationId;
    }

    public String  getId()               { return id; }
    public String  getOrganizationId()   { return organizationId; }
    public String  getRepositoryUrl()    { return repositoryUrl; }
    public boolean isAutoMergeEnabled()  { return autoMergeEnabled; }
    public Instant getUpdatedAt()        { return updatedAt; }

    public void setOrganizationId(String organizationId) { this.organizationId = organizationId; }
    public void setRepositoryUrl(String repositoryUrl)   { this.repositoryUrl = repositoryUrl; }
    public void setAutoMergeEnabled(boolean enabled)     { this.autoMergeEnabled = enabled; }
    public void touch(Instant at)                        { this.updatedAt = at; }
}
