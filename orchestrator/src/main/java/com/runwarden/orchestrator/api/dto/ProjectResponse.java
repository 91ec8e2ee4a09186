package com.runwarden.orchestrator.api.dto;

import com.runwarden.orchestrator.model.Project;

import java.time.Instant;

public record ProjectResponse(String id, String organizationId, String repositoryUrl,
                              boolean autoMergeEnabled, Instant updatedAt) {

    public static ProjectResponse from(Project p) {
        return new ProjectResponse(p.getId(), p.getOrganizationId(), p.getRepositoryUrl(),
                p.isAutoMergeEnabled(), p.getUpdatedAt());
    }
}
