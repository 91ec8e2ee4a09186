package com.runwarden.orchestrator.api.dto;

import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.model.AgentRunStatus;
import com.runwarden.orchestrator.model.ResponseType;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for the agent-run endpoints.
 * {@code externalId} is null until the remote agent has accepted the run.
 */
public record RunResponse(
        UUID           id,
        String         externalId,
        String         organizationId,
        AgentRunStatus status,
        boolean        terminal,
        ResponseType   responseType,
        String         prompt,
        int            progressPercentage,
        String         currentStep,
        String         result,
        String         errorMessage,
        String         webUrl,
        Instant        createdAt,
        Instant        lastUpdatedAt
) {
    public static RunResponse from(AgentRun r) {
        return new RunResponse(
                r.getId(),
                r.getExternalId(),
                r.getOrganizationId(),
                r.getStatus(),
                r.isTerminal(),
                r.getResponseType(),
                r.getPrompt(),
                r.getProgressPercentage(),
                r.getCurrentStep(),
                r.getResultPayload(),
                r.getErrorMessage(),
                r.getWebUrl(),
                r.getCreatedAt(),
                r.getLastUpdatedAt()
        );
    }
}
