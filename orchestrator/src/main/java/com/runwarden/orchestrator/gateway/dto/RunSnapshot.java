package com.runwarden.orchestrator.gateway.dto;

import com.runwarden.orchestrator.model.AgentRunStatus;
import com.runwarden.orchestrator.model.RunUpdate;

import java.time.Instant;

/**
 * What the remote agent API reports about one run at one moment.
 *
 * {@code updatedAt} is the remote system's own modification time; it is
 * null when the API does not report one, in which case the caller stamps
 * the snapshot with the time the request was issued.
 */
public record RunSnapshot(
        String         externalId,
        String         organizationId,
        AgentRunStatus status,
        Integer        progressPercentage,
        String         currentStep,
        String         resultPayload,
        String         errorMessage,
        String         webUrl,
        String         prompt,
        Instant        createdAt,
        Instant        updatedAt
) {
    /** Convert to a store update, ordered by the remote timestamp when present. */
    public RunUpdate toUpdate(Instant requestIssuedAt) {
        Instant at = updatedAt != null ? updatedAt : requestIssuedAt;
        return new RunUpdate(at, externalId, status, progressPercentage,
                currentStep, resultPayload, errorMessage, webUrl);
    }
}
