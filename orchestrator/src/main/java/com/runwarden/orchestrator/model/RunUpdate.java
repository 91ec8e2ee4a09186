package com.runwarden.orchestrator.model;

import java.time.Instant;

/**
 * A partial, timestamped observation of an agent run.
 *
 * Produced by the sync engine (create/resume/cancel/poll) and by the
 * webhook correlator. Null fields mean "not observed" and leave the stored
 * value untouched. {@code observedAt} is the ordering key for
 * last-writer-wins merging.
 */
public record RunUpdate(
        Instant        observedAt,
        String         externalId,
        AgentRunStatus status,
        Integer        progressPercentage,
        String         currentStep,
        String         resultPayload,
        String         errorMessage,
        String         webUrl
) {
    public static RunUpdate status(Instant at, AgentRunStatus status) {
        return new RunUpdate(at, null, status, null, null, null, null, null);
    }

    public RunUpdate withCurrentStep(String step) {
        return new RunUpdate(observedAt, externalId, status, progressPercentage,
                step, resultPayload, errorMessage, webUrl);
    }

    public RunUpdate withErrorMessage(String error) {
        return new RunUpdate(observedAt, externalId, status, progressPercentage,
                currentStep, resultPayload, error, webUrl);
    }
}
