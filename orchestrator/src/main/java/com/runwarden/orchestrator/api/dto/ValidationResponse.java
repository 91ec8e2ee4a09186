package com.runwarden.orchestrator.api.dto;

import com.runwarden.orchestrator.model.MergeStatus;
import com.runwarden.orchestrator.model.PipelineStatus;
import com.runwarden.orchestrator.model.ValidationPipeline;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for the /validations endpoints: the pipeline plus every
 * stage in execution order.
 */
public record ValidationResponse(
        UUID                id,
        String              organizationId,
        String              projectId,
        String              pullRequestUrl,
        Integer             pullRequestId,
        PipelineStatus      status,
        String              currentStep,
        int                 progressPercentage,
        String              deploymentUrl,
        String              errorMessage,
        int                 retryCount,
        UUID                linkedAgentRunId,
        MergeStatus         mergeStatus,
        String              mergeSha,
        String              mergeError,
        List<StageResponse> stages,
        Instant             createdAt,
        Instant             updatedAt,
        Instant             completedAt
) {
    public static ValidationResponse from(ValidationPipeline p) {
        return new ValidationResponse(
                p.getId(),
                p.getOrganizationId(),
                p.getProjectId(),
                p.getPullRequestUrl(),
                p.getPullRequestId(),
                p.getStatus(),
                p.getCurrentStep(),
                p.getProgressPercentage(),
                p.getDeploymentUrl(),
                p.getErrorMessage(),
                p.getRetryCount(),
                p.getLinkedAgentRunId(),
                p.getMergeStatus(),
                p.getMergeSha(),
                p.getMergeError(),
                p.getStages().stream().map(StageResponse::from).toList(),
                p.getCreatedAt(),
                p.getUpdatedAt(),
                p.getCompletedAt()
        );
    }
}
