package com.runwarden.orchestrator.executor.dto;

import java.util.UUID;

/**
 * Everything the sandbox needs to locate the code under validation.
 * deploymentUrl is null until the deployment stage has produced one.
 */
public record StageContext(
        UUID   pipelineId,
        String projectId,
        String repositoryUrl,
        String pullRequestUrl,
        String deploymentUrl
) {}
