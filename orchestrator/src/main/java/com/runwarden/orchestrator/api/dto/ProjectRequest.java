package com.runwarden.orchestrator.api.dto;

/**
 * Request body for PUT /projects/{id}.
 *
 * Required: organizationId
 * Optional: repositoryUrl, autoMergeEnabled (defaults to false)
 */
public record ProjectRequest(String organizationId, String repositoryUrl, Boolean autoMergeEnabled) {}
