package com.runwarden.orchestrator.api.dto;

/** Request body for POST /validations. Both fields are required. */
public record StartValidationRequest(String projectId, String pullRequestUrl) {}
