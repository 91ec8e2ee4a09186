package com.runwarden.orchestrator.api.dto;

/** Request body for POST /organizations/{org}/agent-runs/{id}/resume. */
public record ResumeRunRequest(String instruction) {}
