package com.runwarden.orchestrator.api.dto;

import com.runwarden.orchestrator.model.ResponseType;

import java.util.Map;

/**
 * Request body for POST /organizations/{org}/agent-runs.
 *
 * Required: prompt
 * Optional: context (forwarded to the agent as run metadata), responseType
 *   (defaults to PULL_REQUEST)
 */
public record CreateRunRequest(String prompt, Map<String, Object> context, ResponseType responseType) {

    public CreateRunRequest {
        if (responseType == null) responseType = ResponseType.PULL_REQUEST;
    }
}
