package com.runwarden.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /stage/run on the sandbox executor.
 * status is "success" or "failure".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StageRunResponse(
        String status,
        Long   duration_ms,
        String error,
        String stderr,
        String deployment_url
) {
    public boolean succeeded() {
        return "success".equalsIgnoreCase(status);
    }

    /** The most useful failure text: explicit error first, then stderr. */
    public String failureText() {
        if (error != null && !error.isBlank()) return error;
        if (stderr != null && !stderr.isBlank()) return stderr.stripTrailing();
        return "Stage reported status '" + status + "' without error output";
    }
}
