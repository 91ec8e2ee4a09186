package com.runwarden.orchestrator.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Wire shape of a run as returned by the remote agent API.
 * Unknown fields are skipped; the API adds fields regularly.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentRunResponse(
        String   id,
        String   organization_id,
        String   status,
        String   created_at,
        String   updated_at,
        String   web_url,
        String   prompt,
        Integer  progress_percentage,
        String   current_step,
        String   error,
        JsonNode result
) {

    /** One page of GET /agent/runs. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Page(List<AgentRunResponse> items, int total, int page, int size, int pages) {}
}
