package com.runwarden.orchestrator.webhook;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.runwarden.orchestrator.model.AgentRunStatus;
import com.runwarden.orchestrator.model.RunUpdate;

import java.time.Instant;

/**
 * Body of a run-status callback pushed by the remote agent.
 *
 * Only {@code externalId} is required. {@code timestamp} is when the
 * remote side produced the event; when it is missing the receipt time is
 * used as the ordering key instead.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookPayload(
        @JsonProperty("agent_run_id") @JsonAlias({"id", "run_id"}) String externalId,
        @JsonProperty("organization_id") String organizationId,
        String status,
        @JsonProperty("progress_percentage") Integer progress,
        @JsonProperty("current_step") String currentStep,
        String error,
        JsonNode result,
        @JsonProperty("web_url") String webUrl,
        @JsonAlias({"updated_at", "event_time"}) Instant timestamp
) {
    public RunUpdate toUpdate(Instant receivedAt) {
        return new RunUpdate(
                timestamp != null ? timestamp : receivedAt,
                externalId,
                status != null ? AgentRunStatus.fromRemote(status) : null,
                progress,
                currentStep,
                result == null || result.isNull() ? null
                        : result.isTextual() ? result.asText() : result.toString(),
                error,
                webUrl);
    }
}
