package com.runwarden.orchestrator.store;

import com.runwarden.orchestrator.model.AgentRunStatus;

import java.time.Instant;
import java.util.Set;

/**
 * Filters for listing agent runs. Every field is optional.
 *
 * @param statuses      keep runs in any of these states
 * @param query         case-insensitive substring of prompt, current step or external id
 * @param createdAfter  inclusive lower bound on createdAt
 * @param createdBefore exclusive upper bound on createdAt
 */
public record RunFilter(Set<AgentRunStatus> statuses, String query,
                        Instant createdAfter, Instant createdBefore) {

    public static RunFilter none() {
        return new RunFilter(null, null, null, null);
    }
}
