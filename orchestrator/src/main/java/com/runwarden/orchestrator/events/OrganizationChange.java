package com.runwarden.orchestrator.events;

import java.time.Instant;
import java.util.UUID;

/**
 * "Something changed, re-render" signal for one organization.
 * Carries just enough to let a subscriber decide what to reload; it is
 * safe to drop or merge duplicates.
 */
public record OrganizationChange(String organizationId, Kind kind, UUID subjectId, Instant at) {

    public enum Kind { RUNS, PIPELINE, SYNC }
}
