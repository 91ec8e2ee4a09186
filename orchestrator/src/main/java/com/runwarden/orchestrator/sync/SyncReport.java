package com.runwarden.orchestrator.sync;

import java.time.Instant;

/**
 * Counts from one full sync of an organization.
 */
public record SyncReport(String organizationId, int fetched, int applied,
                         int imported, int unchanged, int failed, Instant finishedAt) {}
