package com.runwarden.orchestrator.api.dto;

import com.runwarden.orchestrator.model.SyncState;
import com.runwarden.orchestrator.model.SyncStatus;

import java.time.Instant;

/**
 * Response body for GET /organizations/{org}/sync.
 * {@code inFlight} is true while a full sync is running in this process.
 */
public record SyncStatusResponse(String organizationId, SyncState state, boolean inFlight,
                                 Instant lastSyncedAt, String lastError) {

    public static SyncStatusResponse from(String organizationId, SyncStatus status, boolean inFlight) {
        if (status == null) {
            return new SyncStatusResponse(organizationId, SyncState.IDLE, inFlight, null, null);
        }
        return new SyncStatusResponse(organizationId, status.getState(), inFlight,
                status.getLastSyncedAt(), status.getLastError());
    }
}
