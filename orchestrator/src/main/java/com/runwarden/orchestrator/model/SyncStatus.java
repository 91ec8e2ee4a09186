package com.runwarden.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Full-sync bookkeeping, one row per organization.
 * Written only by the sync engine; the poller reads it to stay out of the
 * way of a sync in progress.
 *
 * DB table: sync_status  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "sync_status")
public class SyncStatus {

    @Id
    @Column(name = "organization_id")
    private String organizationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SyncState state = SyncState.IDLE;

    @Column(name = "last_synced_at")
    private Instant lastSyncedAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    protected SyncStatus() {}   // required by JPA

    public SyncStatus(String organizationId) {
        this.organizationId = organizationId;
    }

    public void markSyncing() {
        this.state = SyncState.SYNCING;
    }

    public void markSuccess(Instant at) {
        this.state        = SyncState.SUCCESS;
        this.lastSyncedAt = at;
        this.lastError    = null;
    }

    public void markError(String error) {
        this.state     = SyncState.ERROR;
        this.lastError = error;
    }

    public String    getOrganizationId() { return organizationId; }
    public SyncState getState()          { return state; }
    public Instant   getLastSyncedAt()   { return lastSyncedAt; }
    public String    getLastError()      { return lastError; }
}
