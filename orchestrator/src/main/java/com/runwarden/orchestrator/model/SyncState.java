package com.runwarden.orchestrator.model;

public enum SyncState {
    IDLE,
    SYNCING,
    SUCCESS,
    ERROR
}
