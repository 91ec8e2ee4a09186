package com.runwarden.orchestrator.model;

/** Outcome of the auto-merge attempted after a pipeline completes. */
public enum MergeStatus {
    NOT_REQUESTED,
    MERGED,
    FAILED
}
