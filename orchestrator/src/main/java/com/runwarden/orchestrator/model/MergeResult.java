package com.runwarden.orchestrator.model;

/**
 * Outcome of merging a {@link RunUpdate} into a stored {@link AgentRun}.
 */
public enum MergeResult {
    /** At least one field changed. */
    APPLIED,
    /** Update was current but carried nothing new (duplicate delivery). */
    UNCHANGED,
    /** Update is older than the stored record. */
    STALE,
    /** Record is terminal (or the external id conflicts) and refuses the update. */
    REJECTED
}
