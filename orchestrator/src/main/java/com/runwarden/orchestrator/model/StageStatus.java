package com.runwarden.orchestrator.model;

/**
 * Execution state of a single validation stage.
 *
 * Transitions:
 *   PENDING → RUNNING → SUCCESS
 *   RUNNING → FAILURE
 *   FAILURE → PENDING   (linked remediation run completed, stage is retried)
 */
public enum StageStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE
}
