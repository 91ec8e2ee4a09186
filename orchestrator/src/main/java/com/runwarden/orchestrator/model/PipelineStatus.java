package com.runwarden.orchestrator.model;

/**
 * States of a validation pipeline.
 *
 * PENDING → RUNNING → COMPLETED | FAILED | CANCELLED.
 * A RUNNING pipeline with a linked remediation run is paused: no stage
 * starts until that run ends.
 */
public enum PipelineStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
