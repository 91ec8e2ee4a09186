package com.runwarden.orchestrator.executor.dto;

/**
 * Result of running one stage.
 *
 * @param success       whether the stage passed
 * @param durationMs    wall-clock time spent in the sandbox
 * @param error         failure output (null on success)
 * @param deploymentUrl set by a stage that deployed the pull request
 */
public record StageOutcome(boolean success, long durationMs, String error, String deploymentUrl) {

    public static StageOutcome success(long durationMs) {
        return new StageOutcome(true, durationMs, null, null);
    }

    public static StageOutcome failure(long durationMs, String error) {
        return new StageOutcome(false, durationMs, error, null);
    }
}
