package com.runwarden.orchestrator.sync;

/**
 * Thrown when an intent does not fit the run's current state,
 * e.g. resuming a run that already finished.
 */
public class RunStateException extends RuntimeException {

    public RunStateException(String message) {
        super(message);
    }
}
