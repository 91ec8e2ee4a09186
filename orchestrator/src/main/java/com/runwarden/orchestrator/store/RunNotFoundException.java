package com.runwarden.orchestrator.store;

import java.util.UUID;

/**
 * Thrown when a run id does not exist in the given organization.
 */
public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String organizationId, UUID runId) {
        super("Agent run " + runId + " not found in organization " + organizationId);
    }
}
