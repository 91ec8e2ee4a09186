package com.runwarden.orchestrator.validation;

import java.util.UUID;

public class PipelineNotFoundException extends RuntimeException {

    public PipelineNotFoundException(UUID pipelineId) {
        super("Validation pipeline not found: " + pipelineId);
    }
}
