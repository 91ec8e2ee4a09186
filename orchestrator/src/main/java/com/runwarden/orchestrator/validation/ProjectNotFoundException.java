package com.runwarden.orchestrator.validation;

/** Thrown when validation is requested for a project that has not been registered. */
public class ProjectNotFoundException extends RuntimeException {

    public ProjectNotFoundException(String projectId) {
        super("Project not found: " + projectId);
    }
}
