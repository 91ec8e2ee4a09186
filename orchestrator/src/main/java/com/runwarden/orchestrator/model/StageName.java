package com.runwarden.orchestrator.model;

import java.util.Arrays;
import java.util.List;

/**
 * The validation stages, in the only order they may run.
 *
 * Each stage maps to one {@link StageResult} row and one call to the
 * sandbox executor. A stage starts only after its predecessor succeeded.
 */
public enum StageName {
    ENVIRONMENT_SETUP("Environment setup"),
    DEPENDENCY_INSTALL("Dependency install"),
    BUILD("Build"),
    TEST("Test"),
    DEPLOYMENT_VALIDATE("Deployment validation");

    public static final List<StageName> ORDER = Arrays.asList(values());

    private final String label;

    StageName(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Name the sandbox executor knows this stage by. */
    public String wireName() {
        return name().toLowerCase();
    }
}
