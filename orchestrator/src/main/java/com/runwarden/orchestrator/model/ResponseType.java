package com.runwarden.orchestrator.model;

/** What the remote agent is asked to hand back when it finishes. */
public enum ResponseType {
    PLAIN,
    PLAN,
    PULL_REQUEST
}
