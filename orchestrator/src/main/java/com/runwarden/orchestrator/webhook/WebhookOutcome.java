package com.runwarden.orchestrator.webhook;

/** What handling one webhook did to the local view. */
public enum WebhookOutcome {
    /** The run changed. */
    APPLIED,
    /** Already known: a redelivery or an update carrying nothing new. */
    DUPLICATE,
    /** Older than what the store already holds. */
    STALE,
    /** No local run has this external id. */
    IGNORED,
    /** Contradicts a terminal record or comes from the wrong organization. */
    REJECTED
}
