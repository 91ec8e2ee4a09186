package com.runwarden.orchestrator.events;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbound message for the notification relay.
 *
 * @param type     e.g. RUN_TERMINAL, REMEDIATION_DISPATCHED, VALIDATION_COMPLETED
 * @param subject  run or pipeline id the event is about
 * @param url      link a human can follow (PR, deployment or run page)
 * @param at       set by {@link NotificationRelay} when the event is sent
 */
public record RelayEvent(String type, String organizationId, UUID subject,
                         String status, String message, String url, Instant at) {

    public static RelayEvent of(String type, String organizationId, UUID subject,
                                String status, String message, String url) {
        return new RelayEvent(type, organizationId, subject, status, message, url, null);
    }

    public RelayEvent stampedAt(Instant at) {
        return new RelayEvent(type, organizationId, subject, status, message, url, at);
    }
}
