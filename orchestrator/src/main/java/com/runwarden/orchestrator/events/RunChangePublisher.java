package com.runwarden.orchestrator.events;

import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.store.RunChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Fans a store write out to everyone who cares about it: the change
 * stream for every applied write, and for a write that ended the run the
 * {@link RunTerminatedEvent} plus a relay notification.
 *
 * Shared by the sync engine, the poller and the webhook correlator so that
 * all three writers announce changes the same way.
 */
@Component
public class RunChangePublisher {

    private static final Logger log = LoggerFactory.getLogger(RunChangePublisher.class);

    private final ChangeStream              changes;
    private final ApplicationEventPublisher events;
    private final NotificationRelay         relay;

    public RunChangePublisher(ChangeStream changes,
                              ApplicationEventPublisher events,
                              NotificationRelay relay) {
        this.changes = changes;
        this.events  = events;
        this.relay   = relay;
    }

    public void published(RunChange change) {
        if (!change.applied()) return;
        AgentRun run = change.run();
        changes.publish(run.getOrganizationId(), OrganizationChange.Kind.RUNS, run.getId());
        if (change.becameTerminal()) {
            log.info("Run {} (external {}) reached {}", run.getId(), run.getExternalId(), run.getStatus());
            events.publishEvent(new RunTerminatedEvent(run));
            relay.notify(RelayEvent.of("RUN_TERMINAL", run.getOrganizationId(), run.getId(),
                    run.getStatus().name(), run.getErrorMessage(), run.getWebUrl()));
        }
    }
}
