package com.runwarden.orchestrator.webhook;

import com.runwarden.orchestrator.events.RunChangePublisher;
import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.store.RunChange;
import com.runwarden.orchestrator.store.RunNotFoundException;
import com.runwarden.orchestrator.store.RunStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps inbound run-status callbacks onto local runs.
 *
 * The callback is matched through the external id index and merged with
 * the same newer-wins rule every other writer uses, so a redelivered or
 * reordered webhook is harmless. When the merge ends the run, the
 * {@link RunChangePublisher} raises the terminal event that lets the
 * validation orchestrator resume or fail the pipeline waiting on it.
 */
@Service
public class WebhookCorrelator {

    private static final Logger log = LoggerFactory.getLogger(WebhookCorrelator.class);

    private final RunStore           store;
    private final RunChangePublisher publisher;
    private final MeterRegistry      meterRegistry;
    private final Clock              clock;

    public WebhookCorrelator(RunStore store, RunChangePublisher publisher,
                             MeterRegistry meterRegistry, Clock clock) {
        this.store         = store;
        this.publisher     = publisher;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    public WebhookOutcome handle(WebhookPayload payload) {
        WebhookOutcome outcome = correlate(payload);
        meterRegistry.counter("runwarden.webhook.events",
                "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
        return outcome;
    }

    private WebhookOutcome correlate(WebhookPayload payload) {
        if (payload == null || payload.externalId() == null || payload.externalId().isBlank()) {
            log.info("Webhook without a run id; dropping");
            return WebhookOutcome.IGNORED;
        }
        Optional<AgentRun> known = store.findByExternalId(payload.externalId());
        if (known.isEmpty()) {
            log.info("Webhook for unknown remote run {}; dropping", payload.externalId());
            return WebhookOutcome.IGNORED;
        }
        AgentRun run = known.get();
        if (payload.organizationId() != null && !payload.organizationId().equals(run.getOrganizationId())) {
            log.warn("Webhook for run {} names org {} but the run belongs to {}; rejecting",
                    payload.externalId(), payload.organizationId(), run.getOrganizationId());
            return WebhookOutcome.REJECTED;
        }

        MDC.put("orgId", run.getOrganizationId());
        MDC.put("runId", run.getId().toString());
        try {
            RunChange change = store.apply(run.getOrganizationId(), run.getId(),
                    payload.toUpdate(clock.instant()));
            publisher.published(change);
            log.debug("Webhook for run {} ({}): {}", run.getId(), payload.status(), change.result());
            return switch (change.result()) {
                case APPLIED   -> WebhookOutcome.APPLIED;
                case UNCHANGED -> WebhookOutcome.DUPLICATE;
                case STALE     -> WebhookOutcome.STALE;
                case REJECTED  -> WebhookOutcome.REJECTED;
            };
        } catch (RunNotFoundException e) {
            // evicted between lookup and apply
            log.info("Run {} disappeared before its webhook could be applied", run.getId());
            return WebhookOutcome.IGNORED;
        } finally {
            MDC.remove("orgId");
            MDC.remove("runId");
        }
    }
}
