package com.runwarden.orchestrator.api;

import com.runwarden.orchestrator.webhook.WebhookCorrelator;
import com.runwarden.orchestrator.webhook.WebhookPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Inbound run-status callbacks from the remote agent.
 *
 * The callback is acknowledged with 202 as soon as it is queued; correlation
 * happens on the webhook executor so the sender is never held up by the
 * store or by a pipeline cascade.
 */
@RestController
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final WebhookCorrelator correlator;
    private final Executor          webhookExecutor;

    public WebhookController(WebhookCorrelator correlator,
                             @Qualifier("webhookExecutor") Executor webhookExecutor) {
        this.correlator      = correlator;
        this.webhookExecutor = webhookExecutor;
    }

    @PostMapping("/webhooks/agent-runs")
    public ResponseEntity<Map<String, String>> receive(@RequestBody WebhookPayload payload) {
        if (payload.externalId() == null || payload.externalId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "agent_run_id is required");
        }
        try {
            webhookExecutor.execute(() -> {
                try {
                    correlator.handle(payload);
                } catch (RuntimeException e) {
                    log.error("Webhook for run {} failed: {}", payload.externalId(), e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Webhook queue unavailable");
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "agent_run_id", payload.externalId()));
    }
}
