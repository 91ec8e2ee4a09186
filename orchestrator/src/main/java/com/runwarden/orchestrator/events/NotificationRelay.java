package com.runwarden.orchestrator.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;

/**
 * Fire-and-forget delivery of {@link RelayEvent}s to the notification relay.
 *
 * Sending never blocks the caller and never fails it: delivery errors are
 * logged and dropped. With no relay URL configured every event is skipped.
 */
@Component
public class NotificationRelay {

    private static final Logger log = LoggerFactory.getLogger(NotificationRelay.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       relayUrl;
    private final Duration     timeout;
    private final Clock        clock;

    public NotificationRelay(@Value("${runwarden.relay.url:}") String relayUrl,
                             @Value("${runwarden.relay.timeout:PT10S}") Duration timeout,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.clock    = clock;
        this.relayUrl = relayUrl;
        this.timeout  = timeout;
        this.json     = objectMapper;
        this.http     = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    public void notify(RelayEvent event) {
        if (relayUrl == null || relayUrl.isBlank()) {
            log.debug("No relay configured, skipping {} for {}", event.type(), event.subject());
            return;
        }
        String body;
        try {
            body = json.writeValueAsString(event.at() != null ? event : event.stampedAt(clock.instant()));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize relay event {}: {}", event.type(), e.getMessage());
            return;
        }
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(relayUrl))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        http.sendAsync(req, HttpResponse.BodyHandlers.discarding())
                .whenComplete((resp, err) -> {
                    if (err != null) {
                        log.warn("Relay delivery of {} for {} failed: {}",
                                event.type(), event.subject(), err.getMessage());
                    } else if (resp.statusCode() >= 300) {
                        log.warn("Relay rejected {} for {}: HTTP {}",
                                event.type(), event.subject(), resp.statusCode());
                    } else {
                        log.debug("Relay accepted {} for {}", event.type(), event.subject());
                    }
                });
    }
}
