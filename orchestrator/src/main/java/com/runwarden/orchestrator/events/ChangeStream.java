package com.runwarden.orchestrator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Organization-scoped change notifications.
 *
 * Each change is published as a Spring application event (for in-process
 * listeners) and pushed to every Server-Sent Events subscriber of the
 * organization. Subscribers whose connection broke are dropped on the
 * next send.
 */
@Component
public class ChangeStream {

    private static final Logger log = LoggerFactory.getLogger(ChangeStream.class);

    private static final long EMITTER_TIMEOUT_MS = 30 * 60 * 1000L;

    private final Map<String, List<SseEmitter>> subscribers = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher      events;
    private final Clock                          clock;

    public ChangeStream(ApplicationEventPublisher events, Clock clock) {
        this.events = events;
        this.clock  = clock;
    }

    public void publish(String organizationId, OrganizationChange.Kind kind, UUID subjectId) {
        OrganizationChange change = new OrganizationChange(organizationId, kind, subjectId, clock.instant());
        events.publishEvent(change);

        List<SseEmitter> emitters = subscribers.get(organizationId);
        if (emitters == null) return;
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name("changed").data(change));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping change subscriber for org {}: {}", organizationId, e.getMessage());
                emitters.remove(emitter);
            }
        }
    }

    public SseEmitter subscribe(String organizationId) {
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        List<SseEmitter> emitters =
                subscribers.computeIfAbsent(organizationId, k -> new CopyOnWriteArrayList<>());
        emitters.add(emitter);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        return emitter;
    }

    public int subscriberCount(String organizationId) {
        List<SseEmitter> emitters = subscribers.get(organizationId);
        return emitters == null ? 0 : emitters.size();
    }
}
