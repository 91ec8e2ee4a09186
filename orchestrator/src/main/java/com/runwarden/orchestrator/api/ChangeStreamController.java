package com.runwarden.orchestrator.api;

import com.runwarden.orchestrator.events.ChangeStream;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * GET /organizations/{org}/changes: Server-Sent Events stream of "changed"
 * signals. Clients re-read whatever the signal's kind points at.
 */
@RestController
public class ChangeStreamController {

    private final ChangeStream changes;

    public ChangeStreamController(ChangeStream changes) {
        this.changes = changes;
    }

    @GetMapping(path = "/organizations/{org}/changes", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(@PathVariable String org) {
        return changes.subscribe(org);
    }
}
