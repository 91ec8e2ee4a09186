package com.runwarden.orchestrator.api;

import com.runwarden.orchestrator.api.dto.SyncStatusResponse;
import com.runwarden.orchestrator.sync.SyncEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * POST /organizations/{org}/sync: start (or join) a full sync; answers 202 at once
 * GET  /organizations/{org}/sync: state of the last full sync
 */
@RestController
@RequestMapping("/organizations/{org}/sync")
public class SyncController {

    private final SyncEngine syncEngine;

    public SyncController(SyncEngine syncEngine) {
        this.syncEngine = syncEngine;
    }

    @PostMapping
    public ResponseEntity<SyncStatusResponse> refresh(@PathVariable String org) {
        syncEngine.fullSync(org);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(status(org));
    }

    @GetMapping
    public SyncStatusResponse status(@PathVariable String org) {
        return SyncStatusResponse.from(org, syncEngine.syncStatus(org).orElse(null), syncEngine.isSyncing(org));
    }
}
