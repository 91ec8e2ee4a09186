package com.runwarden.orchestrator.api;

import com.runwarden.orchestrator.api.dto.CreateRunRequest;
import com.runwarden.orchestrator.api.dto.ResumeRunRequest;
import com.runwarden.orchestrator.api.dto.RunPageResponse;
import com.runwarden.orchestrator.api.dto.RunResponse;
import com.runwarden.orchestrator.gateway.GatewayException;
import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.model.AgentRunStatus;
import com.runwarden.orchestrator.store.RunFilter;
import com.runwarden.orchestrator.store.RunNotFoundException;
import com.runwarden.orchestrator.store.RunStore;
import com.runwarden.orchestrator.sync.RunStateException;
import com.runwarden.orchestrator.sync.SyncEngine;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * REST API for agent runs, scoped per organization.
 *
 * POST   /organizations/{org}/agent-runs               create a run on the remote agent
 * GET    /organizations/{org}/agent-runs               list with filters, sort and paging
 * GET    /organizations/{org}/agent-runs/{id}          one run from the local view
 * DELETE /organizations/{org}/agent-runs/{id}          evict a run from the local view
 * POST   /organizations/{org}/agent-runs/{id}/resume   send a follow-up instruction
 * POST   /organizations/{org}/agent-runs/{id}/cancel   stop a run
 *
 * Remote failures surface as 502 with the gateway's message; the run record
 * itself stays visible with its FAILED status.
 */
@RestController
@RequestMapping("/organizations/{org}/agent-runs")
public class AgentRunController {

    static final int MAX_PAGE_SIZE = 200;

    private static final Set<String> SORTABLE =
            Set.of("createdAt", "lastUpdatedAt", "status", "progressPercentage");

    private final SyncEngine syncEngine;
    private final RunStore   runStore;

    public AgentRunController(SyncEngine syncEngine, RunStore runStore) {
        this.syncEngine = syncEngine;
        this.runStore   = runStore;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/organizations/42/agent-runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"prompt":"Fix the flaky checkout test"}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> create(@PathVariable String org, @RequestBody CreateRunRequest req) {
        if (req.prompt() == null || req.prompt().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "prompt is required");
        }
        AgentRun run = remote(() -> syncEngine.createRun(org, req.prompt(), req.context(), req.responseType()));
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
    }

    @GetMapping
    public RunPageResponse list(@PathVariable String org,
                                @RequestParam(required = false) List<AgentRunStatus> status,
                                @RequestParam(required = false) String query,
                                @RequestParam(required = false)
                                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdAfter,
                                @RequestParam(required = false)
                                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdBefore,
                                @RequestParam(defaultValue = "createdAt") String sort,
                                @RequestParam(defaultValue = "desc") String direction,
                                @RequestParam(defaultValue = "0") int page,
                                @RequestParam(defaultValue = "50") int size) {
        if (!SORTABLE.contains(sort)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "sort must be one of " + SORTABLE + ", got " + sort);
        }
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        Sort.Direction dir = "asc".equalsIgnoreCase(direction) ? Sort.Direction.ASC : Sort.Direction.DESC;
        RunFilter filter = new RunFilter(
                status == null || status.isEmpty() ? null : EnumSet.copyOf(status),
                query, createdAfter, createdBefore);
        return RunPageResponse.from(
                runStore.search(org, filter, PageRequest.of(page, size, Sort.by(dir, sort))));
    }

    /** Returns 404 if the run is not in this organization. */
    @GetMapping("/{id}")
    public RunResponse get(@PathVariable String org, @PathVariable UUID id) {
        return runStore.get(org, id)
                .map(RunResponse::from)
                .orElseThrow(() -> notFound(org, id));
    }

    /**
     * Drop a run from the local view. A run still active remotely comes back
     * on the next full sync.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String org, @PathVariable UUID id) {
        if (!runStore.delete(org, id)) {
            throw notFound(org, id);
        }
        return ResponseEntity.noContent().build();
    }

    /** 409 if the run already finished or was never accepted remotely. */
    @PostMapping("/{id}/resume")
    public RunResponse resume(@PathVariable String org, @PathVariable UUID id,
                              @RequestBody ResumeRunRequest req) {
        if (req.instruction() == null || req.instruction().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "instruction is required");
        }
        return RunResponse.from(remote(() -> syncEngine.resumeRun(org, id, req.instruction())));
    }

    @PostMapping("/{id}/cancel")
    public RunResponse cancel(@PathVariable String org, @PathVariable UUID id) {
        return RunResponse.from(remote(() -> syncEngine.cancelRun(org, id)));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static AgentRun remote(Supplier<AgentRun> call) {
        try {
            return call.get();
        } catch (RunNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (RunStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        } catch (GatewayException e) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage());
        }
    }

    private static ResponseStatusException notFound(String org, UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND,
                "Agent run " + id + " not found in organization " + org);
    }
}
