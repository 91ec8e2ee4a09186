package com.runwarden.orchestrator.sync;

import com.runwarden.orchestrator.events.ChangeStream;
import com.runwarden.orchestrator.events.OrganizationChange;
import com.runwarden.orchestrator.events.RunChangePublisher;
import com.runwarden.orchestrator.gateway.GatewayException;
import com.runwarden.orchestrator.gateway.RemoteRunGateway;
import com.runwarden.orchestrator.gateway.dto.RunSnapshot;
import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.model.AgentRunStatus;
import com.runwarden.orchestrator.model.MergeResult;
import com.runwarden.orchestrator.model.ResponseType;
import com.runwarden.orchestrator.model.RunUpdate;
import com.runwarden.orchestrator.model.SyncStatus;
import com.runwarden.orchestrator.repository.SyncStatusRepository;
import com.runwarden.orchestrator.store.RunChange;
import com.runwarden.orchestrator.store.RunNotFoundException;
import com.runwarden.orchestrator.store.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Turns local run intents into remote-backed state and pulls remote state
 * back into the {@link RunStore}.
 *
 * Intents (create, resume, cancel) call the gateway on the caller's thread
 * and surface its failures to the caller. Full syncs run on the sync
 * executor; at most one per organization is in flight, and concurrent
 * requests share its result.
 */
@Service
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final RunStore             store;
    private final RemoteRunGateway     gateway;
    private final SyncStatusRepository syncStatusRepo;
    private final RunChangePublisher   publisher;
    private final ChangeStream         changes;
    private final Executor             syncExecutor;
    private final Clock                clock;
    private final Duration             pendingExpiry;

    // organizationId → the full sync currently running for it
    private final Map<String, CompletableFuture<SyncReport>> inFlight = new ConcurrentHashMap<>();

    public SyncEngine(RunStore store,
                      RemoteRunGateway gateway,
                      SyncStatusRepository syncStatusRepo,
                      RunChangePublisher publisher,
                      ChangeStream changes,
                      @Qualifier("syncExecutor") Executor syncExecutor,
                      Clock clock,
                      @Value("${runwarden.sync.pending-expiry:PT10M}") Duration pendingExpiry) {
        this.store          = store;
        this.gateway        = gateway;
        this.syncStatusRepo = syncStatusRepo;
        this.publisher      = publisher;
        this.changes        = changes;
        this.syncExecutor   = syncExecutor;
        this.clock          = clock;
        this.pendingExpiry  = pendingExpiry;
    }

    // ------------------------------------------------------------------
    // Intents
    // ------------------------------------------------------------------

    /**
     * Create a run on the remote agent.
     *
     * A PENDING record is written before the remote call so the run is
     * visible at once. When the call returns the record gets its external
     * id and turns ACTIVE; when it fails the record turns FAILED with the
     * error and the exception is rethrown. Either way the record is never
     * left half-written.
     */
    public AgentRun createRun(String organizationId, String prompt,
                              Map<String, Object> context, ResponseType responseType) {
        AgentRun run = store.insert(new AgentRun(organizationId, prompt, responseType, clock.instant()));
        MDC.put("runId", run.getId().toString());
        try {
            changes.publish(organizationId, OrganizationChange.Kind.RUNS, run.getId());

            Instant issuedAt = clock.instant();
            RunSnapshot created;
            try {
                created = gateway.create(organizationId, prompt, context);
            } catch (RuntimeException e) {
                log.warn("Remote create failed for run {} in org {}: {}", run.getId(), organizationId, e.getMessage());
                RunChange failed = store.apply(organizationId, run.getId(),
                        RunUpdate.status(clock.instant(), AgentRunStatus.FAILED)
                                .withErrorMessage(e.getMessage()));
                publisher.published(failed);
                throw e;
            }

            AgentRunStatus status = created.status() == null || created.status() == AgentRunStatus.PENDING
                    ? AgentRunStatus.ACTIVE
                    : created.status();
            // never older than the local record; the remote clock may lag ours
            Instant acceptedAt = created.updatedAt() != null && created.updatedAt().isAfter(issuedAt)
                    ? created.updatedAt()
                    : issuedAt;
            RunSnapshot accepted = new RunSnapshot(created.externalId(), organizationId, status,
                    created.progressPercentage(), created.currentStep(), created.resultPayload(),
                    created.errorMessage(), created.webUrl(), null, created.createdAt(), acceptedAt);
            RunChange change = store.apply(organizationId, run.getId(), accepted.toUpdate(issuedAt));
            publisher.published(change);
            log.info("Run {} accepted by remote as {} ({})", run.getId(), created.externalId(), status);
            return change.run();
        } finally {
            MDC.remove("runId");
        }
    }

    /**
     * Send a follow-up instruction to a run that is still going
     * (typically WAITING_INPUT or PAUSED). Updates the record in place.
     *
     * @throws RunStateException if the run is terminal or was never accepted remotely
     */
    public AgentRun resumeRun(String organizationId, UUID runId, String instruction) {
        AgentRun run = store.get(organizationId, runId)
                .orElseThrow(() -> new RunNotFoundException(organizationId, runId));
        if (run.isTerminal()) {
            throw new RunStateException("Run " + runId + " is " + run.getStatus() + " and cannot be resumed");
        }
        if (run.getExternalId() == null) {
            throw new RunStateException("Run " + runId + " has not been accepted by the remote agent yet");
        }

        Instant issuedAt = clock.instant();
        RunSnapshot resumed = gateway.resume(organizationId, run.getExternalId(), instruction);
        AgentRunStatus status = resumed.status() != null ? resumed.status() : AgentRunStatus.ACTIVE;
        RunUpdate update = RunUpdate.status(issuedAt, status)
                .withCurrentStep(resumed.currentStep() != null ? resumed.currentStep() : "Resumed with new instruction");
        RunChange change = store.apply(organizationId, runId, update);
        publisher.published(change);
        log.info("Run {} resumed ({} → {})", runId, change.previousStatus(), change.run().getStatus());
        return change.run();
    }

    /**
     * Cancel a run. The remote cancel is attempted but its outcome does not
     * matter: the local record is marked CANCELLED either way, so nothing
     * keeps showing a run the user gave up on. A run that already finished
     * keeps its terminal status.
     */
    public AgentRun cancelRun(String organizationId, UUID runId) {
        AgentRun run = store.get(organizationId, runId)
                .orElseThrow(() -> new RunNotFoundException(organizationId, runId));
        if (run.getExternalId() != null && !run.isTerminal()) {
            try {
                gateway.cancel(organizationId, run.getExternalId());
            } catch (RuntimeException e) {
                log.warn("Remote cancel of run {} ({}) failed, cancelling locally anyway: {}",
                        runId, run.getExternalId(), e.getMessage());
            }
        }
        RunChange change = store.apply(organizationId, runId,
                RunUpdate.status(clock.instant(), AgentRunStatus.CANCELLED).withCurrentStep("Cancelled"));
        publisher.published(change);
        return change.run();
    }

    // ------------------------------------------------------------------
    // Pulling remote state
    // ------------------------------------------------------------------

    /**
     * Re-read one run from the remote agent and merge it.
     *
     * Runs without an external id have nothing to fetch; once they are
     * older than the pending expiry they are failed, since the create call
     * that should have accepted them is long gone.
     *
     * @throws GatewayException on remote failure; the caller decides whether to retry
     */
    public RunChange refresh(AgentRun run) {
        String org = run.getOrganizationId();
        if (run.getExternalId() == null) {
            Instant now = clock.instant();
            if (run.getCreatedAt().plus(pendingExpiry).isBefore(now)) {
                log.warn("Run {} was never acknowledged by the remote agent; failing it", run.getId());
                RunChange change = store.apply(org, run.getId(), RunUpdate.status(now, AgentRunStatus.FAILED)
                        .withErrorMessage("Run was never acknowledged by the remote agent"));
                publisher.published(change);
                return change;
            }
            return new RunChange(run, run.getStatus(), MergeResult.UNCHANGED);
        }
        Instant issuedAt = clock.instant();
        RunSnapshot snapshot = gateway.fetch(org, run.getExternalId());
        RunChange change = store.upsert(org, snapshot, issuedAt);
        publisher.published(change);
        return change;
    }

    /**
     * Reconcile every run of an organization with the remote list.
     *
     * If a sync for the organization is already running, the caller gets
     * that sync's future instead of starting a second remote list call.
     */
    public CompletableFuture<SyncReport> fullSync(String organizationId) {
        CompletableFuture<SyncReport> mine = new CompletableFuture<>();
        CompletableFuture<SyncReport> running = inFlight.putIfAbsent(organizationId, mine);
        if (running != null) {
            log.debug("Full sync for org {} already in flight, joining it", organizationId);
            return running;
        }
        try {
            syncExecutor.execute(() -> {
                // release the slot before completing so waiters see isSyncing() == false
                try {
                    SyncReport report = doFullSync(organizationId);
                    inFlight.remove(organizationId, mine);
                    mine.complete(report);
                } catch (Throwable t) {
                    inFlight.remove(organizationId, mine);
                    mine.completeExceptionally(t);
                }
            });
        } catch (RuntimeException e) {
            // executor rejected the task
            inFlight.remove(organizationId, mine);
            mine.completeExceptionally(e);
        }
        return mine;
    }

    public boolean isSyncing(String organizationId) {
        return inFlight.containsKey(organizationId);
    }

    public Optional<SyncStatus> syncStatus(String organizationId) {
        return syncStatusRepo.findById(organizationId);
    }

    private SyncReport doFullSync(String organizationId) {
        MDC.put("orgId", organizationId);
        SyncStatus status = syncStatusRepo.findById(organizationId)
                .orElseGet(() -> new SyncStatus(organizationId));
        status.markSyncing();
        syncStatusRepo.save(status);
        changes.publish(organizationId, OrganizationChange.Kind.SYNC, null);
        try {
            Instant issuedAt = clock.instant();
            List<RunSnapshot> remote;
            try {
                remote = gateway.list(organizationId);
            } catch (RuntimeException e) {
                log.error("Full sync of org {} failed: {}", organizationId, e.getMessage());
                status.markError(e.getMessage());
                syncStatusRepo.save(status);
                changes.publish(organizationId, OrganizationChange.Kind.SYNC, null);
                throw e;
            }

            int applied = 0, imported = 0, unchanged = 0, failed = 0;
            for (RunSnapshot snapshot : remote) {
                if (snapshot.externalId() == null) {
                    failed++;
                    continue;
                }
                try {
                    RunChange change = store.upsert(organizationId, snapshot, issuedAt);
                    publisher.published(change);
                    if (change.inserted()) imported++;
                    else if (change.applied()) applied++;
                    else unchanged++;
                } catch (RuntimeException e) {
                    failed++;
                    log.warn("Could not merge remote run {} during sync of org {}: {}",
                            snapshot.externalId(), organizationId, e.getMessage());
                }
            }

            Instant finished = clock.instant();
            status.markSuccess(finished);
            syncStatusRepo.save(status);
            changes.publish(organizationId, OrganizationChange.Kind.SYNC, null);
            log.info("Full sync of org {}: {} remote runs, {} updated, {} imported, {} unchanged, {} failed",
                    organizationId, remote.size(), applied, imported, unchanged, failed);
            return new SyncReport(organizationId, remote.size(), applied, imported, unchanged, failed, finished);
        } finally {
            MDC.remove("orgId");
        }
    }
}
