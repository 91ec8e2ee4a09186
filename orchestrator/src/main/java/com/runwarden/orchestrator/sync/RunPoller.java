package com.runwarden.orchestrator.sync;

import com.runwarden.orchestrator.events.ChangeStream;
import com.runwarden.orchestrator.events.OrganizationChange;
import com.runwarden.orchestrator.gateway.GatewayException;
import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.store.RunChange;
import com.runwarden.orchestrator.store.RunStore;
import com.runwarden.orchestrator.validation.ValidationOrchestrator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background refresh of every run that has not finished yet.
 *
 * One instance per process. {@link #start()} may be called any number of
 * times; only the first schedules anything. Every interval the poller:
 * <ol>
 *   <li>lists the non-terminal runs of every organization that has any
 *       (organizations in the middle of a full sync are skipped),</li>
 *   <li>re-fetches them on the bounded poll executor, one remote call per run,</li>
 *   <li>publishes one "changed" signal per organization whose statuses moved,</li>
 *   <li>lets the validation orchestrator pick up remediations whose cascade got lost.</li>
 * </ol>
 * A tick that is still running when the next one is due causes that next
 * one to be skipped, not queued.
 */
@Component
public class RunPoller implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RunPoller.class);

    private final RunStore               store;
    private final SyncEngine             syncEngine;
    private final ValidationOrchestrator orchestrator;
    private final ChangeStream           changes;
    private final Executor               pollExecutor;
    private final MeterRegistry          meterRegistry;
    private final Duration               interval;
    private final Duration               tickTimeout;
    private final boolean                autoStart;
    private final List<String>           coldStartOrganizations;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean ticking = new AtomicBoolean(false);

    private ScheduledExecutorService trigger;
    private ExecutorService          tickThread;

    public RunPoller(RunStore store,
                     SyncEngine syncEngine,
                     ValidationOrchestrator orchestrator,
                     ChangeStream changes,
                     @Qualifier("pollExecutor") Executor pollExecutor,
                     MeterRegistry meterRegistry,
                     @Value("${runwarden.poller.interval:PT30S}") Duration interval,
                     @Value("${runwarden.poller.tick-timeout:PT2M}") Duration tickTimeout,
                     @Value("${runwarden.poller.enabled:true}") boolean autoStart,
                     @Value("${runwarden.sync.organizations:}") List<String> coldStartOrganizations) {
        this.store                  = store;
        this.syncEngine             = syncEngine;
        this.orchestrator           = orchestrator;
        this.changes                = changes;
        this.pollExecutor           = pollExecutor;
        this.meterRegistry          = meterRegistry;
        this.interval               = interval;
        this.tickTimeout            = tickTimeout;
        this.autoStart              = autoStart;
        this.coldStartOrganizations = coldStartOrganizations;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.debug("Run poller already started");
            return;
        }
        tickThread = Executors.newSingleThreadExecutor(r -> daemon(r, "run-poller-tick"));
        trigger    = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "run-poller-trigger"));
        trigger.scheduleAtFixedRate(this::fire, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Run poller started (interval={})", interval);

        for (String org : coldStartOrganizations) {
            if (org == null || org.isBlank()) continue;
            syncEngine.fullSync(org.trim()).whenComplete((report, err) -> {
                if (err != null) {
                    log.warn("Cold-start sync of org {} failed: {}", org, err.getMessage());
                }
            });
        }
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) return;
        trigger.shutdownNow();
        tickThread.shutdownNow();
        log.info("Run poller stopped");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    private void fire() {
        if (ticking.get()) {
            meterRegistry.counter("runwarden.poller.ticks", "outcome", "skipped").increment();
            log.warn("Previous poll tick still running; skipping this one");
            return;
        }
        tickThread.execute(this::tick);
    }

    // ------------------------------------------------------------------
    // Tick
    // ------------------------------------------------------------------

    /**
     * Run one poll pass on the calling thread.
     *
     * @return false when another tick was already running and this one did nothing
     */
    public boolean tick() {
        if (!ticking.compareAndSet(false, true)) {
            meterRegistry.counter("runwarden.poller.ticks", "outcome", "skipped").increment();
            return false;
        }
        try {
            for (String org : store.watchedOrganizations()) {
                if (syncEngine.isSyncing(org)) {
                    log.debug("Org {} is being fully synced; not polling it this tick", org);
                    continue;
                }
                pollOrganization(org);
            }
            try {
                orchestrator.recoverStalledRemediations();
            } catch (RuntimeException e) {
                log.error("Stalled remediation recovery failed: {}", e.getMessage(), e);
            }
            meterRegistry.counter("runwarden.poller.ticks", "outcome", "completed").increment();
            return true;
        } catch (RuntimeException e) {
            meterRegistry.counter("runwarden.poller.ticks", "outcome", "error").increment();
            log.error("Poll tick failed: {}", e.getMessage(), e);
            return true;
        } finally {
            ticking.set(false);
        }
    }

    private void pollOrganization(String org) {
        List<AgentRun> runs = store.listNonTerminal(org);
        if (runs.isEmpty()) return;

        List<CompletableFuture<Boolean>> fetches = new ArrayList<>(runs.size());
        for (AgentRun run : runs) {
            fetches.add(CompletableFuture.supplyAsync(() -> refreshOne(run), pollExecutor));
        }
        try {
            CompletableFuture.allOf(fetches.toArray(new CompletableFuture[0]))
                    .get(tickTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Polling org {} did not finish within {}; unfinished runs wait for the next tick",
                    org, tickTimeout);
        } catch (ExecutionException e) {
            log.warn("Polling org {} failed: {}", org, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }

        boolean changed = fetches.stream()
                .anyMatch(f -> f.isDone() && !f.isCompletedExceptionally() && f.join());
        if (changed) {
            changes.publish(org, OrganizationChange.Kind.RUNS, null);
        }
        log.debug("Polled {} active runs for org {} (changed={})", runs.size(), org, changed);
    }

    private boolean refreshOne(AgentRun run) {
        MDC.put("orgId", run.getOrganizationId());
        MDC.put("runId", run.getId().toString());
        try {
            RunChange change = syncEngine.refresh(run);
            return change.statusChanged();
        } catch (GatewayException e) {
            if (e.isTransient()) {
                log.info("Transient failure polling run {} ({}), retrying next tick: {}",
                        run.getId(), run.getExternalId(), e.getMessage());
            } else {
                log.warn("Remote refused poll of run {} ({}): {}",
                        run.getId(), run.getExternalId(), e.getMessage());
            }
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected error polling run {}: {}", run.getId(), e.getMessage(), e);
            return false;
        } finally {
            MDC.remove("orgId");
            MDC.remove("runId");
        }
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }
}
