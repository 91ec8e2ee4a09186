package com.runwarden.orchestrator.validation;

import com.runwarden.orchestrator.events.ChangeStream;
import com.runwarden.orchestrator.events.NotificationRelay;
import com.runwarden.orchestrator.events.OrganizationChange;
import com.runwarden.orchestrator.events.RelayEvent;
import com.runwarden.orchestrator.events.RunTerminatedEvent;
import com.runwarden.orchestrator.executor.ExecutorException;
import com.runwarden.orchestrator.executor.StageExecutor;
import com.runwarden.orchestrator.executor.dto.StageContext;
import com.runwarden.orchestrator.executor.dto.StageOutcome;
import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.model.AgentRunStatus;
import com.runwarden.orchestrator.model.MergeStatus;
import com.runwarden.orchestrator.model.PipelineStatus;
import com.runwarden.orchestrator.model.Project;
import com.runwarden.orchestrator.model.ResponseType;
import com.runwarden.orchestrator.model.StageName;
import com.runwarden.orchestrator.model.StageResult;
import com.runwarden.orchestrator.model.StageStatus;
import com.runwarden.orchestrator.model.ValidationPipeline;
import com.runwarden.orchestrator.repository.ProjectRepository;
import com.runwarden.orchestrator.repository.ValidationPipelineRepository;
import com.runwarden.orchestrator.source.MergeOutcome;
import com.runwarden.orchestrator.source.PullRequestRef;
import com.runwarden.orchestrator.source.SourceHostingClient;
import com.runwarden.orchestrator.store.RunStore;
import com.runwarden.orchestrator.sync.SyncEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Drives validation pipelines through their stages and closes the loop
 * with the remote agent when a stage fails.
 *
 * Pipeline flow:
 * <pre>
 *   startValidation ──► RUNNING ──► stage 1 … stage 5 ──► COMPLETED ──► (auto-merge)
 *                                     │ failure
 *                                     ▼
 *                        retries left? ──no──► FAILED
 *                                     │ yes
 *                                     ▼
 *                        remediation run dispatched, pipeline paused
 *                                     │ run terminal (webhook / poller)
 *                                     ▼
 *                        COMPLETED ⇒ failed stage re-queued, advance resumes there
 *                        otherwise ⇒ FAILED
 * </pre>
 *
 * Concurrency rules:
 * <ul>
 *   <li>At most one advance loop per pipeline; it runs on the validation executor.</li>
 *   <li>Every read-modify-write of a pipeline happens under that pipeline's lock,
 *       and no remote call (sandbox, agent, source host) is made while holding it.</li>
 *   <li>A pipeline with a linked remediation run never starts a stage.</li>
 * </ul>
 */
@Service
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    private final ValidationPipelineRepository pipelineRepo;
    private final ProjectRepository            projectRepo;
    private final RunStore                     runStore;
    private final StageExecutor                stageExecutor;
    private final SyncEngine                   syncEngine;
    private final SourceHostingClient          sourceHosting;
    private final ChangeStream                 changes;
    private final NotificationRelay            relay;
    private final Executor                     validationExecutor;
    private final MeterRegistry                meterRegistry;
    private final Clock                        clock;
    private final int                          maxRetries;

    // Fixed lock stripes; pipelines sharing a stripe only serialize with each other.
    private static final int LOCK_STRIPES = 64;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    // Pipelines with an advance loop running, and pipelines that asked for
    // another pass while it was running.
    private final Set<UUID> advancing = ConcurrentHashMap.newKeySet();
    private final Set<UUID> requested = ConcurrentHashMap.newKeySet();

    private final Object startLock = new Object();

    public ValidationOrchestrator(ValidationPipelineRepository pipelineRepo,
                                  ProjectRepository projectRepo,
                                  RunStore runStore,
                                  StageExecutor stageExecutor,
                                  SyncEngine syncEngine,
                                  SourceHostingClient sourceHosting,
                                  ChangeStream changes,
                                  NotificationRelay relay,
                                  @Qualifier("validationExecutor") Executor validationExecutor,
                                  MeterRegistry meterRegistry,
                                  Clock clock,
                                  @Value("${runwarden.validation.max-retries}") int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("runwarden.validation.max-retries must be >= 0, got " + maxRetries);
        }
        this.pipelineRepo       = pipelineRepo;
        this.projectRepo        = projectRepo;
        this.runStore           = runStore;
        this.stageExecutor      = stageExecutor;
        this.syncEngine         = syncEngine;
        this.sourceHosting      = sourceHosting;
        this.changes            = changes;
        this.relay              = relay;
        this.validationExecutor = validationExecutor;
        this.meterRegistry      = meterRegistry;
        this.clock              = clock;
        this.maxRetries         = maxRetries;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    // ------------------------------------------------------------------
    // Public operations
    // ------------------------------------------------------------------

    /**
     * Start validating a pull request. Returns at once; stages run on the
     * validation executor. If the pull request already has a pipeline that
     * has not finished, that pipeline is returned instead of a new one.
     *
     * @throws ProjectNotFoundException if the project is not registered
     */
    public ValidationPipeline startValidation(String projectId, String pullRequestUrl) {
        Project project = projectRepo.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));

        ValidationPipeline pipeline;
        synchronized (startLock) {
            Optional<ValidationPipeline> existing =
                    pipelineRepo.findFirstByProjectIdAndPullRequestUrlOrderByCreatedAtDesc(projectId, pullRequestUrl);
            if (existing.isPresent() && !existing.get().getStatus().isTerminal()) {
                log.info("Pull request {} already has active pipeline {}", pullRequestUrl, existing.get().getId());
                return existing.get();
            }
            Integer prNumber = PullRequestRef.parse(pullRequestUrl).map(PullRequestRef::number).orElse(null);
            pipeline = new ValidationPipeline(project.getOrganizationId(), projectId, pullRequestUrl, prNumber, clock.instant());
            pipeline.setStatus(PipelineStatus.RUNNING);
            pipeline.setCurrentStep("Queued");
            pipeline = save(pipeline);
        }
        log.info("Validation pipeline {} started for {}", pipeline.getId(), pullRequestUrl);
        changes.publish(pipeline.getOrganizationId(), OrganizationChange.Kind.PIPELINE, pipeline.getId());
        scheduleAdvance(pipeline.getId());
        return pipeline;
    }

    public Optional<ValidationPipeline> getValidationStatus(UUID pipelineId) {
        return pipelineRepo.findById(pipelineId);
    }

    /**
     * Cancel a pipeline and the remediation run it is waiting on, if any.
     * A stage already executing is left to finish; its result is discarded.
     */
    public ValidationPipeline cancelValidation(UUID pipelineId) {
        UUID[] linked = new UUID[1];
        ValidationPipeline cancelled = withLock(pipelineId, p -> {
            if (p.getStatus().isTerminal()) return p;
            linked[0] = p.getLinkedAgentRunId();
            p.setStatus(PipelineStatus.CANCELLED);
            p.setCurrentStep("Cancelled");
            p.setLinkedAgentRunId(null);
            p.setCompletedAt(clock.instant());
            return save(p);
        });
        if (linked[0] != null) {
            try {
                syncEngine.cancelRun(cancelled.getOrganizationId(), linked[0]);
            } catch (RuntimeException e) {
                log.warn("Could not cancel remediation run {} of pipeline {}: {}",
                        linked[0], pipelineId, e.getMessage());
            }
        }
        changes.publish(cancelled.getOrganizationId(), OrganizationChange.Kind.PIPELINE, pipelineId);
        log.info("Validation pipeline {} is {}", pipelineId, cancelled.getStatus());
        return cancelled;
    }

    /**
     * Ask for the pipeline to make progress. Safe to call any number of
     * times: if an advance loop is already running it takes another pass
     * before exiting.
     */
    public void advance(UUID pipelineId) {
        scheduleAdvance(pipelineId);
    }

    // ------------------------------------------------------------------
    // Remediation cascade
    // ------------------------------------------------------------------

    @EventListener
    public void onRunTerminated(RunTerminatedEvent event) {
        onRemediationFinished(event.run());
    }

    /**
     * Resume or fail the pipeline waiting on {@code run}. Does nothing if no
     * pipeline is linked to it, so it is safe to call for every terminal run
     * and to call twice for the same one.
     */
    public void onRemediationFinished(AgentRun run) {
        if (!run.isTerminal()) return;
        Optional<ValidationPipeline> waiting = pipelineRepo.findByLinkedAgentRunId(run.getId());
        if (waiting.isEmpty()) return;

        UUID pipelineId = waiting.get().getId();
        MDC.put("pipelineId", pipelineId.toString());
        try {
            boolean[] resume = new boolean[1];
            ValidationPipeline after = withLock(pipelineId, p -> {
                if (p.getStatus().isTerminal() || !run.getId().equals(p.getLinkedAgentRunId())) {
                    return p;
                }
                StageResult failed = p.failedStage().orElse(null);
                p.setLinkedAgentRunId(null);
                if (run.getStatus() == AgentRunStatus.COMPLETED && failed != null) {
                    failed.markRemediated();
                    p.setCurrentStep("Remediation completed, retrying " + failed.getStageName().label());
                    resume[0] = true;
                } else {
                    p.setStatus(PipelineStatus.FAILED);
                    p.setErrorMessage("Remediation run " + run.getId() + " ended as " + run.getStatus()
                            + (run.getErrorMessage() != null ? ": " + run.getErrorMessage() : ""));
                    p.setCurrentStep("Remediation failed");
                    p.setCompletedAt(clock.instant());
                }
                return save(p);
            });

            changes.publish(after.getOrganizationId(), OrganizationChange.Kind.PIPELINE, pipelineId);
            if (resume[0]) {
                log.info("Remediation run {} completed; resuming pipeline {}", run.getId(), pipelineId);
                scheduleAdvance(pipelineId);
            } else if (after.getStatus() == PipelineStatus.FAILED) {
                log.warn("Pipeline {} failed: {}", pipelineId, after.getErrorMessage());
                relay.notify(RelayEvent.of("VALIDATION_FAILED", after.getOrganizationId(), pipelineId,
                        after.getStatus().name(), after.getErrorMessage(), after.getPullRequestUrl()));
            }
        } finally {
            MDC.remove("pipelineId");
        }
    }

    /**
     * Pick up pipelines whose cascade never happened: the linked run ended
     * before the link was saved, or the process stopped in between. Also
     * restarts advance loops for RUNNING pipelines that have none, and fails
     * those that stopped between a stage failure and its remediation.
     */
    public void recoverStalledRemediations() {
        for (ValidationPipeline p : pipelineRepo.findByStatusAndLinkedAgentRunIdIsNotNull(PipelineStatus.RUNNING)) {
            Optional<AgentRun> run = runStore.get(p.getOrganizationId(), p.getLinkedAgentRunId());
            if (run.isEmpty()) {
                log.warn("Remediation run {} of pipeline {} no longer exists; failing the pipeline",
                        p.getLinkedAgentRunId(), p.getId());
                failPipeline(p.getId(), "Remediation run " + p.getLinkedAgentRunId() + " no longer exists");
            } else if (run.get().isTerminal()) {
                log.info("Recovering stalled remediation of pipeline {} (run {} is {})",
                        p.getId(), run.get().getId(), run.get().getStatus());
                onRemediationFinished(run.get());
            }
        }
        for (ValidationPipeline p : pipelineRepo.findByStatusAndLinkedAgentRunIdIsNull(PipelineStatus.RUNNING)) {
            if (advancing.contains(p.getId())) continue;
            if (p.failedStage().isPresent()) {
                // failed stage, no linked run and no loop: the dispatch never finished
                ValidationPipeline after = withLock(p.getId(), fresh -> {
                    if (fresh.getStatus() != PipelineStatus.RUNNING || fresh.isAwaitingRemediation()
                            || fresh.failedStage().isEmpty() || advancing.contains(fresh.getId())) {
                        return fresh;
                    }
                    log.warn("Pipeline {} lost its remediation dispatch; failing it", fresh.getId());
                    fresh.setStatus(PipelineStatus.FAILED);
                    fresh.setErrorMessage("Remediation dispatch was interrupted");
                    fresh.setCurrentStep("Failed");
                    fresh.setCompletedAt(clock.instant());
                    return save(fresh);
                });
                changes.publish(after.getOrganizationId(), OrganizationChange.Kind.PIPELINE, after.getId());
            } else {
                log.info("Restarting advance loop of orphaned pipeline {}", p.getId());
                scheduleAdvance(p.getId());
            }
        }
    }

    // ------------------------------------------------------------------
    // Advance loop
    // ------------------------------------------------------------------

    private void scheduleAdvance(UUID pipelineId) {
        requested.add(pipelineId);
        if (advancing.add(pipelineId)) {
            try {
                validationExecutor.execute(() -> advanceLoop(pipelineId));
            } catch (RuntimeException e) {
                advancing.remove(pipelineId);
                log.error("Could not schedule pipeline {}: {}", pipelineId, e.getMessage());
            }
        }
    }

    private void advanceLoop(UUID pipelineId) {
        MDC.put("pipelineId", pipelineId.toString());
        try {
            while (true) {
                requested.remove(pipelineId);
                try {
                    runUntilBlocked(pipelineId);
                } catch (RuntimeException e) {
                    log.error("Advance of pipeline {} failed: {}", pipelineId, e.getMessage(), e);
                    failPipeline(pipelineId, "Internal error: " + e.getMessage());
                }
                advancing.remove(pipelineId);
                // Another request came in while we were finishing: take it unless
                // a fresh loop already did.
                if (!requested.contains(pipelineId) || !advancing.add(pipelineId)) {
                    break;
                }
            }
        } finally {
            MDC.remove("pipelineId");
        }
    }

    /** Run stages until the pipeline finishes, pauses for remediation, or fails. */
    private void runUntilBlocked(UUID pipelineId) {
        while (true) {
            StageClaim claim = claimNextStage(pipelineId);
            if (claim == null) return;

            StageOutcome outcome = execute(claim);
            meterRegistry.timer("runwarden.stage.duration",
                    "stage", claim.stage().wireName(),
                    "status", outcome.success() ? "success" : "failure")
                    .record(Duration.ofMillis(outcome.durationMs()));

            if (!recordOutcome(pipelineId, claim.stage(), outcome)) return;
        }
    }

    private record StageClaim(StageName stage, StageContext context) {}

    /**
     * Mark the next stage RUNNING, or finish the pipeline when none is left.
     * Null means there is nothing to execute right now.
     */
    private StageClaim claimNextStage(UUID pipelineId) {
        StageClaim[] claim = new StageClaim[1];
        boolean[] completed = new boolean[1];
        ValidationPipeline p = withLock(pipelineId, pipeline -> {
            if (pipeline.getStatus() != PipelineStatus.RUNNING
                    || pipeline.isAwaitingRemediation()
                    || pipeline.failedStage().isPresent()) {
                return pipeline;
            }
            Optional<StageResult> next = pipeline.firstUnfinishedStage();
            if (next.isEmpty()) {
                pipeline.setStatus(PipelineStatus.COMPLETED);
                pipeline.recomputeProgress();
                pipeline.setCurrentStep("Validation completed");
                pipeline.setErrorMessage(null);
                pipeline.setCompletedAt(clock.instant());
                completed[0] = true;
                return save(pipeline);
            }
            StageResult stage = next.get();
            stage.markRunning();
            pipeline.setCurrentStep(stage.getStageName().label());
            ValidationPipeline saved = save(pipeline);
            String repoUrl = projectRepo.findById(saved.getProjectId())
                    .map(Project::getRepositoryUrl).orElse(null);
            claim[0] = new StageClaim(stage.getStageName(), new StageContext(saved.getId(),
                    saved.getProjectId(), repoUrl, saved.getPullRequestUrl(), saved.getDeploymentUrl()));
            return saved;
        });

        changes.publish(p.getOrganizationId(), OrganizationChange.Kind.PIPELINE, pipelineId);
        if (completed[0]) {
            onCompleted(p);
        }
        return claim[0];
    }

    private StageOutcome execute(StageClaim claim) {
        long started = System.nanoTime();
        try {
            return stageExecutor.runStage(claim.stage(), claim.context());
        } catch (ExecutorException e) {
            long ms = Duration.ofNanos(System.nanoTime() - started).toMillis();
            String error = e.isTimeout()
                    ? claim.stage().label() + " timed out: " + e.getMessage()
                    : claim.stage().label() + " could not be executed: " + e.getMessage();
            log.warn("Stage {} of pipeline {}: {}", claim.stage(), claim.context().pipelineId(), error);
            return StageOutcome.failure(ms, error);
        }
    }

    /**
     * Store a stage result. On failure either dispatches remediation or fails
     * the pipeline.
     *
     * @return true if the loop should go on with the next stage
     */
    private boolean recordOutcome(UUID pipelineId, StageName stageName, StageOutcome outcome) {
        boolean[] remediate = new boolean[1];
        ValidationPipeline p = withLock(pipelineId, pipeline -> {
            StageResult stage = pipeline.stage(stageName);
            if (pipeline.getStatus() != PipelineStatus.RUNNING || stage.getStatus() != StageStatus.RUNNING) {
                log.info("Discarding {} result of stage {}: pipeline is {}",
                        outcome.success() ? "successful" : "failed", stageName, pipeline.getStatus());
                return pipeline;
            }
            if (outcome.deploymentUrl() != null) {
                pipeline.setDeploymentUrl(outcome.deploymentUrl());
            }
            if (outcome.success()) {
                stage.markSucceeded(outcome.durationMs());
                pipeline.recomputeProgress();
                log.info("Stage {} succeeded in {} ms", stageName, outcome.durationMs());
                return save(pipeline);
            }

            stage.markFailed(outcome.durationMs(), outcome.error());
            if (pipeline.getRetryCount() < maxRetries) {
                pipeline.incrementRetryCount();
                pipeline.setCurrentStep("Dispatching remediation for " + stageName.label());
                remediate[0] = true;
                log.info("Stage {} failed; dispatching remediation {}/{}",
                        stageName, pipeline.getRetryCount(), maxRetries);
            } else {
                pipeline.setStatus(PipelineStatus.FAILED);
                pipeline.setCurrentStep(stageName.label() + " failed");
                pipeline.setErrorMessage(stageName.label() + " failed after " + pipeline.getRetryCount()
                        + " remediation attempt(s): " + outcome.error());
                pipeline.setCompletedAt(clock.instant());
                log.warn("Stage {} failed and the remediation limit ({}) is reached", stageName, maxRetries);
            }
            return save(pipeline);
        });

        changes.publish(p.getOrganizationId(), OrganizationChange.Kind.PIPELINE, pipelineId);
        if (p.getStatus() == PipelineStatus.FAILED) {
            relay.notify(RelayEvent.of("VALIDATION_FAILED", p.getOrganizationId(), pipelineId,
                    p.getStatus().name(), p.getErrorMessage(), p.getPullRequestUrl()));
            return false;
        }
        if (remediate[0]) {
            dispatchRemediation(p, stageName, outcome.error());
            return false;
        }
        return outcome.success() && p.getStatus() == PipelineStatus.RUNNING;
    }

    private void dispatchRemediation(ValidationPipeline pipeline, StageName stage, String error) {
        UUID pipelineId = pipeline.getId();
        AgentRun run;
        try {
            run = syncEngine.createRun(pipeline.getOrganizationId(),
                    RemediationPrompts.forFailure(pipeline, stage, error),
                    RemediationPrompts.context(pipeline, stage),
                    ResponseType.PULL_REQUEST);
        } catch (RuntimeException e) {
            log.error("Could not dispatch remediation for pipeline {}: {}", pipelineId, e.getMessage());
            ValidationPipeline failed = failPipeline(pipelineId,
                    "Could not dispatch remediation for " + stage.label() + ": " + e.getMessage());
            relay.notify(RelayEvent.of("VALIDATION_FAILED", failed.getOrganizationId(), pipelineId,
                    failed.getStatus().name(), failed.getErrorMessage(), failed.getPullRequestUrl()));
            return;
        }

        boolean[] linked = new boolean[1];
        withLock(pipelineId, p -> {
            if (p.getStatus() != PipelineStatus.RUNNING) return p;
            p.setLinkedAgentRunId(run.getId());
            p.setCurrentStep("Awaiting remediation run " + run.getId());
            linked[0] = true;
            return save(p);
        });

        if (!linked[0]) {
            // cancelled while the run was being created
            log.info("Pipeline {} ended while dispatching remediation; cancelling run {}", pipelineId, run.getId());
            try {
                syncEngine.cancelRun(run.getOrganizationId(), run.getId());
            } catch (RuntimeException e) {
                log.warn("Could not cancel orphaned remediation run {}: {}", run.getId(), e.getMessage());
            }
            return;
        }

        meterRegistry.counter("runwarden.remediation.dispatched", "stage", stage.wireName()).increment();
        changes.publish(pipeline.getOrganizationId(), OrganizationChange.Kind.PIPELINE, pipelineId);
        relay.notify(RelayEvent.of("REMEDIATION_DISPATCHED", pipeline.getOrganizationId(), pipelineId,
                stage.name(), "Remediation run " + run.getId() + " dispatched", run.getWebUrl()));
        log.info("Pipeline {} waiting on remediation run {}", pipelineId, run.getId());

        // The run may have ended before the link existed.
        Optional<AgentRun> current = runStore.get(run.getOrganizationId(), run.getId());
        current.filter(AgentRun::isTerminal).ifPresent(this::onRemediationFinished);
    }

    private void onCompleted(ValidationPipeline pipeline) {
        log.info("Validation pipeline {} completed", pipeline.getId());
        relay.notify(RelayEvent.of("VALIDATION_COMPLETED", pipeline.getOrganizationId(), pipeline.getId(),
                pipeline.getStatus().name(), null,
                pipeline.getDeploymentUrl() != null ? pipeline.getDeploymentUrl() : pipeline.getPullRequestUrl()));

        boolean autoMerge = projectRepo.findById(pipeline.getProjectId())
                .map(Project::isAutoMergeEnabled).orElse(false);
        if (!autoMerge) return;

        MergeOutcome outcome;
        try {
            outcome = sourceHosting.merge(pipeline.getPullRequestUrl());
        } catch (RuntimeException e) {
            outcome = MergeOutcome.refused(e.getMessage());
        }
        MergeOutcome result = outcome;
        withLock(pipeline.getId(), p -> {
            if (result.success()) {
                p.recordMerge(MergeStatus.MERGED, result.sha(), null);
            } else {
                p.recordMerge(MergeStatus.FAILED, null, result.message());
            }
            return save(p);
        });
        if (result.success()) {
            log.info("Pull request {} merged as {}", pipeline.getPullRequestUrl(), result.sha());
        } else {
            log.warn("Auto-merge of {} failed: {}", pipeline.getPullRequestUrl(), result.message());
        }
        changes.publish(pipeline.getOrganizationId(), OrganizationChange.Kind.PIPELINE, pipeline.getId());
        relay.notify(RelayEvent.of(result.success() ? "MERGE_COMPLETED" : "MERGE_FAILED",
                pipeline.getOrganizationId(), pipeline.getId(),
                result.success() ? MergeStatus.MERGED.name() : MergeStatus.FAILED.name(),
                result.success() ? result.sha() : result.message(), pipeline.getPullRequestUrl()));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ValidationPipeline failPipeline(UUID pipelineId, String error) {
        ValidationPipeline p = withLock(pipelineId, pipeline -> {
            if (pipeline.getStatus().isTerminal()) return pipeline;
            pipeline.setStatus(PipelineStatus.FAILED);
            pipeline.setErrorMessage(error);
            pipeline.setCurrentStep("Failed");
            pipeline.setLinkedAgentRunId(null);
            pipeline.setCompletedAt(clock.instant());
            return save(pipeline);
        });
        changes.publish(p.getOrganizationId(), OrganizationChange.Kind.PIPELINE, pipelineId);
        return p;
    }

    private ValidationPipeline save(ValidationPipeline pipeline) {
        pipeline.touch(clock.instant());
        return pipelineRepo.save(pipeline);
    }

    /** Load the pipeline fresh and mutate it while holding its lock. */
    private ValidationPipeline withLock(UUID pipelineId, Function<ValidationPipeline, ValidationPipeline> mutation) {
        ReentrantLock lock = lockFor(pipelineId);
        lock.lock();
        try {
            ValidationPipeline pipeline = pipelineRepo.findById(pipelineId)
                    .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
            return mutation.apply(pipeline);
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(UUID pipelineId) {
        return locks[Math.floorMod(pipelineId.hashCode(), LOCK_STRIPES)];
    }
}
