package com.runwarden.orchestrator.validation;

import com.runwarden.orchestrator.TestClock;
import com.runwarden.orchestrator.events.ChangeStream;
import com.runwarden.orchestrator.events.NotificationRelay;
import com.runwarden.orchestrator.events.RunChangePublisher;
import com.runwarden.orchestrator.events.RunTerminatedEvent;
import com.runwarden.orchestrator.executor.ExecutorException;
import com.runwarden.orchestrator.executor.StageExecutor;
import com.runwarden.orchestrator.executor.dto.StageOutcome;
import com.runwarden.orchestrator.gateway.GatewayException;
import com.runwarden.orchestrator.gateway.RemoteRunGateway;
import com.runwarden.orchestrator.gateway.dto.RunSnapshot;
import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.model.AgentRunStatus;
import com.runwarden.orchestrator.model.MergeStatus;
import com.runwarden.orchestrator.model.PipelineStatus;
import com.runwarden.orchestrator.model.Project;
import com.runwarden.orchestrator.model.RunUpdate;
import com.runwarden.orchestrator.model.StageName;
import com.runwarden.orchestrator.model.StageStatus;
import com.runwarden.orchestrator.model.ValidationPipeline;
import com.runwarden.orchestrator.repository.ProjectRepository;
import com.runwarden.orchestrator.repository.SyncStatusRepository;
import com.runwarden.orchestrator.repository.ValidationPipelineRepository;
import com.runwarden.orchestrator.source.MergeOutcome;
import com.runwarden.orchestrator.source.SourceHostingClient;
import com.runwarden.orchestrator.source.SourceHostingException;
import com.runwarden.orchestrator.store.InMemoryRunStore;
import com.runwarden.orchestrator.sync.SyncEngine;
import com.runwarden.orchestrator.webhook.WebhookCorrelator;
import com.runwarden.orchestrator.webhook.WebhookOutcome;
import com.runwarden.orchestrator.webhook.WebhookPayload;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Drives whole pipelines through ValidationOrchestrator with a synchronous
 * executor: startValidation returns once the pipeline is finished or is
 * waiting on a remediation run. Remediation runs are created through a
 * real SyncEngine against a mocked gateway and finished through the real
 * WebhookCorrelator, so the terminal-event cascade is exercised end to end.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ValidationOrchestratorTest {

    static final String ORG     = "org-1";
    static final String PROJECT = "proj-1";
    static final String PR_URL  = "https://github.com/acme/shop/pull/42";

    @Mock ValidationPipelineRepository pipelineRepo;
    @Mock ProjectRepository            projectRepo;
    @Mock SyncStatusRepository         syncStatusRepo;
    @Mock RemoteRunGateway             gateway;
    @Mock StageExecutor                stageExecutor;
    @Mock SourceHostingClient          sourceHosting;
    @Mock ChangeStream                 changes;
    @Mock NotificationRelay            relay;

    InMemoryRunStore       store;
    TestClock              clock;
    SimpleMeterRegistry    meters;
    SyncEngine             syncEngine;
    WebhookCorrelator      correlator;
    ValidationOrchestrator orchestrator;
    Project                project;

    final Map<UUID, ValidationPipeline> pipelines   = new LinkedHashMap<>();
    final Map<StageName, AtomicInteger> failuresLeft = new EnumMap<>(StageName.class);
    final List<StageName>               executed    = new ArrayList<>();
    final AtomicInteger                 remoteIds   = new AtomicInteger();

    @BeforeEach
    void setUp() {
        store  = new InMemoryRunStore();
        clock  = new TestClock();
        meters = new SimpleMeterRegistry();

        RunChangePublisher publisher = new RunChangePublisher(changes, event -> {
            if (event instanceof RunTerminatedEvent terminated) {
                orchestrator.onRunTerminated(terminated);
            }
        }, relay);
        syncEngine = new SyncEngine(store, gateway, syncStatusRepo, publisher, changes,
                Runnable::run, clock, Duration.ofMinutes(10));
        correlator = new WebhookCorrelator(store, publisher, meters, clock);
        orchestrator = orchestrator(2);

        project = new Project(PROJECT, ORG);
        project.setRepositoryUrl("https://github.com/acme/shop");
        when(projectRepo.findById(PROJECT)).thenReturn(Optional.of(project));

        wirePipelineRepository();

        when(gateway.create(eq(ORG), anyString(), anyMap())).thenAnswer(inv -> remoteRun(AgentRunStatus.ACTIVE));
        when(stageExecutor.runStage(any(), any())).thenAnswer(inv -> {
            StageName stage = inv.getArgument(0);
            executed.add(stage);
            AtomicInteger left = failuresLeft.get(stage);
            if (left != null && left.getAndDecrement() > 0) {
                return StageOutcome.failure(25, stage.label() + " broke");
            }
            return StageOutcome.success(25);
        });
    }

    // ------------------------------------------------------------------
    // Straight-through
    // ------------------------------------------------------------------

    @Test
    void startValidation_allStagesPass_completesInOrderWithoutRemediation() {
        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline done = pipeline(p.getId());
        assertThat(done.getStatus()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(done.getProgressPercentage()).isEqualTo(100);
        assertThat(done.getPullRequestId()).isEqualTo(42);
        assertThat(done.getStages()).allMatch(s -> s.getStatus() == StageStatus.SUCCESS);
        assertThat(executed).containsExactlyElementsOf(StageName.ORDER);
        assertThat(done.getMergeStatus()).isEqualTo(MergeStatus.NOT_REQUESTED);
        verify(gateway, never()).create(any(), any(), any());
        verify(sourceHosting, never()).merge(any());
        verify(relay).notify(argThat(e -> e.type().equals("VALIDATION_COMPLETED")));
    }

    @Test
    void startValidation_pipelineTimestampsFollowInjectedClock() {
        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline done = pipeline(p.getId());
        assertThat(done.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(done.getUpdatedAt()).isEqualTo(clock.instant());
        assertThat(done.getCompletedAt()).isEqualTo(clock.instant());
    }

    @Test
    void startValidation_unknownProject_throws() {
        assertThatThrownBy(() -> orchestrator.startValidation("nope", PR_URL))
                .isInstanceOf(ProjectNotFoundException.class);
        assertThat(pipelines).isEmpty();
    }

    @Test
    void constructor_negativeRetryCeiling_isRefused() {
        assertThatThrownBy(() -> orchestrator(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Remediation cascade
    // ------------------------------------------------------------------

    @Test
    void stageFailure_dispatchesRemediationAndPausesPipeline() {
        failuresLeft.put(StageName.DEPENDENCY_INSTALL, new AtomicInteger(1));

        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline waiting = pipeline(p.getId());
        assertThat(waiting.getStatus()).isEqualTo(PipelineStatus.RUNNING);
        assertThat(waiting.getRetryCount()).isEqualTo(1);
        assertThat(waiting.stage(StageName.DEPENDENCY_INSTALL).getStatus()).isEqualTo(StageStatus.FAILURE);
        assertThat(waiting.getLinkedAgentRunId()).isNotNull();

        AgentRun remediation = store.get(ORG, waiting.getLinkedAgentRunId()).orElseThrow();
        assertThat(remediation.getExternalId()).isEqualTo("remote-1");
        assertThat(remediation.getStatus()).isEqualTo(AgentRunStatus.ACTIVE);
        verify(gateway).create(eq(ORG),
                argThat(prompt -> prompt.contains(PR_URL) && prompt.contains("Dependency install broke")),
                argThat(ctx -> "dependency_install".equals(ctx.get("failed_stage"))
                        && Integer.valueOf(42).equals(ctx.get("pull_request_number"))));
        assertThat(executed).containsExactly(StageName.ENVIRONMENT_SETUP, StageName.DEPENDENCY_INSTALL);
        assertThat(meters.counter("runwarden.remediation.dispatched", "stage", "dependency_install").count())
                .isEqualTo(1.0);
    }

    @Test
    void remediationCompleted_resumesAtFailedStageAndFinishes() {
        failuresLeft.put(StageName.DEPENDENCY_INSTALL, new AtomicInteger(1));
        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        assertThat(completeRemote("remote-1")).isEqualTo(WebhookOutcome.APPLIED);

        ValidationPipeline done = pipeline(p.getId());
        assertThat(done.getStatus()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(done.getLinkedAgentRunId()).isNull();
        assertThat(done.stage(StageName.DEPENDENCY_INSTALL).isRemediated()).isTrue();
        assertThat(done.stage(StageName.DEPENDENCY_INSTALL).getAttempts()).isEqualTo(2);
        assertThat(executed).containsExactly(
                StageName.ENVIRONMENT_SETUP,
                StageName.DEPENDENCY_INSTALL,
                StageName.DEPENDENCY_INSTALL,
                StageName.BUILD,
                StageName.TEST,
                StageName.DEPLOYMENT_VALIDATE);
    }

    @Test
    void duplicateCompletionWebhook_doesNotAdvanceTwice() {
        failuresLeft.put(StageName.BUILD, new AtomicInteger(1));
        orchestrator.startValidation(PROJECT, PR_URL);

        completeRemote("remote-1");
        WebhookOutcome again = completeRemote("remote-1");

        assertThat(again).isEqualTo(WebhookOutcome.DUPLICATE);
        assertThat(executed).filteredOn(s -> s == StageName.BUILD).hasSize(2);
        assertThat(executed).filteredOn(s -> s == StageName.DEPLOYMENT_VALIDATE).hasSize(1);
    }

    @Test
    void stageKeepsFailing_stopsAtRetryCeiling() {
        failuresLeft.put(StageName.BUILD, new AtomicInteger(3));
        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        completeRemote("remote-1");
        completeRemote("remote-2");

        ValidationPipeline failed = pipeline(p.getId());
        assertThat(failed.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(failed.getRetryCount()).isEqualTo(2);
        assertThat(failed.getErrorMessage()).isEqualTo("Build failed after 2 remediation attempt(s): Build broke");
        assertThat(failed.getCompletedAt()).isNotNull();
        verify(gateway, times(2)).create(any(), any(), any());
        verify(gateway).create(any(), contains("remediation attempt 2"), any());
        verify(relay).notify(argThat(e -> e.type().equals("VALIDATION_FAILED")));
    }

    @Test
    void zeroRetryCeiling_failsOnFirstStageFailure() {
        orchestrator = orchestrator(0);
        failuresLeft.put(StageName.TEST, new AtomicInteger(1));

        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        assertThat(pipeline(p.getId()).getStatus()).isEqualTo(PipelineStatus.FAILED);
        verify(gateway, never()).create(any(), any(), any());
        assertThat(executed).doesNotContain(StageName.DEPLOYMENT_VALIDATE);
    }

    @Test
    void remediationRunFails_failsPipeline() {
        failuresLeft.put(StageName.BUILD, new AtomicInteger(1));
        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);
        UUID runId = pipeline(p.getId()).getLinkedAgentRunId();

        clock.advance(Duration.ofMinutes(5));
        correlator.handle(new WebhookPayload("remote-1", ORG, "ERROR", null, null,
                "agent gave up", null, null, null));

        ValidationPipeline failed = pipeline(p.getId());
        assertThat(failed.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(failed.getErrorMessage())
                .isEqualTo("Remediation run " + runId + " ended as FAILED: agent gave up");
        assertThat(failed.getLinkedAgentRunId()).isNull();
        assertThat(executed).filteredOn(s -> s == StageName.BUILD).hasSize(1);
        verify(relay).notify(argThat(e -> e.type().equals("VALIDATION_FAILED")));
    }

    @Test
    void remediationAlreadyFinishedWhenCreated_resumesImmediately() {
        doAnswer(inv -> remoteRun(AgentRunStatus.COMPLETED)).when(gateway).create(eq(ORG), anyString(), anyMap());
        failuresLeft.put(StageName.TEST, new AtomicInteger(1));

        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline done = pipeline(p.getId());
        assertThat(done.getStatus()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(executed).filteredOn(s -> s == StageName.TEST).hasSize(2);
    }

    @Test
    void remediationDispatchFails_failsPipeline() {
        doThrow(new GatewayException(GatewayException.Kind.TRANSIENT, 503, "agent API unavailable"))
                .when(gateway).create(eq(ORG), anyString(), anyMap());
        failuresLeft.put(StageName.BUILD, new AtomicInteger(1));

        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline failed = pipeline(p.getId());
        assertThat(failed.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(failed.getErrorMessage()).startsWith("Could not dispatch remediation for Build");
        assertThat(failed.getLinkedAgentRunId()).isNull();
        // the attempted run is recorded as failed, not left pending
        assertThat(store.list(ORG)).singleElement()
                .extracting(AgentRun::getStatus).isEqualTo(AgentRunStatus.FAILED);
    }

    @Test
    void stageTimeout_isRecordedAsStageFailure() {
        orchestrator = orchestrator(0);
        doThrow(new ExecutorException("no answer after 600s", null, true))
                .when(stageExecutor).runStage(eq(StageName.BUILD), any());

        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline failed = pipeline(p.getId());
        assertThat(failed.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(failed.stage(StageName.BUILD).getError()).isEqualTo("Build timed out: no answer after 600s");
    }

    // ------------------------------------------------------------------
    // Duplicate start / cancel
    // ------------------------------------------------------------------

    @Test
    void startValidation_activePipelineForSamePullRequest_returnsIt() {
        failuresLeft.put(StageName.BUILD, new AtomicInteger(1));
        ValidationPipeline first = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline second = orchestrator.startValidation(PROJECT, PR_URL);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(pipelines).hasSize(1);
        verify(gateway, times(1)).create(any(), any(), any());
    }

    @Test
    void startValidation_previousPipelineFinished_createsNewOne() {
        ValidationPipeline first = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline second = orchestrator.startValidation(PROJECT, PR_URL);

        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(pipelines).hasSize(2);
    }

    @Test
    void cancelValidation_cancelsPipelineAndLinkedRun() {
        failuresLeft.put(StageName.BUILD, new AtomicInteger(1));
        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);
        UUID runId = pipeline(p.getId()).getLinkedAgentRunId();
        clock.advance(Duration.ofMinutes(1));

        ValidationPipeline cancelled = orchestrator.cancelValidation(p.getId());

        assertThat(cancelled.getStatus()).isEqualTo(PipelineStatus.CANCELLED);
        assertThat(cancelled.getLinkedAgentRunId()).isNull();
        verify(gateway).cancel(ORG, "remote-1");
        assertThat(store.get(ORG, runId).orElseThrow().getStatus()).isEqualTo(AgentRunStatus.CANCELLED);

        // a late completion from the agent changes nothing
        completeRemote("remote-1");
        assertThat(pipeline(p.getId()).getStatus()).isEqualTo(PipelineStatus.CANCELLED);
        assertThat(executed).filteredOn(s -> s == StageName.BUILD).hasSize(1);
    }

    @Test
    void cancelValidation_unknownPipeline_throws() {
        assertThatThrownBy(() -> orchestrator.cancelValidation(UUID.randomUUID()))
                .isInstanceOf(PipelineNotFoundException.class);
    }

    @Test
    void cancelValidation_finishedPipeline_isLeftAlone() {
        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline after = orchestrator.cancelValidation(p.getId());

        assertThat(after.getStatus()).isEqualTo(PipelineStatus.COMPLETED);
    }

    // ------------------------------------------------------------------
    // Auto-merge
    // ------------------------------------------------------------------

    @Test
    void autoMergeEnabled_mergesAfterCompletion() {
        project.setAutoMergeEnabled(true);
        when(sourceHosting.merge(PR_URL)).thenReturn(MergeOutcome.merged("abc123"));

        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline done = pipeline(p.getId());
        assertThat(done.getMergeStatus()).isEqualTo(MergeStatus.MERGED);
        assertThat(done.getMergeSha()).isEqualTo("abc123");
        verify(relay).notify(argThat(e -> e.type().equals("MERGE_COMPLETED")));
    }

    @Test
    void autoMergeFailure_leavesPipelineCompleted() {
        project.setAutoMergeEnabled(true);
        when(sourceHosting.merge(PR_URL)).thenThrow(new SourceHostingException("GitHub unreachable"));

        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        ValidationPipeline done = pipeline(p.getId());
        assertThat(done.getStatus()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(done.getMergeStatus()).isEqualTo(MergeStatus.FAILED);
        assertThat(done.getMergeError()).isEqualTo("GitHub unreachable");
        verify(relay).notify(argThat(e -> e.type().equals("MERGE_FAILED")));
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    @Test
    void recoverStalledRemediations_runFinishedWithoutEvent_resumesPipeline() {
        failuresLeft.put(StageName.BUILD, new AtomicInteger(1));
        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);
        UUID runId = pipeline(p.getId()).getLinkedAgentRunId();
        // written straight to the store: no terminal event is raised
        store.apply(ORG, runId, RunUpdate.status(clock.advance(Duration.ofMinutes(3)), AgentRunStatus.COMPLETED));

        orchestrator.recoverStalledRemediations();

        assertThat(pipeline(p.getId()).getStatus()).isEqualTo(PipelineStatus.COMPLETED);
    }

    @Test
    void recoverStalledRemediations_linkedRunStillActive_waits() {
        failuresLeft.put(StageName.BUILD, new AtomicInteger(1));
        ValidationPipeline p = orchestrator.startValidation(PROJECT, PR_URL);

        orchestrator.recoverStalledRemediations();

        ValidationPipeline waiting = pipeline(p.getId());
        assertThat(waiting.getStatus()).isEqualTo(PipelineStatus.RUNNING);
        assertThat(waiting.getLinkedAgentRunId()).isNotNull();
    }

    @Test
    void recoverStalledRemediations_orphanedRunningPipeline_isAdvanced() {
        ValidationPipeline orphan = new ValidationPipeline(ORG, PROJECT, PR_URL, 42, clock.instant());
        orphan.setStatus(PipelineStatus.RUNNING);
        pipelines.put(orphan.getId(), orphan);

        orchestrator.recoverStalledRemediations();

        assertThat(pipeline(orphan.getId()).getStatus()).isEqualTo(PipelineStatus.COMPLETED);
    }

    @Test
    void recoverStalledRemediations_interruptedDispatch_failsPipeline() {
        ValidationPipeline orphan = new ValidationPipeline(ORG, PROJECT, PR_URL, 42, clock.instant());
        orphan.setStatus(PipelineStatus.RUNNING);
        orphan.stage(StageName.ENVIRONMENT_SETUP).markRunning();
        orphan.stage(StageName.ENVIRONMENT_SETUP).markFailed(10, "disk full");
        pipelines.put(orphan.getId(), orphan);

        orchestrator.recoverStalledRemediations();

        ValidationPipeline failed = pipeline(orphan.getId());
        assertThat(failed.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("Remediation dispatch was interrupted");
        assertThat(executed).isEmpty();
    }

    // ------------------------------------------------------------------
    // Locking
    // ------------------------------------------------------------------

    @Test
    void lockFor_manyPipelines_sharesABoundedSetOfLocks() {
        UUID id = UUID.randomUUID();
        Set<ReentrantLock> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 10_000; i++) {
            distinct.add(orchestrator.lockFor(UUID.randomUUID()));
        }

        assertThat(orchestrator.lockFor(id)).isSameAs(orchestrator.lockFor(id));
        assertThat(distinct).hasSizeLessThanOrEqualTo(64);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ValidationOrchestrator orchestrator(int maxRetries) {
        return new ValidationOrchestrator(pipelineRepo, projectRepo, store, stageExecutor, syncEngine,
                sourceHosting, changes, relay, Runnable::run, meters, clock, maxRetries);
    }

    private void wirePipelineRepository() {
        when(pipelineRepo.save(any(ValidationPipeline.class))).thenAnswer(inv -> {
            ValidationPipeline p = inv.getArgument(0);
            pipelines.put(p.getId(), p);
            return p;
        });
        when(pipelineRepo.findById(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(pipelines.get(inv.<UUID>getArgument(0))));
        when(pipelineRepo.findByLinkedAgentRunId(any(UUID.class))).thenAnswer(inv -> pipelines.values().stream()
                .filter(p -> inv.getArgument(0).equals(p.getLinkedAgentRunId()))
                .findFirst());
        when(pipelineRepo.findFirstByProjectIdAndPullRequestUrlOrderByCreatedAtDesc(anyString(), anyString()))
                .thenAnswer(inv -> pipelines.values().stream()
                        .filter(p -> p.getProjectId().equals(inv.getArgument(0))
                                && p.getPullRequestUrl().equals(inv.getArgument(1)))
                        .reduce((older, newer) -> newer));
        when(pipelineRepo.findByStatusAndLinkedAgentRunIdIsNotNull(any())).thenAnswer(inv -> pipelines.values().stream()
                .filter(p -> p.getStatus() == inv.getArgument(0) && p.getLinkedAgentRunId() != null)
                .toList());
        when(pipelineRepo.findByStatusAndLinkedAgentRunIdIsNull(any())).thenAnswer(inv -> pipelines.values().stream()
                .filter(p -> p.getStatus() == inv.getArgument(0) && p.getLinkedAgentRunId() == null)
                .toList());
    }

    private RunSnapshot remoteRun(AgentRunStatus status) {
        String id = "remote-" + remoteIds.incrementAndGet();
        return new RunSnapshot(id, ORG, status, null, null, null, null,
                "https://agent.example.com/runs/" + id, null, null, null);
    }

    private WebhookOutcome completeRemote(String externalId) {
        clock.advance(Duration.ofMinutes(5));
        return correlator.handle(new WebhookPayload(externalId, ORG, "COMPLETE", 100, "Pushed fix",
                null, null, null, null));
    }

    private ValidationPipeline pipeline(UUID id) {
        return pipelines.get(id);
    }
}
