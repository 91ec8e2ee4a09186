package com.runwarden.orchestrator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runwarden.orchestrator.executor.dto.StageContext;
import com.runwarden.orchestrator.executor.dto.StageOutcome;
import com.runwarden.orchestrator.executor.dto.StageRunResponse;
import com.runwarden.orchestrator.model.StageName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * HTTP client for the sandbox executor service.
 *
 * One endpoint, POST /stage/run, executes a named stage against a pull
 * request checkout and answers with its status, duration and output.
 * Called from the validation worker pool, so blocking I/O here is fine.
 */
@Component
public class SandboxStageClient implements StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(SandboxStageClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     stageTimeout;

    public SandboxStageClient(@Value("${runwarden.executor.base-url}") String baseUrl,
                              @Value("${runwarden.executor.stage-timeout:PT10M}") Duration stageTimeout,
                              ObjectMapper objectMapper) {
        this.baseUrl      = baseUrl;
        this.stageTimeout = stageTimeout;
        this.json         = objectMapper;
        this.http         = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public StageOutcome runStage(StageName stage, StageContext context) {
        log.info("Running stage {} for pipeline {}", stage, context.pipelineId());
        Map<String, Object> body = new HashMap<>();
        body.put("stage",            stage.wireName());
        body.put("pipeline_id",      context.pipelineId().toString());
        body.put("project_id",       context.projectId());
        body.put("pull_request_url", context.pullRequestUrl());
        body.put("timeout_sec",      stageTimeout.toSeconds());
        if (context.repositoryUrl() != null) body.put("repository_url", context.repositoryUrl());
        if (context.deploymentUrl() != null) body.put("deployment_url", context.deploymentUrl());

        long started = System.nanoTime();
        // Allow a bit more wall-clock time than the sandbox's own deadline.
        String respBody = post("/stage/run", toJson(body), "runStage " + stage,
                stageTimeout.plusSeconds(30));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        StageRunResponse resp;
        try {
            resp = json.readValue(respBody, StageRunResponse.class);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse runStage response", e);
        }
        long duration = resp.duration_ms() != null ? resp.duration_ms() : elapsedMs;
        return resp.succeeded()
                ? new StageOutcome(true, duration, null, resp.deployment_url())
                : new StageOutcome(false, duration, resp.failureText(), resp.deployment_url());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, String jsonBody, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ExecutorException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new ExecutorException(opName + " timed out after " + timeout.toSeconds() + "s", e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }
}
