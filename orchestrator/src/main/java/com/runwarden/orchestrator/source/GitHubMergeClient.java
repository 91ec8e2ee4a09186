package com.runwarden.orchestrator.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
import java.time.Duration;
import java.util.Map;

/**
 * Merges pull requests through the GitHub REST API
 * ({@code PUT /repos/{owner}/{repo}/pulls/{number}/merge}).
 */
@Component
public class GitHubMergeClient implements SourceHostingClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubMergeClient.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MergeResponse(String sha, Boolean merged, String message) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiUrl;
    private final String       token;
    private final String       mergeMethod;
    private final Duration     timeout;

    public GitHubMergeClient(@Value("${runwarden.source.api-url:https://api.github.com}") String apiUrl,
                             @Value("${runwarden.source.token:}") String token,
                             @Value("${runwarden.source.merge-method:squash}") String mergeMethod,
                             @Value("${runwarden.source.timeout:PT30S}") Duration timeout,
                             ObjectMapper objectMapper) {
        this.apiUrl      = apiUrl;
        this.token       = token;
        this.mergeMethod = mergeMethod;
        this.timeout     = timeout;
        this.json        = objectMapper;
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public MergeOutcome merge(String pullRequestUrl) {
        PullRequestRef pr = PullRequestRef.parse(pullRequestUrl)
                .orElseThrow(() -> new SourceHostingException("Not a pull request URL: " + pullRequestUrl));
        String url = "%s/repos/%s/%s/pulls/%d/merge".formatted(apiUrl, pr.owner(), pr.repo(), pr.number());
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Accept", "application/vnd.github+json")
                    .header("Content-Type", "application/json")
                    .PUT(HttpRequest.BodyPublishers.ofString(
                            json.writeValueAsString(Map.of("merge_method", mergeMethod))));
            if (!token.isBlank()) {
                req.header("Authorization", "Bearer " + token);
            }
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            MergeResponse body = parseLenient(resp.body());
            if (resp.statusCode() == 200 && (body.merged() == null || body.merged())) {
                log.info("Merged {} as {}", pullRequestUrl, body.sha());
                return MergeOutcome.merged(body.sha());
            }
            String reason = body.message() != null ? body.message() : "HTTP " + resp.statusCode();
            log.warn("Merge of {} refused: {}", pullRequestUrl, reason);
            return MergeOutcome.refused(reason);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceHostingException("Merge of " + pullRequestUrl + " interrupted", e);
        } catch (Exception e) {
            throw new SourceHostingException("Merge of " + pullRequestUrl + " failed: " + e.getMessage(), e);
        }
    }

    private MergeResponse parseLenient(String body) {
        if (body == null || body.isBlank()) return new MergeResponse(null, null, null);
        try {
            return json.readValue(body, MergeResponse.class);
        } catch (JsonProcessingException e) {
            return new MergeResponse(null, null, body);
        }
    }
}
