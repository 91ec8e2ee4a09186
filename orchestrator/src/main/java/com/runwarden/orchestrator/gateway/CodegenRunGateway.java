package com.runwarden.orchestrator.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runwarden.orchestrator.gateway.dto.AgentRunResponse;
import com.runwarden.orchestrator.gateway.dto.RunSnapshot;
import com.runwarden.orchestrator.model.AgentRunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP implementation of {@link RemoteRunGateway} against the Codegen
 * agent API ({@code /v1/organizations/{org}/agent/...}).
 *
 * Uses java.net.http.HttpClient with an explicit per-request timeout;
 * a timeout surfaces as a TRANSIENT {@link GatewayException}.
 */
@Component
public class CodegenRunGateway implements RemoteRunGateway {

    private static final Logger log = LoggerFactory.getLogger(CodegenRunGateway.class);

    private static final int LIST_PAGE_SIZE = 100;
    private static final int LIST_MAX_PAGES = 50;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiToken;
    private final Duration     timeout;

    public CodegenRunGateway(@Value("${runwarden.gateway.base-url}") String baseUrl,
                             @Value("${runwarden.gateway.api-token}") String apiToken,
                             @Value("${runwarden.gateway.timeout:PT30S}") Duration timeout,
                             ObjectMapper objectMapper) {
        this.baseUrl  = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiToken = apiToken;
        this.timeout  = timeout;
        this.json     = objectMapper;
        this.http     = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // RemoteRunGateway
    // ------------------------------------------------------------------

    @Override
    public RunSnapshot create(String organizationId, String prompt, Map<String, Object> context) {
        Map<String, Object> body = new HashMap<>();
        body.put("prompt", prompt);
        if (context != null && !context.isEmpty()) {
            body.put("metadata", context);
        }
        String resp = send("POST", orgPath(organizationId) + "/agent/run", toJson(body), "create run");
        AgentRunResponse run = parse(resp, AgentRunResponse.class, "create run");
        log.info("Remote run {} created for org {} (status={})", run.id(), organizationId, run.status());
        return toSnapshot(run, organizationId);
    }

    @Override
    public RunSnapshot resume(String organizationId, String externalId, String instruction) {
        Map<String, Object> body = new HashMap<>();
        body.put("agent_run_id", parseRunId(externalId));
        if (instruction != null && !instruction.isBlank()) {
            body.put("prompt", instruction);
        }
        String resp = send("POST", orgPath(organizationId) + "/agent/run/resume", toJson(body),
                "resume run " + externalId);
        return toSnapshot(parse(resp, AgentRunResponse.class, "resume run"), organizationId);
    }

    @Override
    public RunSnapshot fetch(String organizationId, String externalId) {
        String resp = send("GET", orgPath(organizationId) + "/agent/run/" + externalId, null,
                "fetch run " + externalId);
        return toSnapshot(parse(resp, AgentRunResponse.class, "fetch run"), organizationId);
    }

    @Override
    public List<RunSnapshot> list(String organizationId) {
        List<RunSnapshot> all = new ArrayList<>();
        for (int page = 1; page <= LIST_MAX_PAGES; page++) {
            String resp = send("GET",
                    orgPath(organizationId) + "/agent/runs?page=" + page + "&size=" + LIST_PAGE_SIZE,
                    null, "list runs");
            AgentRunResponse.Page parsed = parse(resp, AgentRunResponse.Page.class, "list runs");
            if (parsed.items() != null) {
                parsed.items().forEach(r -> all.add(toSnapshot(r, organizationId)));
            }
            if (parsed.items() == null || parsed.items().isEmpty() || page >= parsed.pages()) {
                break;
            }
        }
        return all;
    }

    @Override
    public void cancel(String organizationId, String externalId) {
        String body = toJson(Map.of("agent_run_id", parseRunId(externalId)));
        send("POST", orgPath(organizationId) + "/agent/run/stop", body, "cancel run " + externalId);
        log.info("Remote run {} cancelled for org {}", externalId, organizationId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String orgPath(String organizationId) {
        return baseUrl + "/v1/organizations/" + organizationId;
    }

    private String send(String method, String url, String jsonBody, String operation) {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiToken)
                .header("Accept", "application/json");
        if (jsonBody != null) {
            req.header("Content-Type", "application/json")
               .method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
        } else {
            req.method(method, HttpRequest.BodyPublishers.noBody());
        }
        try {
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw GatewayException.forStatus(resp.statusCode(), operation, resp.body());
            }
            return resp.body();
        } catch (IOException e) {
            // HttpTimeoutException is an IOException
            throw new GatewayException(GatewayException.Kind.TRANSIENT, operation + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(GatewayException.Kind.TRANSIENT, operation + " interrupted", e);
        }
    }

    private <T> T parse(String body, Class<T> type, String operation) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new GatewayException(GatewayException.Kind.TRANSIENT,
                    "Failed to parse " + operation + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new GatewayException(GatewayException.Kind.REJECTED, "JSON serialization failed", e);
        }
    }

    // The remote API uses numeric run ids; keep them numeric on the wire when they are.
    private static Object parseRunId(String externalId) {
        try {
            return Long.parseLong(externalId);
        } catch (NumberFormatException e) {
            return externalId;
        }
    }

    static RunSnapshot toSnapshot(AgentRunResponse r, String organizationId) {
        return new RunSnapshot(
                r.id(),
                r.organization_id() != null ? r.organization_id() : organizationId,
                AgentRunStatus.fromRemote(r.status()),
                r.progress_percentage(),
                r.current_step(),
                resultText(r.result()),
                r.error(),
                r.web_url(),
                r.prompt(),
                parseInstant(r.created_at()),
                parseInstant(r.updated_at()));
    }

    private static String resultText(JsonNode result) {
        if (result == null || result.isNull()) return null;
        return result.isTextual() ? result.asText() : result.toString();
    }

    static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                // The API sometimes omits the zone; its clock is UTC.
                return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable timestamp from remote API: {}", raw);
                return null;
            }
        }
    }
}
