package com.runwarden.orchestrator.api;

import com.runwarden.orchestrator.gateway.GatewayException;
import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.model.AgentRunStatus;
import com.runwarden.orchestrator.model.ResponseType;
import com.runwarden.orchestrator.model.RunUpdate;
import com.runwarden.orchestrator.store.RunFilter;
import com.runwarden.orchestrator.store.RunNotFoundException;
import com.runwarden.orchestrator.store.RunStore;
import com.runwarden.orchestrator.sync.RunStateException;
import com.runwarden.orchestrator.sync.SyncEngine;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for AgentRunController. SyncEngine and RunStore are mocks.
 */
@WebMvcTest(AgentRunController.class)
class AgentRunControllerTest {

    static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired   MockMvc    mockMvc;
    @MockitoBean SyncEngine syncEngine;
    @MockitoBean RunStore   runStore;

    // ------------------------------------------------------------------
    // POST /organizations/{org}/agent-runs
    // ------------------------------------------------------------------

    @Test
    void create_validRequest_returns201WithRun() throws Exception {
        AgentRun run = run(AgentRunStatus.ACTIVE, "remote-7");
        when(syncEngine.createRun(eq("org-1"), eq("Fix the flaky checkout test"), anyMap(),
                eq(ResponseType.PULL_REQUEST))).thenReturn(run);

        mockMvc.perform(post("/organizations/{org}/agent-runs", "org-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"prompt":"Fix the flaky checkout test","context":{"ticket":"SHOP-12"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(run.getId().toString()))
                .andExpect(jsonPath("$.externalId").value("remote-7"))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.terminal").value(false));
    }

    @Test
    void create_blankPrompt_returns400() throws Exception {
        mockMvc.perform(post("/organizations/{org}/agent-runs", "org-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"  \"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(syncEngine);
    }

    @Test
    void create_remoteFailure_returns502() throws Exception {
        when(syncEngine.createRun(any(), any(), any(), any()))
                .thenThrow(new GatewayException(GatewayException.Kind.TRANSIENT, 503, "create run failed with HTTP 503"));

        mockMvc.perform(post("/organizations/{org}/agent-runs", "org-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"Fix it\"}"))
                .andExpect(status().isBadGateway());
    }

    // ------------------------------------------------------------------
    // GET list
    // ------------------------------------------------------------------

    @Test
    void list_passesFiltersSortAndPaging() throws Exception {
        AgentRun run = run(AgentRunStatus.FAILED, "remote-1");
        when(runStore.search(eq("org-1"), any(), any()))
                .thenReturn(new PageImpl<>(List.of(run), PageRequest.of(1, 10), 11));

        mockMvc.perform(get("/organizations/{org}/agent-runs", "org-1")
                        .param("status", "FAILED", "CANCELLED")
                        .param("query", "checkout")
                        .param("createdAfter", "2024-04-01T00:00:00Z")
                        .param("sort", "lastUpdatedAt")
                        .param("direction", "asc")
                        .param("page", "1")
                        .param("size", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].status").value("FAILED"))
                .andExpect(jsonPath("$.total").value(11))
                .andExpect(jsonPath("$.pages").value(2));

        ArgumentCaptor<RunFilter> filter   = ArgumentCaptor.forClass(RunFilter.class);
        ArgumentCaptor<Pageable>  pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(runStore).search(eq("org-1"), filter.capture(), pageable.capture());
        assertThat(filter.getValue().statuses()).containsExactlyInAnyOrder(AgentRunStatus.FAILED, AgentRunStatus.CANCELLED);
        assertThat(filter.getValue().query()).isEqualTo("checkout");
        assertThat(filter.getValue().createdAfter()).isEqualTo(Instant.parse("2024-04-01T00:00:00Z"));
        assertThat(filter.getValue().createdBefore()).isNull();
        assertThat(pageable.getValue().getPageNumber()).isEqualTo(1);
        assertThat(pageable.getValue().getPageSize()).isEqualTo(10);
        assertThat(pageable.getValue().getSort()).isEqualTo(Sort.by(Sort.Direction.ASC, "lastUpdatedAt"));
    }

    @Test
    void list_unknownSortField_returns400() throws Exception {
        mockMvc.perform(get("/organizations/{org}/agent-runs", "org-1").param("sort", "prompt"))
                .andExpect(status().isBadRequest());

        verify(runStore, never()).search(any(), any(), any());
    }

    @Test
    void list_oversizedPage_returns400() throws Exception {
        mockMvc.perform(get("/organizations/{org}/agent-runs", "org-1").param("size", "500"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET / DELETE one
    // ------------------------------------------------------------------

    @Test
    void get_existingRun_returns200() throws Exception {
        AgentRun run = run(AgentRunStatus.COMPLETED, "remote-3");
        when(runStore.get("org-1", run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/organizations/{org}/agent-runs/{id}", "org-1", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.terminal").value(true))
                .andExpect(jsonPath("$.progressPercentage").value(100));
    }

    @Test
    void get_unknownRun_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(runStore.get("org-1", id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/organizations/{org}/agent-runs/{id}", "org-1", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void delete_existingRun_returns204() throws Exception {
        UUID id = UUID.randomUUID();
        when(runStore.delete("org-1", id)).thenReturn(true);

        mockMvc.perform(delete("/organizations/{org}/agent-runs/{id}", "org-1", id))
                .andExpect(status().isNoContent());
    }

    @Test
    void delete_unknownRun_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(runStore.delete("org-1", id)).thenReturn(false);

        mockMvc.perform(delete("/organizations/{org}/agent-runs/{id}", "org-1", id))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // resume / cancel
    // ------------------------------------------------------------------

    @Test
    void resume_terminalRun_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(syncEngine.resumeRun("org-1", id, "try again"))
                .thenThrow(new RunStateException("Run " + id + " is COMPLETED and cannot be resumed"));

        mockMvc.perform(post("/organizations/{org}/agent-runs/{id}/resume", "org-1", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruction\":\"try again\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void resume_blankInstruction_returns400() throws Exception {
        mockMvc.perform(post("/organizations/{org}/agent-runs/{id}/resume", "org-1", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cancel_existingRun_returnsCancelledRun() throws Exception {
        AgentRun run = run(AgentRunStatus.CANCELLED, "remote-4");
        when(syncEngine.cancelRun("org-1", run.getId())).thenReturn(run);

        mockMvc.perform(post("/organizations/{org}/agent-runs/{id}/cancel", "org-1", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    void cancel_runInOtherOrganization_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(syncEngine.cancelRun("org-2", id)).thenThrow(new RunNotFoundException("org-2", id));

        mockMvc.perform(post("/organizations/{org}/agent-runs/{id}/cancel", "org-2", id))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AgentRun run(AgentRunStatus status, String externalId) {
        AgentRun run = new AgentRun("org-1", "Fix the flaky checkout test", ResponseType.PULL_REQUEST, T0);
        run.merge(new RunUpdate(T0.plusSeconds(5), externalId, status, null, null, null, null, null));
        return run;
    }
}
