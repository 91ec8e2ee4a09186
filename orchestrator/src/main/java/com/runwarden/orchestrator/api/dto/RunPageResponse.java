package com.runwarden.orchestrator.api.dto;

import com.runwarden.orchestrator.model.AgentRun;
import org.springframework.data.domain.Page;

import java.util.List;

/** One page of GET /organizations/{org}/agent-runs. */
public record RunPageResponse(List<RunResponse> items, long total, int page, int size, int pages) {

    public static RunPageResponse from(Page<AgentRun> page) {
        return new RunPageResponse(
                page.getContent().stream().map(RunResponse::from).toList(),
                page.getTotalElements(),
                page.getNumber(),
                page.getSize(),
                page.getTotalPages()
        );
    }
}
