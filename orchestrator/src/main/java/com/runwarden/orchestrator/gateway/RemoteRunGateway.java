package com.runwarden.orchestrator.gateway;

import com.runwarden.orchestrator.gateway.dto.RunSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Narrow view of the remote agent-execution API.
 *
 * Every method is a bounded-time remote call and throws
 * {@link GatewayException} on failure; nothing here touches local state.
 */
public interface RemoteRunGateway {

    /** Start a new run. The returned snapshot carries the remote id and initial status. */
    RunSnapshot create(String organizationId, String prompt, Map<String, Object> context);

    /** Send a follow-up instruction to an existing run. */
    RunSnapshot resume(String organizationId, String externalId, String instruction);

    RunSnapshot fetch(String organizationId, String externalId);

    /** Every run the remote side knows for the organization. */
    List<RunSnapshot> list(String organizationId);

    void cancel(String organizationId, String externalId);
}
