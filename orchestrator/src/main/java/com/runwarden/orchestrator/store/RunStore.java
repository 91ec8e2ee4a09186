package com.runwarden.orchestrator.store;

import com.runwarden.orchestrator.gateway.dto.RunSnapshot;
import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.model.RunUpdate;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The local view of agent runs, scoped per organization.
 *
 * Every write goes through {@link AgentRun#merge}, so all writers (user
 * intents, poller, webhooks) obey the same rule: the observation with the
 * later timestamp wins regardless of arrival order, and terminal records
 * are never reopened. Other components depend on this interface only.
 */
public interface RunStore {

    Optional<AgentRun> get(String organizationId, UUID runId);

    /** Lookup through the external id index; ids are unique across organizations. */
    Optional<AgentRun> findByExternalId(String externalId);

    List<AgentRun> list(String organizationId);

    /** Runs the poller still has to watch, oldest first. */
    List<AgentRun> listNonTerminal(String organizationId);

    Page<AgentRun> search(String organizationId, RunFilter filter, Pageable pageable);

    /** Organizations owning at least one non-terminal run. */
    List<String> watchedOrganizations();

    /** Persist a freshly created run. */
    AgentRun insert(AgentRun run);

    /**
     * Merge an observation into an existing run.
     *
     * @throws RunNotFoundException if the run does not exist in the organization
     */
    RunChange apply(String organizationId, UUID runId, RunUpdate update);

    /**
     * Merge a remote snapshot, matched by external id. Runs this instance
     * has never seen are inserted.
     *
     * @param requestIssuedAt when the remote call that produced the snapshot started
     */
    RunChange upsert(String organizationId, RunSnapshot snapshot, Instant requestIssuedAt);

    /** User-initiated eviction of a run from the local view. */
    boolean delete(String organizationId, UUID runId);
}
