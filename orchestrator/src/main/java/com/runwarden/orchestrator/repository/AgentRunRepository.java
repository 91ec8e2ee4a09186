package com.runwarden.orchestrator.repository;

import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.model.AgentRunStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + lookup queries for the agent_runs table.
 *
 * Writers go through the {@code lock*} finders so that each record is
 * mutated by one transaction at a time (SELECT ... FOR UPDATE).
 */
public interface AgentRunRepository extends JpaRepository<AgentRun, UUID>,
                                            JpaSpecificationExecutor<AgentRun> {

    /** Secondary index lookup used by webhook correlation. */
    Optional<AgentRun> findByExternalId(String externalId);

    List<AgentRun> findByOrganizationIdOrderByCreatedAtDesc(String organizationId);

    List<AgentRun> findByOrganizationIdAndStatusInOrderByCreatedAtAsc(String organizationId,
                                                                      Collection<AgentRunStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM AgentRun r WHERE r.id = :id")
    Optional<AgentRun> lockById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM AgentRun r WHERE r.externalId = :externalId")
    Optional<AgentRun> lockByExternalId(@Param("externalId") String externalId);

    /** Organizations that still have at least one run in one of the given states. */
    @Query("SELECT DISTINCT r.organizationId FROM AgentRun r WHERE r.status IN :statuses")
    List<String> findOrganizationsWithStatusIn(@Param("statuses") Collection<AgentRunStatus> statuses);
}
