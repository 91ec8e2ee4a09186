package com.runwarden.orchestrator.repository;

import com.runwarden.orchestrator.model.PipelineStatus;
import com.runwarden.orchestrator.model.ValidationPipeline;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the validation_pipelines table.
 */
public interface ValidationPipelineRepository extends JpaRepository<ValidationPipeline, UUID> {

    /** The pipeline waiting on a given remediation run, if any. */
    Optional<ValidationPipeline> findByLinkedAgentRunId(UUID agentRunId);

    /** Latest pipeline for a pull request (secondary index on project + PR URL). */
    Optional<ValidationPipeline> findFirstByProjectIdAndPullRequestUrlOrderByCreatedAtDesc(
            String projectId, String pullRequestUrl);

    /** Pipelines paused on a remediation run; scanned by the stalled-remediation recovery. */
    List<ValidationPipeline> findByStatusAndLinkedAgentRunIdIsNotNull(PipelineStatus status);

    /** Pipelines in a state with no remediation pending; used to restart orphaned advance loops. */
    List<ValidationPipeline> findByStatusAndLinkedAgentRunIdIsNull(PipelineStatus status);
}
