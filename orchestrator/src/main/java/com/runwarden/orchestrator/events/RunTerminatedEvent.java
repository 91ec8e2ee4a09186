package com.runwarden.orchestrator.events;

import com.runwarden.orchestrator.model.AgentRun;

/**
 * Published exactly once per run, by whichever writer moved it into a
 * terminal state. The validation orchestrator listens for it to resume or
 * fail the pipeline waiting on that run.
 */
public record RunTerminatedEvent(AgentRun run) {}
