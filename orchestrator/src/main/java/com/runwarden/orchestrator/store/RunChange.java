package com.runwarden.orchestrator.store;

import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.model.AgentRunStatus;
import com.runwarden.orchestrator.model.MergeResult;

/**
 * Result of one store write: the record as it stands afterwards, the
 * status it had before, and what the merge did.
 *
 * {@code previousStatus} is null when the write inserted the record.
 */
public record RunChange(AgentRun run, AgentRunStatus previousStatus, MergeResult result) {

    public boolean applied() {
        return result == MergeResult.APPLIED;
    }

    public boolean inserted() {
        return previousStatus == null && applied();
    }

    public boolean statusChanged() {
        return applied() && previousStatus != run.getStatus();
    }

    /** True only for the write that moved the run into a terminal state. */
    public boolean becameTerminal() {
        return statusChanged() && run.isTerminal()
                && (previousStatus == null || !previousStatus.isTerminal());
    }
}
