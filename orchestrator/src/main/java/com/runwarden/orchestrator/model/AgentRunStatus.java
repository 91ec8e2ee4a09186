package com.runwarden.orchestrator.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle states of an agent run.
 *
 * Transitions:
 *   PENDING → ACTIVE ⇄ WAITING_INPUT / PAUSED   (non-terminal sub-states)
 *   any non-terminal → COMPLETED | FAILED | CANCELLED | TIMED_OUT
 *                      | MAX_ITERATIONS_REACHED | OUT_OF_TOKENS
 *
 * Terminal states never move again. A later update may only fill in
 * result, error or progress while keeping the same terminal status.
 */
public enum AgentRunStatus {
    PENDING,
    ACTIVE,
    WAITING_INPUT,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMED_OUT,
    MAX_ITERATIONS_REACHED,
    OUT_OF_TOKENS;

    private static final Set<AgentRunStatus> TERMINAL = EnumSet.of(
            COMPLETED, FAILED, CANCELLED, TIMED_OUT, MAX_ITERATIONS_REACHED, OUT_OF_TOKENS);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static Set<AgentRunStatus> nonTerminal() {
        return EnumSet.complementOf(EnumSet.copyOf(TERMINAL));
    }

    /**
     * Map a status string reported by the remote agent API or a webhook.
     *
     * The remote side speaks its own vocabulary (COMPLETE, ERROR, TIMEOUT,
     * EVALUATION...), so unknown values fall back to ACTIVE: a run we cannot
     * classify is still being worked on as far as we can tell.
     */
    public static AgentRunStatus fromRemote(String raw) {
        if (raw == null || raw.isBlank()) return ACTIVE;
        String s = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (s) {
            case "PENDING", "QUEUED"                      -> PENDING;
            case "ACTIVE", "RUNNING", "EVALUATION"        -> ACTIVE;
            case "WAITING_INPUT", "WAITING_FOR_INPUT"     -> WAITING_INPUT;
            case "PAUSED"                                 -> PAUSED;
            case "COMPLETE", "COMPLETED", "SUCCESS"       -> COMPLETED;
            case "FAILED", "ERROR"                        -> FAILED;
            case "CANCELLED", "CANCELED", "STOPPED"       -> CANCELLED;
            case "TIMEOUT", "TIMED_OUT"                   -> TIMED_OUT;
            case "MAX_ITERATIONS_REACHED"                 -> MAX_ITERATIONS_REACHED;
            case "OUT_OF_TOKENS"                          -> OUT_OF_TOKENS;
            default                                       -> ACTIVE;
        };
    }
}
