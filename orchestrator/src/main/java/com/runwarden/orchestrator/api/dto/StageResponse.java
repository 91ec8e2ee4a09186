package com.runwarden.orchestrator.api.dto;

import com.runwarden.orchestrator.model.StageResult;
import com.runwarden.orchestrator.model.StageStatus;

public record StageResponse(
        String      name,
        String      label,
        StageStatus status,
        Long        durationMs,
        String      error,
        int         attempts,
        boolean     remediated
) {
    public static StageResponse from(StageResult s) {
        return new StageResponse(
                s.getStageName().wireName(),
                s.getStageName().label(),
                s.getStatus(),
                s.getDurationMs(),
                s.getError(),
                s.getAttempts(),
                s.isRemediated()
        );
    }
}
