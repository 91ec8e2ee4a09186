package com.runwarden.orchestrator.executor;

import com.runwarden.orchestrator.executor.dto.StageContext;
import com.runwarden.orchestrator.executor.dto.StageOutcome;
import com.runwarden.orchestrator.model.StageName;

/**
 * The sandbox that actually sets up, installs, builds, tests and deploys a
 * pull request. The orchestrator only knows stage names; which commands run
 * for a stage is the sandbox's business.
 */
public interface StageExecutor {

    /**
     * Run one stage to completion.
     *
     * @throws ExecutorException when the sandbox cannot be reached or times out
     */
    StageOutcome runStage(StageName stage, StageContext context);
}
