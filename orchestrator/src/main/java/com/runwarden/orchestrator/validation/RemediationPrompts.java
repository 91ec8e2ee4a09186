package com.runwarden.orchestrator.validation;

import com.runwarden.orchestrator.model.StageName;
import com.runwarden.orchestrator.model.ValidationPipeline;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the instruction and metadata sent to the agent when a validation
 * stage fails.
 */
final class RemediationPrompts {

    // Stage output can be huge; the agent only needs the tail.
    static final int MAX_ERROR_CHARS = 8_000;

    private RemediationPrompts() {}

    static String forFailure(ValidationPipeline pipeline, StageName stage, String error) {
        StringBuilder sb = new StringBuilder();
        sb.append("Validation of pull request ").append(pipeline.getPullRequestUrl())
          .append(" failed at stage \"").append(stage.label()).append("\"");
        if (pipeline.getRetryCount() > 1) {
            sb.append(" (remediation attempt ").append(pipeline.getRetryCount()).append(")");
        }
        sb.append(".\n\nError output:\n").append(tail(error)).append("\n");
        if (pipeline.getDeploymentUrl() != null) {
            sb.append("\nDeployment under test: ").append(pipeline.getDeploymentUrl()).append("\n");
        }
        sb.append("\nAnalyze the error and push a fix to the same pull request branch. ")
          .append("Do not open a new pull request.");
        return sb.toString();
    }

    static Map<String, Object> context(ValidationPipeline pipeline, StageName stage) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("pipeline_id", pipeline.getId().toString());
        ctx.put("project_id", pipeline.getProjectId());
        ctx.put("pull_request_url", pipeline.getPullRequestUrl());
        if (pipeline.getPullRequestId() != null) {
            ctx.put("pull_request_number", pipeline.getPullRequestId());
        }
        ctx.put("failed_stage", stage.wireName());
        return ctx;
    }

    static String tail(String error) {
        if (error == null || error.isBlank()) return "(no error output)";
        if (error.length() <= MAX_ERROR_CHARS) return error;
        return "..." + error.substring(error.length() - MAX_ERROR_CHARS);
    }
}
