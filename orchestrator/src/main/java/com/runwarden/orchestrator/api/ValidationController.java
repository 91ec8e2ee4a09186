package com.runwarden.orchestrator.api;

import com.runwarden.orchestrator.api.dto.StartValidationRequest;
import com.runwarden.orchestrator.api.dto.ValidationResponse;
import com.runwarden.orchestrator.model.ValidationPipeline;
import com.runwarden.orchestrator.validation.PipelineNotFoundException;
import com.runwarden.orchestrator.validation.ProjectNotFoundException;
import com.runwarden.orchestrator.validation.ValidationOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for pull request validation.
 *
 * POST /validations                start validating a pull request (202, runs in the background)
 * GET  /validations/{id}           pipeline state with every stage
 * POST /validations/{id}/cancel    stop the pipeline and its remediation run
 */
@RestController
@RequestMapping("/validations")
public class ValidationController {

    private final ValidationOrchestrator orchestrator;

    public ValidationController(ValidationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Returns the already-running pipeline when the pull request has one.
     *
     * Example:
     *   curl -X POST http://localhost:8080/validations \
     *     -H "Content-Type: application/json" \
     *     -d '{"projectId":"shop","pullRequestUrl":"https://github.com/acme/shop/pull/42"}'
     */
    @PostMapping
    public ResponseEntity<ValidationResponse> start(@RequestBody StartValidationRequest req) {
        if (req.projectId() == null || req.projectId().isBlank()
                || req.pullRequestUrl() == null || req.pullRequestUrl().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "projectId and pullRequestUrl are required");
        }
        try {
            ValidationPipeline pipeline = orchestrator.startValidation(req.projectId(), req.pullRequestUrl().trim());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(ValidationResponse.from(pipeline));
        } catch (ProjectNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @GetMapping("/{id}")
    public ValidationResponse get(@PathVariable UUID id) {
        return orchestrator.getValidationStatus(id)
                .map(ValidationResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Validation pipeline not found: " + id));
    }

    @PostMapping("/{id}/cancel")
    public ValidationResponse cancel(@PathVariable UUID id) {
        try {
            return ValidationResponse.from(orchestrator.cancelValidation(id));
        } catch (PipelineNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }
}
