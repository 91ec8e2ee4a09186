package com.runwarden.orchestrator.api;

import com.runwarden.orchestrator.api.dto.ProjectRequest;
import com.runwarden.orchestrator.api.dto.ProjectResponse;
import com.runwarden.orchestrator.validation.ProjectService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * PUT /projects/{id}: register a project or change its settings
 * GET /projects/{id}: current settings
 */
@RestController
@RequestMapping("/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @PutMapping("/{id}")
    public ProjectResponse put(@PathVariable String id, @RequestBody ProjectRequest req) {
        if (req.organizationId() == null || req.organizationId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "organizationId is required");
        }
        return ProjectResponse.from(projectService.upsert(id, req.organizationId(), req.repositoryUrl(),
                Boolean.TRUE.equals(req.autoMergeEnabled())));
    }

    @GetMapping("/{id}")
    public ProjectResponse get(@PathVariable String id) {
        return projectService.find(id)
                .map(ProjectResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Project not found: " + id));
    }
}
