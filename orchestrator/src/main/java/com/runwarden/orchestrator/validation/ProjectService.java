package com.runwarden.orchestrator.validation;

import com.runwarden.orchestrator.model.Project;
import com.runwarden.orchestrator.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Registration of projects and their auto-merge setting.
 */
@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepo;
    private final Clock             clock;

    public ProjectService(ProjectRepository projectRepo, Clock clock) {
        this.projectRepo = projectRepo;
        this.clock       = clock;
    }

    /** Create the project or overwrite its settings. */
    @Transactional
    public Project upsert(String projectId, String organizationId, String repositoryUrl, boolean autoMergeEnabled) {
        Project project = projectRepo.findById(projectId)
                .orElseGet(() -> new Project(projectId, organizationId));
        project.setOrganizationId(organizationId);
        project.setRepositoryUrl(repositoryUrl);
        project.setAutoMergeEnabled(autoMergeEnabled);
        project.touch(clock.instant());
        Project saved = projectRepo.save(project);
        log.info("Project {} saved (org={}, autoMerge={})", projectId, organizationId, autoMergeEnabled);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Project> find(String projectId) {
        return projectRepo.findById(projectId);
    }
}
