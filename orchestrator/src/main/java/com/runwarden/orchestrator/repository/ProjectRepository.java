package com.runwarden.orchestrator.repository;

import com.runwarden.orchestrator.model.Project;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectRepository extends JpaRepository<Project, String> {
}
