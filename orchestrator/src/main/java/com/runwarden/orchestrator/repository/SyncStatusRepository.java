package com.runwarden.orchestrator.repository;

import com.runwarden.orchestrator.model.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncStatusRepository extends JpaRepository<SyncStatus, String> {
}
