package com.runwarden.orchestrator.store;

import com.runwarden.orchestrator.gateway.dto.RunSnapshot;
import com.runwarden.orchestrator.model.AgentRun;
import com.runwarden.orchestrator.model.AgentRunStatus;
import com.runwarden.orchestrator.model.MergeResult;
import com.runwarden.orchestrator.model.ResponseType;
import com.runwarden.orchestrator.model.RunUpdate;
import com.runwarden.orchestrator.repository.AgentRunRepository;
import jakarta.persistence.criteria.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link RunStore} backed by the agent_runs table.
 *
 * Each write method is @Transactional and loads the row with
 * SELECT ... FOR UPDATE before merging, so concurrent writers to the same
 * run serialize on the row lock while readers are never blocked.
 */
@Component
public class JpaRunStore implements RunStore {

    private static final Logger log = LoggerFactory.getLogger(JpaRunStore.class);

    private final AgentRunRepository runRepo;

    public JpaRunStore(AgentRunRepository runRepo) {
        this.runRepo = runRepo;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public Optional<AgentRun> get(String organizationId, UUID runId) {
        return runRepo.findById(runId)
                .filter(r -> r.getOrganizationId().equals(organizationId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AgentRun> findByExternalId(String externalId) {
        return runRepo.findByExternalId(externalId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AgentRun> list(String organizationId) {
        return runRepo.findByOrganizationIdOrderByCreatedAtDesc(organizationId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AgentRun> listNonTerminal(String organizationId) {
        return runRepo.findByOrganizationIdAndStatusInOrderByCreatedAtAsc(
                organizationId, AgentRunStatus.nonTerminal());
    }

    @Override
    @Transactional(readOnly = true)
    public Page<AgentRun> search(String organizationId, RunFilter filter, Pageable pageable) {
        return runRepo.findAll(matching(organizationId, filter), pageable);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> watchedOrganizations() {
        return runRepo.findOrganizationsWithStatusIn(AgentRunStatus.nonTerminal());
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public AgentRun insert(AgentRun run) {
        return runRepo.save(run);
    }

    @Override
    @Transactional
    public RunChange apply(String organizationId, UUID runId, RunUpdate update) {
        AgentRun run = runRepo.lockById(runId)
                .filter(r -> r.getOrganizationId().equals(organizationId))
                .orElseThrow(() -> new RunNotFoundException(organizationId, runId));
        return mergeAndSave(run, update);
    }

    @Override
    @Transactional
    public RunChange upsert(String organizationId, RunSnapshot snapshot, Instant requestIssuedAt) {
        RunUpdate update = snapshot.toUpdate(requestIssuedAt);
        Optional<AgentRun> existing = runRepo.lockByExternalId(snapshot.externalId());
        if (existing.isPresent()) {
            AgentRun run = existing.get();
            if (!run.getOrganizationId().equals(organizationId)) {
                log.warn("Remote run {} reported for org {} but stored under org {}; ignoring",
                        snapshot.externalId(), organizationId, run.getOrganizationId());
                return new RunChange(run, run.getStatus(), MergeResult.REJECTED);
            }
            return mergeAndSave(run, update);
        }

        // A run created elsewhere (another instance, the remote UI): adopt it.
        Instant created = snapshot.createdAt() != null && snapshot.createdAt().isBefore(update.observedAt())
                ? snapshot.createdAt()
                : update.observedAt();
        AgentRun run = new AgentRun(organizationId,
                snapshot.prompt() != null ? snapshot.prompt() : "",
                ResponseType.PULL_REQUEST, created);
        MergeResult result = run.merge(update);
        runRepo.save(run);
        log.info("Imported remote run {} into org {} with status {}",
                snapshot.externalId(), organizationId, run.getStatus());
        return new RunChange(run, null, result);
    }

    @Override
    @Transactional
    public boolean delete(String organizationId, UUID runId) {
        Optional<AgentRun> run = get(organizationId, runId);
        run.ifPresent(runRepo::delete);
        return run.isPresent();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private RunChange mergeAndSave(AgentRun run, RunUpdate update) {
        AgentRunStatus before = run.getStatus();
        MergeResult result = run.merge(update);
        if (result == MergeResult.APPLIED || result == MergeResult.UNCHANGED) {
            // UNCHANGED may still have advanced lastUpdatedAt
            runRepo.save(run);
        } else {
            log.debug("Update for run {} {} (stored={} at {}, incoming={} at {})",
                    run.getId(), result, before, run.getLastUpdatedAt(),
                    update.status(), update.observedAt());
        }
        return new RunChange(run, before, result);
    }

    private static Specification<AgentRun> matching(String organizationId, RunFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("organizationId"), organizationId));
            if (filter.statuses() != null && !filter.statuses().isEmpty()) {
                predicates.add(root.get("status").in(filter.statuses()));
            }
            if (filter.query() != null && !filter.query().isBlank()) {
                String like = "%" + filter.query().trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("prompt")), like),
                        cb.like(cb.lower(root.get("currentStep")), like),
                        cb.like(cb.lower(root.get("externalId")), like)));
            }
            if (filter.createdAfter() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), filter.createdAfter()));
            }
            if (filter.createdBefore() != null) {
                predicates.add(cb.lessThan(root.get("createdAt"), filter.createdBefore()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
