package app.anvil.generation.storage;

import app.anvil.generation.domain.entity.GenerationJobEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.JobStatus;
import app.anvil.generation.repository.GenerationJobRepository;
import jakarta.persistence.EntityManager;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Generation job records. {@link #updateJob} is data-only; the transition helpers are the
 * conditional updates callers use to move jobs forward.
 */
public class JobStore extends ScopedStore {

    static final Set<JobStatus> ACTIVE = EnumSet.of(JobStatus.pending, JobStatus.processing);

    private final GenerationJobRepository repository;

    JobStore(GenerationJobRepository repository,
             JdbcTemplate jdbcTemplate,
             EntityManager entityManager,
             Clock clock,
             UUID tenantId) {
        super(jdbcTemplate, entityManager, clock, tenantId);
        this.repository = repository;
    }

    public GenerationJobEntity createJob(UUID subjectId, DocumentKind kind, JobStatus initialStatus) {
        UUID owner = requireTenant();
        Instant now = clock.instant();
        GenerationJobEntity job = new GenerationJobEntity(
                UUID.randomUUID(),
                owner,
                subjectId,
                kind,
                initialStatus,
                null,
                now,
                now
        );
        return repository.saveAndFlush(job);
    }

    public Optional<GenerationJobEntity> getJob(UUID id) {
        return visible(repository.findById(id), GenerationJobEntity::getUserId);
    }

    public Optional<GenerationJobEntity> getLatestJob(UUID subjectId, DocumentKind kind) {
        Optional<GenerationJobEntity> latest = kind == null
                ? repository.findFirstByIdeaIdOrderByCreatedAtDesc(subjectId)
                : repository.findFirstByIdeaIdAndDocumentTypeOrderByCreatedAtDesc(subjectId, kind);
        return visible(latest, GenerationJobEntity::getUserId);
    }

    public Optional<GenerationJobEntity> findActiveJob(UUID subjectId, DocumentKind kind) {
        return visible(
                repository.findFirstByIdeaIdAndDocumentTypeAndStatusInOrderByCreatedAtDesc(subjectId, kind, ACTIVE),
                GenerationJobEntity::getUserId
        );
    }

    public boolean updateJob(UUID id, JobUpdate update) {
        return update(
                """
                update app_anvil.generation_jobs
                set status = coalesce(?, status),
                    description = coalesce(?, description),
                    updated_at = ?
                where id = ?
                """,
                text(update.status() == null ? null : update.status().name()),
                text(update.description()),
                now(),
                id
        ) > 0;
    }

    public boolean markProcessing(UUID id, String description) {
        return transition(id, EnumSet.of(JobStatus.pending), JobStatus.processing, description);
    }

    /**
     * Moves an active job to a terminal status. Returns false when the job was already terminal.
     */
    public boolean promoteIfActive(UUID id, JobStatus terminal, String description) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return transition(id, ACTIVE, terminal, description);
    }

    public List<UUID> promoteStale(Instant cutoff, JobStatus terminal, String description) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return updateReturning(
                """
                update app_anvil.generation_jobs
                set status = ?,
                    description = ?,
                    updated_at = ?
                where status in ('pending', 'processing')
                  and created_at < ?
                """,
                "returning id",
                (rs, rowNum) -> rs.getObject("id", UUID.class),
                terminal.name(),
                text(description),
                now(),
                timestamp(cutoff)
        );
    }

    private boolean transition(UUID id, Set<JobStatus> from, JobStatus to, String description) {
        List<Object> args = new ArrayList<>();
        args.add(to.name());
        args.add(text(description));
        args.add(now());
        args.add(id);
        from.forEach(status -> args.add(status.name()));
        return update(
                """
                update app_anvil.generation_jobs
                set status = ?,
                    description = coalesce(?, description),
                    updated_at = ?
                where id = ?
                  and status in (%s)
                """.formatted(placeholders(from)),
                args.toArray()
        ) > 0;
    }
}
