package app.anvil.generation.storage;

import app.anvil.generation.domain.entity.IdeaEntity;
import app.anvil.generation.domain.type.IdeaStatus;
import app.anvil.generation.repository.IdeaRepository;
import jakarta.persistence.EntityManager;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public class IdeaStore extends ScopedStore {

    private final IdeaRepository repository;

    IdeaStore(IdeaRepository repository,
              JdbcTemplate jdbcTemplate,
              EntityManager entityManager,
              Clock clock,
              UUID tenantId) {
        super(jdbcTemplate, entityManager, clock, tenantId);
        this.repository = repository;
    }

    public Optional<IdeaEntity> getIdea(UUID id) {
        return visible(repository.findById(id), IdeaEntity::getUserId);
    }

    public boolean markGenerating(UUID id) {
        return update(
                """
                update app_anvil.ideas
                set status = 'Generating',
                    generation_started_at = ?,
                    updated_at = ?
                where id = ?
                """,
                now(),
                now(),
                id
        ) > 0;
    }

    /**
     * Conditional status change; false when the idea was no longer in {@code from}.
     */
    public boolean transition(UUID id, IdeaStatus from, IdeaStatus to) {
        return update(
                """
                update app_anvil.ideas
                set status = ?,
                    updated_at = ?
                where id = ?
                  and status = ?
                """,
                to.name(),
                now(),
                id,
                from.name()
        ) > 0;
    }

    public int promoteStale(Instant cutoff, IdeaStatus target) {
        return update(
                """
                update app_anvil.ideas
                set status = ?,
                    updated_at = ?
                where status = 'Generating'
                  and coalesce(generation_started_at, updated_at) < ?
                """,
                target.name(),
                now(),
                timestamp(cutoff)
        );
    }
}
