package app.anvil.generation.storage;

import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.DocumentStatus;
import app.anvil.generation.repository.ProjectDocumentRepository;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.EntityManager;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class DocumentStore extends ScopedStore {

    private final ProjectDocumentRepository repository;

    DocumentStore(ProjectDocumentRepository repository,
                  JdbcTemplate jdbcTemplate,
                  EntityManager entityManager,
                  Clock clock,
                  UUID tenantId) {
        super(jdbcTemplate, entityManager, clock, tenantId);
        this.repository = repository;
    }

    public Optional<ProjectDocumentEntity> getDocument(UUID id) {
        return visible(repository.findById(id), ProjectDocumentEntity::getUserId);
    }

    public List<ProjectDocumentEntity> listForIdea(UUID ideaId) {
        return repository.findByIdeaIdOrderByCreatedAtAsc(ideaId).stream()
                .filter(doc -> tenantId == null || tenantId.equals(doc.getUserId()))
                .toList();
    }

    public Optional<ProjectDocumentEntity> findLatest(UUID ideaId, DocumentKind kind) {
        return visible(repository.findFirstByIdeaIdAndDocumentTypeOrderByCreatedAtDesc(ideaId, kind),
                ProjectDocumentEntity::getUserId);
    }

    public Optional<ProjectDocumentEntity> findByExternalId(UUID ideaId, DocumentKind kind, String externalId) {
        if (externalId == null || externalId.isBlank()) {
            return Optional.empty();
        }
        return visible(repository.findFirstByIdeaIdAndDocumentTypeAndExternalIdOrderByCreatedAtDesc(ideaId, kind, externalId),
                ProjectDocumentEntity::getUserId);
    }

    /**
     * Points the latest document of the kind at a new job and flags it as generating, creating the
     * document on first use. Existing content and external id are kept.
     */
    public ProjectDocumentEntity startGeneration(UUID ideaId, DocumentKind kind, UUID jobId) {
        UUID owner = requireTenant();
        Instant now = clock.instant();
        ProjectDocumentEntity document = findLatest(ideaId, kind).orElseGet(() -> {
            ProjectDocumentEntity created = new ProjectDocumentEntity();
            created.setId(UUID.randomUUID());
            created.setUserId(owner);
            created.setIdeaId(ideaId);
            created.setDocumentType(kind);
            created.setTitle(kind.title());
            created.setCreatedAt(now);
            return created;
        });
        document.setJobId(jobId);
        document.setStatus(DocumentStatus.Generating);
        document.setGenerationStartedAt(now);
        document.setUpdatedAt(now);
        return repository.saveAndFlush(document);
    }

    /**
     * Writes a generator result. A document still in flight takes the result status and content;
     * a completed document receiving another completed result only has its content refreshed;
     * anything else is left alone.
     */
    public ResultApplication applyResult(UUID documentId, DocumentResult result) {
        if (result.completed()) {
            int updated = update(
                    """
                    update app_anvil.project_documents
                    set status = 'Completed',
                        html = ?,
                        content = coalesce(?, content),
                        content_sections = coalesce(cast(? as jsonb), content_sections),
                        external_id = coalesce(external_id, ?),
                        updated_at = ?
                    where id = ?
                      and status in ('Draft', 'Generating')
                    """,
                    text(result.html() == null ? "" : result.html()),
                    text(result.content()),
                    text(json(result.sections())),
                    text(blankToNull(result.externalId())),
                    now(),
                    documentId
            );
            if (updated > 0) {
                return ResultApplication.APPLIED;
            }
            int refreshed = update(
                    """
                    update app_anvil.project_documents
                    set html = coalesce(?, html),
                        content = coalesce(?, content),
                        content_sections = coalesce(cast(? as jsonb), content_sections),
                        external_id = coalesce(external_id, ?),
                        updated_at = ?
                    where id = ?
                      and status = 'Completed'
                    """,
                    text(result.html()),
                    text(result.content()),
                    text(json(result.sections())),
                    text(blankToNull(result.externalId())),
                    now(),
                    documentId
            );
            return refreshed > 0 ? ResultApplication.CONTENT_REFRESHED : ResultApplication.IGNORED;
        }
        int failed = update(
                """
                update app_anvil.project_documents
                set status = 'Failed',
                    external_id = coalesce(external_id, ?),
                    updated_at = ?
                where id = ?
                  and status in ('Draft', 'Generating')
                """,
                text(blankToNull(result.externalId())),
                now(),
                documentId
        );
        return failed > 0 ? ResultApplication.APPLIED : ResultApplication.IGNORED;
    }

    /**
     * Stores the external id unless one is already known.
     */
    public boolean recordExternalId(UUID documentId, String externalId) {
        String value = blankToNull(externalId);
        if (value == null) {
            return false;
        }
        return update(
                """
                update app_anvil.project_documents
                set external_id = ?,
                    updated_at = ?
                where id = ?
                  and external_id is null
                """,
                value,
                now(),
                documentId
        ) > 0;
    }

    public Map<DocumentKind, String> externalIds(UUID ideaId) {
        Map<DocumentKind, String> ids = new EnumMap<>(DocumentKind.class);
        // list is oldest first, so the latest document of each kind wins
        for (ProjectDocumentEntity document : listForIdea(ideaId)) {
            if (document.getExternalId() != null) {
                ids.put(document.getDocumentType(), document.getExternalId());
            }
        }
        return ids;
    }

    public List<StaleDocument> promoteStale(Instant cutoff, DocumentStatus terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return updateReturning(
                """
                update app_anvil.project_documents
                set status = ?,
                    updated_at = ?
                where status = 'Generating'
                  and coalesce(generation_started_at, updated_at) < ?
                """,
                "returning id, job_id, idea_id, user_id, document_type",
                (rs, rowNum) -> new StaleDocument(
                        rs.getObject("id", UUID.class),
                        rs.getObject("job_id", UUID.class),
                        rs.getObject("idea_id", UUID.class),
                        rs.getObject("user_id", UUID.class),
                        DocumentKind.valueOf(rs.getString("document_type"))
                ),
                terminal.name(),
                now(),
                timestamp(cutoff)
        );
    }

    private static String json(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node.toString();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
