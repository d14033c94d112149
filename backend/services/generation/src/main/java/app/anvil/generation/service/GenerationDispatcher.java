package app.anvil.generation.service;

import app.anvil.generation.domain.entity.GenerationJobEntity;
import app.anvil.generation.domain.entity.IdeaEntity;
import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.JobEventType;
import app.anvil.generation.domain.type.JobStatus;
import app.anvil.generation.events.JobEventPublisher;
import app.anvil.generation.storage.TenantScope;
import app.anvil.generation.storage.TenantScopedGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Starts document generation for an idea. The job, document and idea are prepared in one tenant
 * transaction; the generator is called only after it commits.
 */
@Service
public class GenerationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(GenerationDispatcher.class);

    static final String SUPERSEDED = "Superseded by retry";

    private final TenantScopedGateway gateway;
    private final GenerationTaskPublisher taskPublisher;
    private final JobEventPublisher eventPublisher;

    public GenerationDispatcher(TenantScopedGateway gateway,
                                GenerationTaskPublisher taskPublisher,
                                JobEventPublisher eventPublisher) {
        this.gateway = gateway;
        this.taskPublisher = taskPublisher;
        this.eventPublisher = eventPublisher;
    }

    public DispatchResult dispatch(UUID tenantId, UUID ideaId, DocumentKind kind, String instructions) {
        Prepared prepared;
        try {
            prepared = gateway.withTenantScope(tenantId, scope -> prepare(scope, ideaId, kind, instructions));
        } catch (DataIntegrityViolationException ex) {
            log.info("Concurrent dispatch detected ideaId={} kind={}", ideaId, kind);
            return gateway.withTenantScope(tenantId, scope -> scope.jobs().findActiveJob(ideaId, kind)
                    .map(job -> new DispatchResult(job, scope.documents().findLatest(ideaId, kind).orElse(null), true))
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.CONFLICT, "Generation already in progress")));
        }

        if (prepared.task() == null) {
            log.info("Returning active job ideaId={} kind={} jobId={}", ideaId, kind, prepared.job().getId());
            return new DispatchResult(prepared.job(), prepared.document(), true);
        }

        GenerationTask task = prepared.task();
        log.info("Dispatching generation jobId={} ideaId={} kind={}", task.jobId(), ideaId, kind);
        taskPublisher.submit(task);

        return gateway.withTenantScope(tenantId, scope -> new DispatchResult(
                scope.jobs().getJob(task.jobId()).orElse(prepared.job()),
                scope.documents().getDocument(task.documentId()).orElse(prepared.document()),
                false
        ));
    }

    /**
     * Fails any active job of the kind, then dispatches a fresh one.
     */
    public DispatchResult retry(UUID tenantId, UUID ideaId, DocumentKind kind, String instructions) {
        Optional<UUID> superseded = gateway.withTenantScope(tenantId, scope -> {
            requireIdea(scope, ideaId);
            return scope.jobs().findActiveJob(ideaId, kind)
                    .map(GenerationJobEntity::getId)
                    .filter(jobId -> scope.jobs().promoteIfActive(jobId, JobStatus.failed, SUPERSEDED));
        });
        superseded.ifPresent(jobId -> {
            log.info("Superseded active job for retry jobId={} ideaId={} kind={}", jobId, ideaId, kind);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("jobId", jobId.toString());
            data.put("status", JobStatus.failed.name());
            data.put("message", SUPERSEDED);
            eventPublisher.publish(jobId, JobEventType.error, data);
        });
        return dispatch(tenantId, ideaId, kind, instructions);
    }

    private Prepared prepare(TenantScope scope, UUID ideaId, DocumentKind kind, String instructions) {
        IdeaEntity idea = requireIdea(scope, ideaId);
        Optional<GenerationJobEntity> active = scope.jobs().findActiveJob(ideaId, kind);
        if (active.isPresent()) {
            return new Prepared(active.get(), scope.documents().findLatest(ideaId, kind).orElse(null), null);
        }

        GenerationJobEntity job = scope.jobs().createJob(ideaId, kind, JobStatus.pending);
        ProjectDocumentEntity document = scope.documents().startGeneration(ideaId, kind, job.getId());
        if (kind == DocumentKind.LeanCanvas) {
            scope.ideas().markGenerating(ideaId);
        }
        Map<DocumentKind, String> correlationIds = scope.documents().externalIds(ideaId);

        GenerationTask task = new GenerationTask(
                job.getId(),
                scope.tenantId(),
                ideaId,
                document.getId(),
                kind,
                instructions,
                idea.getTitle(),
                idea.getDescription(),
                correlationIds
        );
        return new Prepared(job, document, task);
    }

    private IdeaEntity requireIdea(TenantScope scope, UUID ideaId) {
        return scope.ideas().getIdea(ideaId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Idea not found"));
    }

    private record Prepared(GenerationJobEntity job, ProjectDocumentEntity document, GenerationTask task) {
    }
}
