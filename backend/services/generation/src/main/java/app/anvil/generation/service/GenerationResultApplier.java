package app.anvil.generation.service;

import app.anvil.generation.domain.entity.GenerationJobEntity;
import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.IdeaStatus;
import app.anvil.generation.domain.type.JobEventType;
import app.anvil.generation.domain.type.JobStatus;
import app.anvil.generation.events.JobEventPublisher;
import app.anvil.generation.storage.DocumentResult;
import app.anvil.generation.storage.ResultApplication;
import app.anvil.generation.storage.StorageScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Terminal update shared by the webhook and polling paths. Runs inside the caller's scope;
 * events are published by the caller once that scope has committed.
 */
@Component
public class GenerationResultApplier {

    private static final Logger log = LoggerFactory.getLogger(GenerationResultApplier.class);

    private final JobEventPublisher eventPublisher;

    public GenerationResultApplier(JobEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    public ReconcileOutcome apply(StorageScope scope, ProjectDocumentEntity document, DocumentResult result, String error) {
        return apply(scope, document, result, error, null);
    }

    /**
     * @param hintedJobId job named by the caller; used only when the document carries no job and
     *                    the job belongs to the same idea and kind
     */
    public ReconcileOutcome apply(StorageScope scope,
                                  ProjectDocumentEntity document,
                                  DocumentResult result,
                                  String error,
                                  UUID hintedJobId) {
        ResultApplication application = scope.documents().applyResult(document.getId(), result);
        scope.documents().recordExternalId(document.getId(), result.externalId());

        JobStatus jobStatus = result.completed() ? JobStatus.completed : JobStatus.failed;
        UUID jobId = document.getJobId();
        if (jobId == null && hintedJobId != null) {
            jobId = scope.jobs().getJob(hintedJobId)
                    .filter(job -> document.getIdeaId().equals(job.getIdeaId()) && job.getDocumentType() == document.getDocumentType())
                    .map(GenerationJobEntity::getId)
                    .orElse(null);
        }
        if (jobId == null) {
            jobId = scope.jobs().findActiveJob(document.getIdeaId(), document.getDocumentType())
                    .map(GenerationJobEntity::getId)
                    .orElse(null);
        }
        boolean promoted = jobId != null && scope.jobs().promoteIfActive(jobId, jobStatus, jobDescription(result, error));

        if (document.getDocumentType() == DocumentKind.LeanCanvas && application == ResultApplication.APPLIED) {
            IdeaStatus ideaStatus = result.completed() ? IdeaStatus.Completed : IdeaStatus.Draft;
            scope.ideas().transition(document.getIdeaId(), IdeaStatus.Generating, ideaStatus);
        }

        ProjectDocumentEntity refreshed = scope.documents().getDocument(document.getId()).orElse(document);
        log.info("Applied generation result documentId={} kind={} application={} jobId={} promoted={}",
                document.getId(), document.getDocumentType(), application, jobId, promoted);
        return new ReconcileOutcome(refreshed, application, promoted ? jobId : null, jobStatus);
    }

    /**
     * Publishes {@code done} or {@code error} for a job this reconciliation moved to terminal.
     */
    public void publish(ReconcileOutcome outcome) {
        if (!outcome.jobPromoted()) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", outcome.promotedJobId().toString());
        data.put("status", outcome.jobStatus().name());
        data.put("documentId", outcome.document().getId().toString());
        data.put("documentType", outcome.document().getDocumentType().name());
        JobEventType type = outcome.jobStatus() == JobStatus.completed ? JobEventType.done : JobEventType.error;
        eventPublisher.publish(outcome.promotedJobId(), type, data);
    }

    private static String jobDescription(DocumentResult result, String error) {
        if (result.completed()) {
            return "Generation completed";
        }
        return error == null || error.isBlank() ? "Generation failed" : "Error: " + GenerationInvoker.safeMessage(error);
    }
}
