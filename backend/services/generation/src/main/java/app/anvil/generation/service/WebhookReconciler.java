package app.anvil.generation.service;

import app.anvil.generation.controller.dto.WebhookAck;
import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.storage.SystemScope;
import app.anvil.generation.storage.TenantScopedGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Applies generator callbacks. Callbacks carry no tenant, so they run in the system scope.
 */
@Service
public class WebhookReconciler {

    private static final Logger log = LoggerFactory.getLogger(WebhookReconciler.class);

    private final TenantScopedGateway gateway;
    private final GenerationResultApplier resultApplier;

    public WebhookReconciler(TenantScopedGateway gateway, GenerationResultApplier resultApplier) {
        this.gateway = gateway;
        this.resultApplier = resultApplier;
    }

    public WebhookAck reconcile(WebhookPayload payload) {
        ReconcileOutcome outcome = gateway.withSystemScope(scope -> locate(scope, payload)
                .map(document -> resultApplier.apply(scope, document, payload.result(), payload.error(), payload.jobId()))
                .orElse(null));

        if (outcome == null) {
            log.warn("Webhook matched no document ideaId={} kind={} externalId={}",
                    payload.ideaId(), payload.kind(), payload.result().externalId());
            return WebhookAck.unmatched();
        }
        resultApplier.publish(outcome);
        ProjectDocumentEntity document = outcome.document();
        UUID jobId = outcome.jobPromoted() ? outcome.promotedJobId() : document.getJobId();
        return new WebhookAck(true, document.getId(), document.getStatus(), jobId, outcome.jobPromoted());
    }

    private Optional<ProjectDocumentEntity> locate(SystemScope scope, WebhookPayload payload) {
        return scope.documents().findByExternalId(payload.ideaId(), payload.kind(), payload.result().externalId())
                .or(() -> scope.documents().findLatest(payload.ideaId(), payload.kind()));
    }
}
