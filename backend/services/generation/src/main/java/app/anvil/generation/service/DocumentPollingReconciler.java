package app.anvil.generation.service;

import app.anvil.generation.client.recordstore.GeneratedArtifact;
import app.anvil.generation.client.recordstore.RecordStoreClient;
import app.anvil.generation.config.GenerationProps;
import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.DocumentStatus;
import app.anvil.generation.storage.DocumentResult;
import app.anvil.generation.storage.TenantScopedGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-side reconciliation: a generating document that has been out long enough is looked up in
 * the system of record, and completed from there if the generator already wrote it.
 */
@Component
public class DocumentPollingReconciler {

    private static final Logger log = LoggerFactory.getLogger(DocumentPollingReconciler.class);

    private final RecordStoreClient recordStoreClient;
    private final TenantScopedGateway gateway;
    private final GenerationResultApplier resultApplier;
    private final GenerationProps props;
    private final Clock clock;

    public DocumentPollingReconciler(RecordStoreClient recordStoreClient,
                                     TenantScopedGateway gateway,
                                     GenerationResultApplier resultApplier,
                                     GenerationProps props,
                                     Clock clock) {
        this.recordStoreClient = recordStoreClient;
        this.gateway = gateway;
        this.resultApplier = resultApplier;
        this.props = props;
        this.clock = clock;
    }

    public ProjectDocumentEntity reconcile(UUID tenantId, ProjectDocumentEntity document) {
        if (document.getExternalId() == null) {
            return document;
        }
        if (missingMarkup(document)) {
            return fetchAndApply(tenantId, document, null);
        }
        if (document.getStatus() != DocumentStatus.Generating || document.getGenerationStartedAt() == null) {
            return document;
        }
        Duration elapsed = Duration.between(document.getGenerationStartedAt(), clock.instant());
        if (elapsed.compareTo(props.pollDwell()) < 0) {
            return document;
        }
        return fetchAndApply(tenantId, document, elapsed);
    }

    /**
     * A document completed by the timeout sweep may have no markup yet; the generator can still
     * write it to the system of record afterwards.
     */
    private static boolean missingMarkup(ProjectDocumentEntity document) {
        return document.getStatus() == DocumentStatus.Completed
                && (document.getHtml() == null || document.getHtml().isBlank());
    }

    private ProjectDocumentEntity fetchAndApply(UUID tenantId, ProjectDocumentEntity document, Duration elapsed) {
        Optional<GeneratedArtifact> artifact;
        try {
            artifact = recordStoreClient.fetch(document.getDocumentType(), document.getExternalId());
        } catch (RestClientException ex) {
            log.warn("System of record lookup failed documentId={} externalId={} error={}",
                    document.getId(), document.getExternalId(), GenerationInvoker.safeMessage(ex.getMessage()));
            return document;
        }
        if (artifact.isEmpty()) {
            if (elapsed != null && elapsed.compareTo(props.timeout()) > 0) {
                log.info("Generated artifact still missing after timeout documentId={} externalId={} elapsedSeconds={}",
                        document.getId(), document.getExternalId(), elapsed.toSeconds());
            }
            return document;
        }

        GeneratedArtifact found = artifact.get();
        DocumentResult result = new DocumentResult(DocumentStatus.Completed, found.html(), found.content(), null, found.externalId());
        ReconcileOutcome outcome = gateway.withTenantScope(tenantId, scope -> resultApplier.apply(scope, document, result, null));
        resultApplier.publish(outcome);
        return outcome.document();
    }
}
