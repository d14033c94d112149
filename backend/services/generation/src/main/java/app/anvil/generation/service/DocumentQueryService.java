package app.anvil.generation.service;

import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.storage.TenantScopedGateway;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

@Service
public class DocumentQueryService {

    private final TenantScopedGateway gateway;
    private final DocumentPollingReconciler pollingReconciler;

    public DocumentQueryService(TenantScopedGateway gateway, DocumentPollingReconciler pollingReconciler) {
        this.gateway = gateway;
        this.pollingReconciler = pollingReconciler;
    }

    public List<ProjectDocumentEntity> listDocuments(UUID tenantId, UUID ideaId) {
        return gateway.withTenantScope(tenantId, scope -> {
            if (scope.ideas().getIdea(ideaId).isEmpty()) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Idea not found");
            }
            return scope.documents().listForIdea(ideaId);
        });
    }

    /**
     * Latest document of the kind, reconciled against the system of record when it is overdue.
     */
    public ProjectDocumentEntity getDocument(UUID tenantId, UUID ideaId, DocumentKind kind) {
        ProjectDocumentEntity document = gateway.withTenantScope(tenantId, scope -> scope.documents().findLatest(ideaId, kind))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Document not found"));
        return pollingReconciler.reconcile(tenantId, document);
    }
}
