package app.anvil.generation.service;

import app.anvil.generation.domain.entity.GenerationJobEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.storage.TenantScopedGateway;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@Service
public class JobQueryService {

    private final TenantScopedGateway gateway;

    public JobQueryService(TenantScopedGateway gateway) {
        this.gateway = gateway;
    }

    public GenerationJobEntity getJob(UUID tenantId, UUID jobId) {
        return gateway.withTenantScope(tenantId, scope -> scope.jobs().getJob(jobId))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found"));
    }

    public GenerationJobEntity getLatestJob(UUID tenantId, UUID ideaId, DocumentKind kind) {
        return gateway.withTenantScope(tenantId, scope -> scope.jobs().getLatestJob(ideaId, kind))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found"));
    }
}
