package app.anvil.generation.controller;

import app.anvil.generation.controller.dto.DocumentResponse;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.security.CurrentTenantProvider;
import app.anvil.generation.service.DocumentQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/ideas/{ideaId}/documents")
public class DocumentController {

    private final DocumentQueryService documentQueryService;
    private final CurrentTenantProvider tenantProvider;

    public DocumentController(DocumentQueryService documentQueryService, CurrentTenantProvider tenantProvider) {
        this.documentQueryService = documentQueryService;
        this.tenantProvider = tenantProvider;
    }

    @GetMapping
    public List<DocumentResponse> list(@AuthenticationPrincipal Jwt jwt,
                                       @PathVariable UUID ideaId) {
        return documentQueryService.listDocuments(requireTenantId(jwt), ideaId).stream()
                .map(DocumentResponse::from)
                .toList();
    }

    @GetMapping("/{kind}")
    public DocumentResponse get(@AuthenticationPrincipal Jwt jwt,
                                @PathVariable UUID ideaId,
                                @PathVariable DocumentKind kind) {
        return DocumentResponse.from(documentQueryService.getDocument(requireTenantId(jwt), ideaId, kind));
    }

    private UUID requireTenantId(Jwt jwt) {
        try {
            return tenantProvider.requireTenantId(jwt);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, ex.getMessage());
        }
    }
}
