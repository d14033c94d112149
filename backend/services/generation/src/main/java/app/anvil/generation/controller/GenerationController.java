package app.anvil.generation.controller;

import app.anvil.generation.controller.dto.DispatchRequest;
import app.anvil.generation.controller.dto.DispatchResponse;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.security.CurrentTenantProvider;
import app.anvil.generation.service.GenerationDispatcher;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/ideas/{ideaId}/documents/{kind}")
public class GenerationController {

    private final GenerationDispatcher dispatcher;
    private final CurrentTenantProvider tenantProvider;

    public GenerationController(GenerationDispatcher dispatcher, CurrentTenantProvider tenantProvider) {
        this.dispatcher = dispatcher;
        this.tenantProvider = tenantProvider;
    }

    @PostMapping("/generate")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public DispatchResponse generate(@AuthenticationPrincipal Jwt jwt,
                                     @PathVariable UUID ideaId,
                                     @PathVariable DocumentKind kind,
                                     @Valid @RequestBody(required = false) DispatchRequest request) {
        return DispatchResponse.from(dispatcher.dispatch(requireTenantId(jwt), ideaId, kind, instructions(request)));
    }

    @PostMapping("/retry")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public DispatchResponse retry(@AuthenticationPrincipal Jwt jwt,
                                  @PathVariable UUID ideaId,
                                  @PathVariable DocumentKind kind,
                                  @Valid @RequestBody(required = false) DispatchRequest request) {
        return DispatchResponse.from(dispatcher.retry(requireTenantId(jwt), ideaId, kind, instructions(request)));
    }

    private UUID requireTenantId(Jwt jwt) {
        try {
            return tenantProvider.requireTenantId(jwt);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, ex.getMessage());
        }
    }

    private static String instructions(DispatchRequest request) {
        return request == null ? null : request.instructions();
    }
}
