package app.anvil.generation.controller;

import app.anvil.generation.controller.dto.WebhookAck;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.security.WebhookAuthenticator;
import app.anvil.generation.service.WebhookPayloadReader;
import app.anvil.generation.service.WebhookReconciler;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/webhooks")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final WebhookAuthenticator authenticator;
    private final WebhookPayloadReader payloadReader;
    private final WebhookReconciler reconciler;

    public WebhookController(WebhookAuthenticator authenticator,
                             WebhookPayloadReader payloadReader,
                             WebhookReconciler reconciler) {
        this.authenticator = authenticator;
        this.payloadReader = payloadReader;
        this.reconciler = reconciler;
    }

    @PostMapping("/generation")
    public WebhookAck generation(HttpServletRequest request,
                                 @RequestBody JsonNode body) {
        requireAuthenticated(request);
        return reconciler.reconcile(payloadReader.read(body, null));
    }

    @PostMapping("/{slug}")
    public WebhookAck forKind(HttpServletRequest request,
                              @PathVariable String slug,
                              @RequestBody JsonNode body) {
        requireAuthenticated(request);
        DocumentKind kind = DocumentKind.parse(slug)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown webhook"));
        return reconciler.reconcile(payloadReader.read(body, kind));
    }

    private void requireAuthenticated(HttpServletRequest request) {
        if (!authenticator.authenticate(request)) {
            log.warn("Rejected webhook call path={} remote={}", request.getRequestURI(), request.getRemoteAddr());
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid webhook credentials");
        }
    }
}
