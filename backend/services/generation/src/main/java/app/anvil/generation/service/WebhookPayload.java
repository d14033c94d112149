package app.anvil.generation.service;

import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.storage.DocumentResult;

import java.util.UUID;

public record WebhookPayload(
        UUID ideaId,
        DocumentKind kind,
        DocumentResult result,
        UUID jobId,
        String error
) {
}
