package app.anvil.generation.controller.dto;

import app.anvil.generation.domain.type.DocumentStatus;

import java.util.UUID;

public record WebhookAck(
        boolean matched,
        UUID documentId,
        DocumentStatus documentStatus,
        UUID jobId,
        boolean jobPromoted
) {
    public static WebhookAck unmatched() {
        return new WebhookAck(false, null, null, null, false);
    }
}
