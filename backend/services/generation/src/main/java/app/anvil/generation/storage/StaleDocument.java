package app.anvil.generation.storage;

import app.anvil.generation.domain.type.DocumentKind;

import java.util.UUID;

public record StaleDocument(
        UUID documentId,
        UUID jobId,
        UUID ideaId,
        UUID userId,
        DocumentKind kind
) {
}
