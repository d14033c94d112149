package app.anvil.generation.client.generator;

import app.anvil.generation.domain.type.DocumentKind;

import java.util.Map;
import java.util.UUID;

public record GeneratorRequest(
        UUID jobId,
        UUID ideaId,
        UUID documentId,
        DocumentKind kind,
        String instructions,
        String title,
        String ideaText,
        Map<DocumentKind, String> correlationIds
) {
    public GeneratorRequest {
        correlationIds = correlationIds == null ? Map.of() : Map.copyOf(correlationIds);
    }
}
