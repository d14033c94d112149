package app.anvil.generation.service;

import app.anvil.generation.client.generator.GeneratorRequest;
import app.anvil.generation.domain.type.DocumentKind;

import java.util.Map;
import java.util.UUID;

/**
 * Everything needed to call a generator once the dispatch transaction has committed. Also the
 * message body on the queue transport.
 */
public record GenerationTask(
        UUID jobId,
        UUID tenantId,
        UUID ideaId,
        UUID documentId,
        DocumentKind kind,
        String instructions,
        String title,
        String ideaText,
        Map<DocumentKind, String> correlationIds
) {
    public GenerationTask {
        correlationIds = correlationIds == null ? Map.of() : Map.copyOf(correlationIds);
    }

    public GeneratorRequest toRequest() {
        return new GeneratorRequest(jobId, ideaId, documentId, kind, instructions, title, ideaText, correlationIds);
    }
}
