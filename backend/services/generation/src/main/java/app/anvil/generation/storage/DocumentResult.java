package app.anvil.generation.storage;

import app.anvil.generation.domain.type.DocumentStatus;
import com.fasterxml.jackson.databind.JsonNode;

public record DocumentResult(
        DocumentStatus status,
        String html,
        String content,
        JsonNode sections,
        String externalId
) {
    public DocumentResult {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Document result must carry a terminal status");
        }
    }

    public static DocumentResult failed(String externalId) {
        return new DocumentResult(DocumentStatus.Failed, null, null, null, externalId);
    }

    public boolean completed() {
        return status == DocumentStatus.Completed;
    }
}
