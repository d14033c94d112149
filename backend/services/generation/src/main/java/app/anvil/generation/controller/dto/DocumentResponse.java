package app.anvil.generation.controller.dto;

import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.DocumentStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record DocumentResponse(
        UUID documentId,
        UUID ideaId,
        UUID jobId,
        DocumentKind documentType,
        String title,
        DocumentStatus status,
        String content,
        String html,
        JsonNode sections,
        String externalId,
        Instant generationStartedAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static DocumentResponse from(ProjectDocumentEntity document) {
        if (document == null) {
            return null;
        }
        return new DocumentResponse(
                document.getId(),
                document.getIdeaId(),
                document.getJobId(),
                document.getDocumentType(),
                document.getTitle(),
                document.getStatus(),
                document.getContent(),
                document.getHtml(),
                document.getContentSections(),
                document.getExternalId(),
                document.getGenerationStartedAt(),
                document.getCreatedAt(),
                document.getUpdatedAt()
        );
    }
}
