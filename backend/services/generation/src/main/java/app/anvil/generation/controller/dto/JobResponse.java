package app.anvil.generation.controller.dto;

import app.anvil.generation.domain.entity.GenerationJobEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.JobStatus;

import java.time.Instant;
import java.util.UUID;

public record JobResponse(
        UUID jobId,
        UUID ideaId,
        DocumentKind documentType,
        JobStatus status,
        String description,
        Instant createdAt,
        Instant updatedAt
) {
    public static JobResponse from(GenerationJobEntity job) {
        return new JobResponse(
                job.getId(),
                job.getIdeaId(),
                job.getDocumentType(),
                job.getStatus(),
                job.getDescription(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
