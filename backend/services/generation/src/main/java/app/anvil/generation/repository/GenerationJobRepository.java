package app.anvil.generation.repository;

import app.anvil.generation.domain.entity.GenerationJobEntity;
import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GenerationJobRepository extends JpaRepository<GenerationJobEntity, UUID> {
    Optional<GenerationJobEntity> findFirstByIdeaIdOrderByCreatedAtDesc(UUID ideaId);

    Optional<GenerationJobEntity> findFirstByIdeaIdAndDocumentTypeOrderByCreatedAtDesc(UUID ideaId, DocumentKind documentType);

    Optional<GenerationJobEntity> findFirstByIdeaIdAndDocumentTypeAndStatusInOrderByCreatedAtDesc(UUID ideaId,
                                                                                                  DocumentKind documentType,
                                                                                                  Collection<JobStatus> statuses);
}
