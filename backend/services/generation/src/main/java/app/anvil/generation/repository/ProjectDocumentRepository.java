package app.anvil.generation.repository;

import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.DocumentKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProjectDocumentRepository extends JpaRepository<ProjectDocumentEntity, UUID> {
    List<ProjectDocumentEntity> findByIdeaIdOrderByCreatedAtAsc(UUID ideaId);

    Optional<ProjectDocumentEntity> findFirstByIdeaIdAndDocumentTypeOrderByCreatedAtDesc(UUID ideaId, DocumentKind documentType);

    Optional<ProjectDocumentEntity> findFirstByIdeaIdAndDocumentTypeAndExternalIdOrderByCreatedAtDesc(UUID ideaId,
                                                                                                      DocumentKind documentType,
                                                                                                      String externalId);
}
