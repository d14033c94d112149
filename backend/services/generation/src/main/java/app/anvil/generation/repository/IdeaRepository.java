package app.anvil.generation.repository;

import app.anvil.generation.domain.entity.IdeaEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface IdeaRepository extends JpaRepository<IdeaEntity, UUID> {
}
