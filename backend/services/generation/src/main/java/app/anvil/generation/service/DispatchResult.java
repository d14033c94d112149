package app.anvil.generation.service;

import app.anvil.generation.domain.entity.GenerationJobEntity;
import app.anvil.generation.domain.entity.ProjectDocumentEntity;

/**
 * @param duplicate true when an active job already existed and no new generation was started
 */
public record DispatchResult(
        GenerationJobEntity job,
        ProjectDocumentEntity document,
        boolean duplicate
) {
}
