package app.anvil.generation.service;

import app.anvil.generation.domain.entity.ProjectDocumentEntity;
import app.anvil.generation.domain.type.JobStatus;
import app.anvil.generation.storage.ResultApplication;

import java.util.UUID;

/**
 * @param promotedJobId job moved to {@code jobStatus} by this reconciliation, or null
 */
public record ReconcileOutcome(
        ProjectDocumentEntity document,
        ResultApplication application,
        UUID promotedJobId,
        JobStatus jobStatus
) {
    public boolean jobPromoted() {
        return promotedJobId != null;
    }
}
