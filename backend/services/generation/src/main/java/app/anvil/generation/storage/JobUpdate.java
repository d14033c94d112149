package app.anvil.generation.storage;

import app.anvil.generation.domain.type.JobStatus;

/**
 * Partial job update; null fields are left untouched.
 */
public record JobUpdate(
        JobStatus status,
        String description
) {
    public static JobUpdate description(String description) {
        return new JobUpdate(null, description);
    }
}
