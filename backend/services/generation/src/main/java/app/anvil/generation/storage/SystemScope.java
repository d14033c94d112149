package app.anvil.generation.storage;

/**
 * Privileged scope for trusted internal callers (webhook ingestion, timeout sweep). Row policies
 * do not apply, so reads are not filtered by tenant.
 */
public interface SystemScope extends StorageScope {
}
