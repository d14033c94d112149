package app.anvil.generation.storage;

/**
 * Handle to the stores of one gateway transaction. Instances are only created by
 * {@link TenantScopedGateway}; holding one means the session context is already applied.
 */
public interface StorageScope {

    JobStore jobs();

    DocumentStore documents();

    IdeaStore ideas();
}
