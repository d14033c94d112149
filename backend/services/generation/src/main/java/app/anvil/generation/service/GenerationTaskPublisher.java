package app.anvil.generation.service;

/**
 * Hands a committed task to the configured generator transport.
 */
public interface GenerationTaskPublisher {

    void submit(GenerationTask task);
}
