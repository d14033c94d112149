package app.anvil.generation.client.recordstore;

public record GeneratedArtifact(
        String externalId,
        String html,
        String content
) {
}
