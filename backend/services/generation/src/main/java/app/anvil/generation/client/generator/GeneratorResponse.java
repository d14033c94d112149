package app.anvil.generation.client.generator;

public record GeneratorResponse(
        int status,
        String body
) {
}
