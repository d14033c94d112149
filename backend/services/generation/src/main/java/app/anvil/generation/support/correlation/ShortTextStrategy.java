package app.anvil.generation.support.correlation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Treats a short non-structured reply as the id itself.
 */
public class ShortTextStrategy implements CorrelationIdStrategy {

    static final int MAX_LENGTH = 100;

    @Override
    public Optional<String> extract(GeneratorReply reply) {
        JsonNode json = reply.json();
        if (json.isContainerNode()) {
            return Optional.empty();
        }
        String value = json.isTextual() ? json.asText().trim() : reply.text();
        if (value == null || value.isEmpty() || value.length() >= MAX_LENGTH) {
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
