package app.anvil.generation.support.correlation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Acknowledgement body returned by a generator, with its JSON form when it parses.
 */
public record GeneratorReply(String text, JsonNode json) {

    public static GeneratorReply parse(String body, ObjectMapper objectMapper) {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty()) {
            return new GeneratorReply(text, MissingNode.getInstance());
        }
        try {
            JsonNode json = objectMapper.readTree(text);
            return new GeneratorReply(text, json == null ? MissingNode.getInstance() : json);
        } catch (JsonProcessingException ex) {
            return new GeneratorReply(text, MissingNode.getInstance());
        }
    }
}
