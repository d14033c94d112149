package app.anvil.generation.support.correlation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class FuzzyIdFieldStrategy implements CorrelationIdStrategy {

    static final int MAX_LENGTH = 100;

    @Override
    public Optional<String> extract(GeneratorReply reply) {
        JsonNode json = reply.json();
        if (!json.isObject()) {
            return Optional.empty();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getKey().toLowerCase(Locale.ROOT).contains("id") || !field.getValue().isTextual()) {
                continue;
            }
            String value = field.getValue().asText().trim();
            if (!value.isEmpty() && value.length() < MAX_LENGTH) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
