package app.anvil.generation.support.correlation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Looks for the id under the field names generators are known to use.
 */
public class ExactFieldStrategy implements CorrelationIdStrategy {

    static final List<String> FIELDS = List.of(
            "id",
            "project_id",
            "leancanvas_id",
            "prd_id",
            "brd_id",
            "frd_id",
            "functional_id",
            "functionalId",
            "functional_requirements_id"
    );

    @Override
    public Optional<String> extract(GeneratorReply reply) {
        JsonNode json = reply.json();
        if (!json.isObject()) {
            return Optional.empty();
        }
        for (String field : FIELDS) {
            JsonNode value = json.get(field);
            if (value != null && (value.isTextual() || value.isNumber())) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            }
        }
        return Optional.empty();
    }
}
