package app.anvil.generation.support.correlation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Pulls the generator's own id for the artifact out of its acknowledgement. Strategies are tried
 * in order; the first hit wins.
 */
@Component
public class CorrelationIdExtractor {

    private final ObjectMapper objectMapper;
    private final List<CorrelationIdStrategy> strategies;

    @Autowired
    public CorrelationIdExtractor(ObjectMapper objectMapper) {
        this(objectMapper, List.of(new ExactFieldStrategy(), new FuzzyIdFieldStrategy(), new ShortTextStrategy()));
    }

    CorrelationIdExtractor(ObjectMapper objectMapper, List<CorrelationIdStrategy> strategies) {
        this.objectMapper = objectMapper;
        this.strategies = List.copyOf(strategies);
    }

    public Optional<String> extract(String body) {
        GeneratorReply reply = GeneratorReply.parse(body, objectMapper);
        for (CorrelationIdStrategy strategy : strategies) {
            Optional<String> id = strategy.extract(reply);
            if (id.isPresent()) {
                return id;
            }
        }
        return Optional.empty();
    }
}
