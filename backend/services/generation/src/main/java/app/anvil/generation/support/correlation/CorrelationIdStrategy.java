package app.anvil.generation.support.correlation;

import java.util.Optional;

public interface CorrelationIdStrategy {

    Optional<String> extract(GeneratorReply reply);
}
