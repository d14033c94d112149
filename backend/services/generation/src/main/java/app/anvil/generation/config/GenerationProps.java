package app.anvil.generation.config;

import app.anvil.generation.domain.type.TimeoutPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.generation")
public record GenerationProps(
        Duration pollDwell,
        Duration timeout,
        TimeoutPolicy timeoutPolicy
) {
    public GenerationProps {
        if (pollDwell == null) {
            pollDwell = Duration.ofSeconds(10);
        }
        if (timeout == null) {
            timeout = Duration.ofMinutes(2);
        }
        if (timeoutPolicy == null) {
            timeoutPolicy = TimeoutPolicy.complete;
        }
    }
}
