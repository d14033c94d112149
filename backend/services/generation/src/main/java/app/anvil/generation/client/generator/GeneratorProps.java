package app.anvil.generation.client.generator;

import app.anvil.generation.domain.type.DocumentKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

@ConfigurationProperties(prefix = "app.generator")
public record GeneratorProps(
        String transport,
        Duration requestTimeout,
        String callbackUrl,
        String topic,
        Map<DocumentKind, Endpoint> endpoints
) {
    public GeneratorProps {
        if (transport == null || transport.isBlank()) {
            transport = "http";
        }
        if (requestTimeout == null) {
            requestTimeout = Duration.ofSeconds(30);
        }
        if (topic == null || topic.isBlank()) {
            topic = "generation-tasks";
        }
        endpoints = endpoints == null ? Map.of() : Map.copyOf(endpoints);
    }

    public Endpoint endpoint(DocumentKind kind) {
        Endpoint endpoint = endpoints.get(kind);
        if (endpoint == null || endpoint.url() == null || endpoint.url().isBlank()) {
            return null;
        }
        return endpoint;
    }

    /**
     * @param authType  {@code basic}, {@code bearer} or {@code none}
     * @param tokenUrl  login endpoint for bearer auth, posted as a form with username and password
     * @param tokenTtl  how long a fetched token is trusted
     */
    public record Endpoint(
            String url,
            String authType,
            String username,
            String password,
            String tokenUrl,
            Duration tokenTtl
    ) {
        public Endpoint {
            if (authType == null || authType.isBlank()) {
                authType = "none";
            }
            if (tokenTtl == null) {
                tokenTtl = Duration.ofDays(1);
            }
        }
    }
}
