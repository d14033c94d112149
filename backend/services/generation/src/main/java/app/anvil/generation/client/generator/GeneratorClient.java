package app.anvil.generation.client.generator;

import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.security.WebhookProps;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class GeneratorClient {

    private static final Logger log = LoggerFactory.getLogger(GeneratorClient.class);

    private final RestClient restClient;
    private final GeneratorProps props;
    private final WebhookProps webhookProps;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<DocumentKind, AccessTokenCache> tokens = new ConcurrentHashMap<>();

    @Autowired
    public GeneratorClient(RestClient.Builder restClientBuilder,
                           GeneratorProps props,
                           WebhookProps webhookProps,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this(restClientBuilder.requestFactory(requestFactory(props)).build(), props, webhookProps, objectMapper, clock);
    }

    GeneratorClient(RestClient restClient,
                    GeneratorProps props,
                    WebhookProps webhookProps,
                    ObjectMapper objectMapper,
                    Clock clock) {
        this.restClient = restClient;
        this.props = props;
        this.webhookProps = webhookProps;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public GeneratorResponse invoke(GeneratorRequest request) throws GeneratorInvocationException {
        GeneratorProps.Endpoint endpoint = props.endpoint(request.kind());
        if (endpoint == null) {
            throw new GeneratorInvocationException("No generator endpoint configured for " + request.kind());
        }
        ObjectNode payload = payload(request);
        GeneratorResponse response = send(request.kind(), endpoint, payload);
        if (response.status() == HttpStatus.UNAUTHORIZED.value() && "bearer".equalsIgnoreCase(endpoint.authType())) {
            log.info("Generator rejected cached token, logging in again kind={}", request.kind());
            tokenCache(request.kind(), endpoint).invalidate();
            response = send(request.kind(), endpoint, payload);
        }
        if (response.status() < 200 || response.status() >= 300) {
            throw new GeneratorInvocationException(
                    "Generator responded " + response.status() + ": " + safeMessage(response.body()));
        }
        return response;
    }

    ObjectNode payload(GeneratorRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("ideaId", request.ideaId().toString());
        payload.put("idea_id", request.ideaId().toString());
        payload.put("documentId", request.documentId() == null ? null : request.documentId().toString());
        payload.put("job_id", request.jobId().toString());
        payload.put("documentType", request.kind().name());
        payload.put("instructions", request.instructions());
        payload.put("title", request.title());
        payload.put("idea", request.ideaText());
        for (DocumentKind kind : DocumentKind.values()) {
            if (kind.correlationKey() != null) {
                payload.put(kind.correlationKey(), request.correlationIds().get(kind));
            }
        }
        payload.put("project_id", request.correlationIds().get(DocumentKind.LeanCanvas));
        payload.put("callback_url", blankToNull(props.callbackUrl()));
        payload.put("webhook_secret", webhookProps.hasSecret() ? webhookProps.secret() : null);
        return payload;
    }

    private GeneratorResponse send(DocumentKind kind, GeneratorProps.Endpoint endpoint, JsonNode payload)
            throws GeneratorInvocationException {
        try {
            RestClient.RequestBodySpec spec = restClient.post()
                    .uri(endpoint.url())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON, MediaType.TEXT_PLAIN);
            authorize(kind, endpoint, spec);
            return spec.body(payload)
                    .exchange((req, res) -> new GeneratorResponse(
                            res.getStatusCode().value(),
                            StreamUtils.copyToString(res.getBody(), StandardCharsets.UTF_8)
                    ));
        } catch (RestClientException | IllegalStateException ex) {
            throw new GeneratorInvocationException(safeMessage(ex.getMessage()), ex);
        }
    }

    private void authorize(DocumentKind kind, GeneratorProps.Endpoint endpoint, RestClient.RequestBodySpec spec) {
        switch (endpoint.authType().toLowerCase()) {
            case "basic" -> spec.headers(headers -> headers.setBasicAuth(endpoint.username(), endpoint.password()));
            case "bearer" -> spec.header(HttpHeaders.AUTHORIZATION,
                    "Bearer " + tokenCache(kind, endpoint).getOrRefresh(clock.instant()));
            case "none" -> {
            }
            default -> throw new IllegalStateException("Unsupported generator auth type: " + endpoint.authType());
        }
    }

    private AccessTokenCache tokenCache(DocumentKind kind, GeneratorProps.Endpoint endpoint) {
        return tokens.computeIfAbsent(kind, k -> new AccessTokenCache(() -> login(endpoint), endpoint.tokenTtl()));
    }

    private String login(GeneratorProps.Endpoint endpoint) {
        if (endpoint.tokenUrl() == null || endpoint.tokenUrl().isBlank()) {
            throw new IllegalStateException("Bearer auth requires a token-url");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", endpoint.username());
        form.add("password", endpoint.password());
        JsonNode response = restClient.post()
                .uri(endpoint.tokenUrl())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);
        if (response == null) {
            throw new IllegalStateException("Login response is empty");
        }
        return response.path("access_token").asText(null);
    }

    private static SimpleClientHttpRequestFactory requestFactory(GeneratorProps props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(props.requestTimeout());
        factory.setReadTimeout(props.requestTimeout());
        return factory;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    static String safeMessage(String message) {
        if (message == null) {
            return "";
        }
        String trimmed = message.replaceAll("\\s+", " ").trim();
        return trimmed.length() > 200 ? trimmed.substring(0, 200) : trimmed;
    }
}
