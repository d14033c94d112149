package app.anvil.generation.client.recordstore;

import app.anvil.generation.domain.type.DocumentKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Optional;

/**
 * Reads generated artifacts from the PostgREST-style system of record by their external id.
 */
@Component
public class RecordStoreClient {

    private final RestClient restClient;
    private final RecordStoreProps props;

    public RecordStoreClient(RestClient.Builder restClientBuilder, RecordStoreProps props) {
        this.restClient = props.configured()
                ? restClientBuilder.baseUrl(props.baseUrl()).build()
                : restClientBuilder.build();
        this.props = props;
    }

    public boolean supports(DocumentKind kind) {
        return props.configured() && props.tables().containsKey(kind);
    }

    /**
     * Returns the artifact if the system of record already holds non-blank markup for it.
     */
    public Optional<GeneratedArtifact> fetch(DocumentKind kind, String externalId) {
        if (!supports(kind) || externalId == null || externalId.isBlank()) {
            return Optional.empty();
        }
        RecordStoreProps.Table table = props.tables().get(kind);
        JsonNode rows = restClient.get()
                .uri(uri -> uri.path("/rest/v1/{table}")
                        .queryParam("id", "{filter}")
                        .queryParam("select", "*")
                        .build(table.name(), "eq." + externalId))
                .header("apikey", props.apiKey())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + props.apiKey())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);
        if (rows == null || !rows.isArray() || rows.isEmpty()) {
            return Optional.empty();
        }
        JsonNode row = rows.get(0);
        String html = row.path(table.htmlColumn()).asText("");
        if (html.isBlank()) {
            return Optional.empty();
        }
        String content = table.contentColumn() == null ? null : row.path(table.contentColumn()).asText(null);
        return Optional.of(new GeneratedArtifact(externalId, html, content));
    }
}
