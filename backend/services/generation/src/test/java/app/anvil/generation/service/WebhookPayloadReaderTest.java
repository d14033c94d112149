package app.anvil.generation.service;

import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.DocumentStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookPayloadReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WebhookPayloadReader reader = new WebhookPayloadReader(objectMapper);
    private final UUID ideaId = UUID.randomUUID();

    @Test
    void read_mapsCompletedPayload() throws Exception {
        WebhookPayload payload = reader.read(json("""
                {"subject":"%s","kind":"LeanCanvas","status":"Completed","html":"<p>x</p>","externalId":"lc-1"}
                """.formatted(ideaId)), null);

        assertThat(payload.ideaId()).isEqualTo(ideaId);
        assertThat(payload.kind()).isEqualTo(DocumentKind.LeanCanvas);
        assertThat(payload.result().status()).isEqualTo(DocumentStatus.Completed);
        assertThat(payload.result().html()).isEqualTo("<p>x</p>");
        assertThat(payload.result().externalId()).isEqualTo("lc-1");
    }

    @Test
    void read_treatsMissingStatusAsCompleted() throws Exception {
        WebhookPayload payload = reader.read(json("""
                {"idea_id":"%s","prd_id":"prd-3","content":"body"}
                """.formatted(ideaId)), DocumentKind.ProjectRequirements);

        assertThat(payload.result().status()).isEqualTo(DocumentStatus.Completed);
        assertThat(payload.result().externalId()).isEqualTo("prd-3");
        assertThat(payload.result().content()).isEqualTo("body");
        assertThat(payload.kind()).isEqualTo(DocumentKind.ProjectRequirements);
    }

    @Test
    void read_mapsFailureAliases() throws Exception {
        WebhookPayload payload = reader.read(json("""
                {"ideaId":"%s","document_type":"functional-requirements","status":"error","error":"model overloaded"}
                """.formatted(ideaId)), null);

        assertThat(payload.result().status()).isEqualTo(DocumentStatus.Failed);
        assertThat(payload.error()).isEqualTo("model overloaded");
        assertThat(payload.kind()).isEqualTo(DocumentKind.FunctionalRequirements);
    }

    @Test
    void read_gathersTopLevelCanvasSections() throws Exception {
        WebhookPayload payload = reader.read(json("""
                {"ideaId":"%s","project_id":"lc-9","problem":"Tools sit idle","solution":"Share them","keyMetrics":"Rentals/week"}
                """.formatted(ideaId)), DocumentKind.LeanCanvas);

        JsonNode sections = payload.result().sections();
        assertThat(sections.get("problem").asText()).isEqualTo("Tools sit idle");
        assertThat(sections.get("solution").asText()).isEqualTo("Share them");
        assertThat(sections.get("keyMetrics").asText()).isEqualTo("Rentals/week");
        assertThat(payload.result().externalId()).isEqualTo("lc-9");
    }

    @Test
    void read_rejectsMissingSubject() {
        assertThatThrownBy(() -> reader.read(json("{\"kind\":\"LeanCanvas\"}"), null))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
    }

    @Test
    void read_rejectsUnknownStatus() {
        assertThatThrownBy(() -> reader.read(json("""
                {"ideaId":"%s","kind":"LeanCanvas","status":"paused"}
                """.formatted(ideaId)), null))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("paused");
    }

    @Test
    void read_rejectsMissingKindOnGenericRoute() {
        assertThatThrownBy(() -> reader.read(json("{\"ideaId\":\"%s\"}".formatted(ideaId)), null))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("kind");
    }

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }
}
