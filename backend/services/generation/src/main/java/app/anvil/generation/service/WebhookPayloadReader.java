package app.anvil.generation.service;

import app.anvil.generation.domain.type.DocumentKind;
import app.anvil.generation.domain.type.DocumentStatus;
import app.anvil.generation.storage.DocumentResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Lenient reader for generator callbacks. Generators disagree on field names, so each value is
 * looked up under all of its known aliases.
 */
@Component
public class WebhookPayloadReader {

    static final List<String> SUBJECT_FIELDS = List.of("ideaId", "idea_id", "subject");
    static final List<String> KIND_FIELDS = List.of("kind", "documentType", "document_type");
    static final List<String> EXTERNAL_ID_FIELDS = List.of("externalId", "external_id", "correlationId");
    static final List<String> CANVAS_SECTIONS = List.of(
            "problem",
            "customerSegments",
            "uniqueValueProposition",
            "solution",
            "channels",
            "revenueStreams",
            "costStructure",
            "keyMetrics",
            "unfairAdvantage"
    );

    private static final Set<String> COMPLETED = Set.of("completed", "complete", "done", "success");
    private static final Set<String> FAILED = Set.of("failed", "error", "failure");

    private final ObjectMapper objectMapper;

    public WebhookPayloadReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public WebhookPayload read(JsonNode body, DocumentKind implicitKind) {
        if (body == null || !body.isObject()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Payload must be a JSON object");
        }
        UUID ideaId = uuid(first(body, SUBJECT_FIELDS))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "ideaId is missing or invalid"));
        DocumentKind kind = implicitKind != null ? implicitKind : DocumentKind.parse(first(body, KIND_FIELDS))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "kind is required"));
        DocumentStatus status = status(text(body, "status"));

        String externalId = first(body, EXTERNAL_ID_FIELDS);
        if (externalId == null) {
            externalId = kindSpecificId(body, kind);
        }
        String error = text(body, "error");
        UUID jobId = uuid(text(body, "jobId")).or(() -> uuid(text(body, "job_id"))).orElse(null);

        DocumentResult result = status == DocumentStatus.Failed
                ? DocumentResult.failed(externalId)
                : new DocumentResult(DocumentStatus.Completed, text(body, "html"), text(body, "content"), sections(body), externalId);
        return new WebhookPayload(ideaId, kind, result, jobId, error);
    }

    private DocumentStatus status(String raw) {
        if (raw == null) {
            return DocumentStatus.Completed;
        }
        String value = raw.toLowerCase(Locale.ROOT);
        if (COMPLETED.contains(value)) {
            return DocumentStatus.Completed;
        }
        if (FAILED.contains(value)) {
            return DocumentStatus.Failed;
        }
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown status: " + raw);
    }

    private JsonNode sections(JsonNode body) {
        JsonNode sections = body.get("sections");
        if (sections != null && sections.isObject()) {
            return sections;
        }
        ObjectNode gathered = objectMapper.createObjectNode();
        for (String field : CANVAS_SECTIONS) {
            String value = text(body, field);
            if (value != null) {
                gathered.put(field, value);
            }
        }
        return gathered.isEmpty() ? null : gathered;
    }

    private static String kindSpecificId(JsonNode body, DocumentKind kind) {
        if (kind.correlationKey() != null) {
            String value = text(body, kind.correlationKey());
            if (value != null) {
                return value;
            }
        }
        return kind == DocumentKind.LeanCanvas ? text(body, "project_id") : null;
    }

    private static String first(JsonNode body, List<String> fields) {
        for (String field : fields) {
            String value = text(body, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static Optional<UUID> uuid(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
