package app.anvil.generation.client.recordstore;

import app.anvil.generation.domain.type.DocumentKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Where finished artifacts land when a generator writes them straight to the system of record.
 */
@ConfigurationProperties(prefix = "app.record-store")
public record RecordStoreProps(
        String baseUrl,
        String apiKey,
        Map<DocumentKind, Table> tables
) {
    public RecordStoreProps {
        Map<DocumentKind, Table> merged = new EnumMap<>(DocumentKind.class);
        merged.put(DocumentKind.ProjectRequirements, new Table("prd", "project_req_html", null));
        merged.put(DocumentKind.BusinessRequirements, new Table("brd", "brd_html", null));
        merged.put(DocumentKind.FunctionalRequirements, new Table("frd", "frd_html", null));
        if (tables != null) {
            merged.putAll(tables);
        }
        tables = Map.copyOf(merged);
    }

    public boolean configured() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    public record Table(
            String name,
            String htmlColumn,
            String contentColumn
    ) {
    }
}
