package app.anvil.generation.domain.type;

import java.util.Locale;
import java.util.Optional;

public enum DocumentKind {
    LeanCanvas("canvas", "Lean Canvas", "leancanvas_id"),
    ProjectRequirements("requirements", "Project Requirements", "prd_id"),
    BusinessRequirements("business-requirements", "Business Requirements", "brd_id"),
    FunctionalRequirements("functional-requirements", "Functional Requirements", "frd_id"),
    Workflows("workflows", "Workflows", null);

    private final String slug;
    private final String title;
    private final String correlationKey;

    DocumentKind(String slug, String title, String correlationKey) {
        this.slug = slug;
        this.title = title;
        this.correlationKey = correlationKey;
    }

    public String slug() {
        return slug;
    }

    public String title() {
        return title;
    }

    /**
     * Payload key under which generators exchange this kind's external id, or null when
     * downstream generators never ask for it.
     */
    public String correlationKey() {
        return correlationKey;
    }

    public static Optional<DocumentKind> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (DocumentKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value) || kind.slug.equals(value.toLowerCase(Locale.ROOT))) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
