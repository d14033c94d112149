package app.anvil.generation.config;

import app.anvil.generation.domain.type.DocumentKind;
import org.springframework.core.convert.converter.Converter;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/**
 * Path and query binding for document kinds; accepts the enum name or its slug.
 */
@Component
public class DocumentKindConverter implements Converter<String, DocumentKind> {

    @Override
    public DocumentKind convert(String source) {
        return DocumentKind.parse(source)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown document kind: " + source));
    }
}
