package app.anvil.generation.security;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Shared-secret check for generator callbacks: either the secret header or Basic credentials.
 * With nothing configured every request is rejected.
 */
@Component
public class WebhookAuthenticator {

    private final WebhookProps props;

    public WebhookAuthenticator(WebhookProps props) {
        this.props = props;
    }

    public boolean authenticate(HttpServletRequest request) {
        if (props.hasSecret()) {
            String provided = request.getHeader(props.secretHeader());
            if (provided != null && constantTimeEquals(provided, props.secret())) {
                return true;
            }
        }
        if (props.hasBasicCredentials()) {
            return basicMatches(request.getHeader(HttpHeaders.AUTHORIZATION));
        }
        return false;
    }

    private boolean basicMatches(String header) {
        if (header == null || !header.regionMatches(true, 0, "Basic ", 0, 6)) {
            return false;
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(header.substring(6).trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return false;
        }
        int separator = decoded.indexOf(':');
        if (separator < 0) {
            return false;
        }
        boolean userMatches = constantTimeEquals(decoded.substring(0, separator), props.username());
        boolean passwordMatches = constantTimeEquals(decoded.substring(separator + 1), props.password());
        return userMatches & passwordMatches;
    }

    private static boolean constantTimeEquals(String provided, String expected) {
        return MessageDigest.isEqual(
                provided.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8)
        );
    }
}
