package app.anvil.generation.security;

import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class CurrentTenantProvider {

    public Optional<UUID> getTenantId(Jwt jwt) {
        if (jwt == null) {
            return Optional.empty();
        }
        String claim = jwt.getClaimAsString("user_id");
        if (claim == null || claim.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(claim.trim()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    public UUID requireTenantId(Jwt jwt) {
        return getTenantId(jwt)
                .orElseThrow(() -> new IllegalStateException("user_id claim missing"));
    }
}
