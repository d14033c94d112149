package app.anvil.generation.client.generator;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Holds one bearer token and fetches a new one when the cached value is within five minutes of
 * expiring.
 */
public class AccessTokenCache {

    static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);

    private final Supplier<String> login;
    private final Duration lifetime;
    private CachedToken token;

    public AccessTokenCache(Supplier<String> login, Duration lifetime) {
        this.login = login;
        this.lifetime = lifetime;
    }

    public synchronized String getOrRefresh(Instant now) {
        if (token != null && now.isBefore(token.expiresAt().minus(REFRESH_MARGIN))) {
            return token.value();
        }
        String value = login.get();
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Login response missing access_token");
        }
        token = new CachedToken(value, now.plus(lifetime));
        return value;
    }

    public synchronized void invalidate() {
        token = null;
    }

    record CachedToken(String value, Instant expiresAt) {
    }
}
