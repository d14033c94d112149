package app.anvil.generation.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.webhook")
public record WebhookProps(
        String secret,
        String username,
        String password,
        String secretHeader
) {
    public WebhookProps {
        if (secretHeader == null || secretHeader.isBlank()) {
            secretHeader = "X-Webhook-Secret";
        }
    }

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }

    public boolean hasBasicCredentials() {
        return username != null && !username.isBlank() && password != null && !password.isBlank();
    }
}
